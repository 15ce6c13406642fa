package com.puzzlenft.puzzleservice.config;

import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.service.IteratedHashPuzzleGenerator;
import com.puzzlenft.puzzleservice.service.PuzzleHashing;
import com.puzzlenft.puzzleservice.service.SeedCommitmentPuzzleGenerator;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PuzzleEngineConfigTest {

    private final PuzzleEngineConfig config = new PuzzleEngineConfig();

    @Test
    void testDerivedAuthorityIsStable() {
        Identity first = PuzzleEngineConfig.deriveAuthority("puzzle-nft", "authority");
        Identity second = PuzzleEngineConfig.deriveAuthority("puzzle-nft", "authority");

        assertEquals(first, second);
        assertNotEquals(first, PuzzleEngineConfig.deriveAuthority("other-program", "authority"));
        assertNotEquals(first, PuzzleEngineConfig.deriveAuthority("puzzle-nft", "other-seed"));
    }

    @Test
    void testDerivedAuthorityIsProgramIdThenSeedDigest() {
        byte[] digest = PuzzleHashing.sha256("puzzle-nftauthority".getBytes(StandardCharsets.UTF_8));
        assertEquals(Identity.of(digest), PuzzleEngineConfig.deriveAuthority("puzzle-nft", "authority"));
    }

    @Test
    void testConfiguredAuthorityWins() {
        PuzzleProperties properties = new PuzzleProperties();
        properties.getAuthority().setIdentity("cd".repeat(32));
        assertEquals(Identity.fromHex("cd".repeat(32)), config.updateAuthority(properties).getIdentity());

        properties.getAuthority().setIdentity("");
        assertEquals(PuzzleEngineConfig.deriveAuthority("puzzle-nft", "authority"),
                config.updateAuthority(properties).getIdentity());
    }

    @Test
    void testGeneratorVariant() {
        PuzzleProperties properties = new PuzzleProperties();
        assertInstanceOf(IteratedHashPuzzleGenerator.class, config.puzzleGenerator(properties));

        properties.getGenerator().setVariant(PuzzleProperties.GeneratorVariant.SEED_COMMITMENT);
        assertInstanceOf(SeedCommitmentPuzzleGenerator.class, config.puzzleGenerator(properties));
    }
}
