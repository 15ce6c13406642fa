package com.puzzlenft.puzzleservice.config;

import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.UpdateAuthority;
import com.puzzlenft.puzzleservice.service.EntropySource;
import com.puzzlenft.puzzleservice.service.IteratedHashPuzzleGenerator;
import com.puzzlenft.puzzleservice.service.PuzzleGenerator;
import com.puzzlenft.puzzleservice.service.PuzzleHashing;
import com.puzzlenft.puzzleservice.service.SeedCommitmentPuzzleGenerator;
import com.puzzlenft.puzzleservice.service.SystemEntropySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Wires the pieces of the puzzle engine that depend on configuration
 */
@Slf4j
@Configuration
public class PuzzleEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EntropySource entropySource(Clock clock, PuzzleProperties properties) {
        PuzzleProperties.Entropy entropy = properties.getEntropy();
        return new SystemEntropySource(clock, entropy.getGenesis(), entropy.getSlotDuration());
    }

    @Bean
    public PuzzleGenerator puzzleGenerator(PuzzleProperties properties) {
        PuzzleProperties.GeneratorVariant variant = properties.getGenerator().getVariant();
        log.info("Using {} puzzle generator", variant);
        return switch (variant) {
            case ITERATED_HASH -> new IteratedHashPuzzleGenerator();
            case SEED_COMMITMENT -> new SeedCommitmentPuzzleGenerator();
        };
    }

    /**
     * The program's update authority. Either configured explicitly or derived as
     * {@code SHA-256(programId || seed)}.
     */
    @Bean
    public UpdateAuthority updateAuthority(PuzzleProperties properties) {
        String configured = properties.getAuthority().getIdentity();
        Identity identity = configured != null && !configured.isBlank()
                ? Identity.fromHex(configured)
                : deriveAuthority(properties.getProgramId(), properties.getAuthority().getSeed());
        log.info("Program {} update authority: {}", properties.getProgramId(), identity);
        return new UpdateAuthority(identity);
    }

    static Identity deriveAuthority(String programId, String seed) {
        return Identity.of(PuzzleHashing.sha256(
                programId.getBytes(StandardCharsets.UTF_8),
                seed.getBytes(StandardCharsets.UTF_8)));
    }
}
