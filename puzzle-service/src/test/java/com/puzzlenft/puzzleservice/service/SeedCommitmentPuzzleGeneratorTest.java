package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;
import com.puzzlenft.puzzleservice.model.CommitmentScheme;
import com.puzzlenft.puzzleservice.model.EntropySnapshot;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.PuzzleInstance;
import com.puzzlenft.puzzleservice.model.PuzzleType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeedCommitmentPuzzleGeneratorTest {

    private static final Identity MINTER = Identity.fromHex("22".repeat(32));

    private final SeedCommitmentPuzzleGenerator generator = new SeedCommitmentPuzzleGenerator();

    @Test
    void testSeedDrivesTypeAndCommitment() {
        for (long slot = 0; slot < 200; slot++) {
            PuzzleInstance puzzle = generator.generate(MINTER, 0, 1, new EntropySnapshot(slot, 0));
            byte[] seed = PuzzleHashing.sha256(MINTER.toBytes(), PuzzleHashing.bigEndian(slot));

            assertEquals(CommitmentScheme.SEED_PREFIX, puzzle.getScheme());
            assertEquals(PuzzleHashing.toHex(seed), puzzle.getPuzzleHash());
            if ((seed[0] & 0xff) % 2 == 0) {
                assertEquals(PuzzleType.MATH_FACTOR, puzzle.getPuzzleType());
                long number = puzzle.getPuzzleNumber();
                assertTrue(number >= 20 && number <= 108 && number % 2 == 0, "number " + number);
            } else {
                assertEquals(PuzzleType.HASH_RIDDLE, puzzle.getPuzzleType());
                assertNull(puzzle.getPuzzleNumber());
                assertEquals(puzzle.getPuzzleHash().substring(0, 8), puzzle.getSolutionHash());
            }
        }
    }

    @Test
    void testDifferentMintersGetDifferentSeeds() {
        EntropySnapshot entropy = new EntropySnapshot(42, 0);
        PuzzleInstance a = generator.generate(MINTER, 0, 1, entropy);
        PuzzleInstance b = generator.generate(Identity.fromHex("33".repeat(32)), 0, 1, entropy);
        assertNotEquals(a.getPuzzleHash(), b.getPuzzleHash());
    }

    @Test
    void testUnknownSelectorRejected() {
        PuzzleException e = assertThrows(PuzzleException.class,
                () -> generator.generate(MINTER, 9, 1, new EntropySnapshot(42, 0)));
        assertEquals(PuzzleErrorCode.INVALID_PUZZLE_TYPE, e.getErrorCode());
    }
}
