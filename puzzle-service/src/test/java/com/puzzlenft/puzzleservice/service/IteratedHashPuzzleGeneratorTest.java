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

class IteratedHashPuzzleGeneratorTest {

    private static final Identity MINTER = Identity.fromHex("11".repeat(32));

    private final IteratedHashPuzzleGenerator generator = new IteratedHashPuzzleGenerator();

    @Test
    void testMathFactorAtSlot42() {
        PuzzleInstance puzzle = generator.generate(MINTER, 0, 1, new EntropySnapshot(42, 1_700_000_000L));

        // ((42 % 1000) + 1) * 2 + 100
        assertEquals(186L, puzzle.getPuzzleNumber());
        assertEquals(PuzzleType.MATH_FACTOR, puzzle.getPuzzleType());
        assertEquals(CommitmentScheme.ITERATED_HASH, puzzle.getScheme());
        assertEquals("54cef7", puzzle.getSolutionHash());
        assertEquals(42L, puzzle.getMintSlot());
        assertEquals(1, puzzle.getDifficulty());
        assertFalse(puzzle.isSolved());
        assertNull(puzzle.getSolver());
        assertNull(puzzle.getSolvedAt());
        assertNull(puzzle.getRarity());
    }

    @Test
    void testTypeShiftsNumber() {
        EntropySnapshot entropy = new EntropySnapshot(42, 0);
        assertEquals(286L, generator.generate(MINTER, 1, 1, entropy).getPuzzleNumber());
        assertEquals(386L, generator.generate(MINTER, 2, 1, entropy).getPuzzleNumber());
    }

    @Test
    void testSlotWrapsAtOneThousand() {
        assertEquals(1300L, generator.generate(MINTER, 2, 0, new EntropySnapshot(1999, 0)).getPuzzleNumber());
        assertEquals(101L, generator.generate(MINTER, 0, 0, new EntropySnapshot(5000, 0)).getPuzzleNumber());
    }

    @Test
    void testDeterministic() {
        EntropySnapshot entropy = new EntropySnapshot(777, 123);
        assertEquals(generator.generate(MINTER, 1, 3, entropy), generator.generate(MINTER, 1, 3, entropy));
    }

    @Test
    void testUnknownSelectorRejected() {
        PuzzleException e = assertThrows(PuzzleException.class,
                () -> generator.generate(MINTER, 3, 1, new EntropySnapshot(42, 0)));
        assertEquals(PuzzleErrorCode.INVALID_PUZZLE_TYPE, e.getErrorCode());
    }
}
