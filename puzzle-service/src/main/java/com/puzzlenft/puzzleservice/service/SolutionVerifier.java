package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;
import com.puzzlenft.puzzleservice.model.PuzzleInstance;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Checks a candidate solution against a puzzle's stored commitment
 */
@Component
public class SolutionVerifier {

    /**
     * @return true when {@code solution} solves {@code puzzle}
     * @throws PuzzleException INVALID_PUZZLE_TYPE if the puzzle has no recognised type
     */
    public boolean verify(PuzzleInstance puzzle, long solution) {
        if (puzzle.getPuzzleType() == null) {
            throw new PuzzleException(PuzzleErrorCode.INVALID_PUZZLE_TYPE, "puzzle has no type");
        }
        return switch (puzzle.getPuzzleType()) {
            case MATH_FACTOR -> verifyFactor(puzzle, solution);
            case HASH_RIDDLE, PATTERN -> verifyCommitment(puzzle, solution);
        };
    }

    /**
     * Any divisor is accepted, including 1 and the number itself.
     */
    private boolean verifyFactor(PuzzleInstance puzzle, long solution) {
        Long number = puzzle.getPuzzleNumber();
        if (number == null) {
            throw new PuzzleException(PuzzleErrorCode.PUZZLE_NOT_FOUND, "math factor puzzle without a number");
        }
        return solution > 0 && number % solution == 0;
    }

    private boolean verifyCommitment(PuzzleInstance puzzle, long solution) {
        return switch (puzzle.getScheme()) {
            case ITERATED_HASH -> PuzzleHashing.iteratedHash(solution).equals(puzzle.getSolutionHash());
            case SEED_PREFIX -> verifySeedPrefix(puzzle, solution);
        };
    }

    private boolean verifySeedPrefix(PuzzleInstance puzzle, long solution) {
        byte[] expected = PuzzleHashing.fromHex(puzzle.getPuzzleHash());
        byte[] candidate = PuzzleHashing.sha256(PuzzleHashing.littleEndian(solution));
        int n = PuzzleHashing.SEED_PREFIX_LENGTH;
        return Arrays.equals(candidate, 0, n, expected, 0, n);
    }
}
