package com.puzzlenft.puzzleservice.model;

import lombok.Builder;
import lombok.Value;

/**
 * Typed view of the puzzle stored in an asset's attributes.
 * Type, difficulty, commitment and mint slot never change after creation; the solve fields
 * are either all absent (unsolved) or all present (solved).
 */
@Value
@Builder(toBuilder = true)
public class PuzzleInstance {
    PuzzleType puzzleType;
    int difficulty;
    CommitmentScheme scheme;
    Long puzzleNumber;  // absent for seed-prefix hash riddles
    String puzzleHash;  // seed hash, only for SEED_PREFIX
    String solutionHash;
    long mintSlot;
    boolean solved;
    Identity solver;
    Long solution;
    Long solvedAt;
    Rarity rarity;

    /**
     * Copy of this puzzle moved to its terminal state.
     */
    public PuzzleInstance markSolved(Identity solver, long solution, long solvedAt, Rarity rarity) {
        return toBuilder()
                .solved(true)
                .solver(solver)
                .solution(solution)
                .solvedAt(solvedAt)
                .rarity(rarity)
                .build();
    }
}
