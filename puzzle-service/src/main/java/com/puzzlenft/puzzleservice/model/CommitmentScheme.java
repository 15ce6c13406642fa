package com.puzzlenft.puzzleservice.model;

/**
 * How a puzzle's solution commitment was derived, and therefore how candidates are checked.
 */
public enum CommitmentScheme {
    /**
     * {@code solution_hash} is three rounds of {@code x -> x * 31 + 17} over the answer, in hex.
     * Puzzle number comes from the mint slot, difficulty and type.
     */
    ITERATED_HASH,

    /**
     * {@code puzzle_hash} is SHA-256 of the minter identity and mint slot; hash riddles are solved
     * by any number whose SHA-256 shares the first four bytes of that seed.
     */
    SEED_PREFIX
}
