package com.puzzlenft.puzzleservice.model;

import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;

/**
 * Types of puzzles an asset can carry
 */
public enum PuzzleType {
    /**
     * Find any divisor of the published puzzle number
     */
    MATH_FACTOR(0, "math_factor"),

    /**
     * Find a number whose commitment matches the stored hash
     */
    HASH_RIDDLE(1, "hash_riddle"),

    /**
     * Find the value behind a stored pattern commitment
     */
    PATTERN(2, "pattern");

    private final int selector;
    private final String wireName;

    PuzzleType(int selector, String wireName) {
        this.selector = selector;
        this.wireName = wireName;
    }

    public int getSelector() {
        return selector;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve the numeric selector sent with a mint request.
     */
    public static PuzzleType fromSelector(int selector) {
        for (PuzzleType type : values()) {
            if (type.selector == selector) {
                return type;
            }
        }
        throw new PuzzleException(PuzzleErrorCode.INVALID_PUZZLE_TYPE, "Unknown puzzle type selector: " + selector);
    }

    /**
     * Resolve the name stored in the {@code puzzle_type} attribute.
     */
    public static PuzzleType fromWireName(String wireName) {
        for (PuzzleType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new PuzzleException(PuzzleErrorCode.INVALID_PUZZLE_TYPE, "Unknown puzzle type: " + wireName);
    }
}
