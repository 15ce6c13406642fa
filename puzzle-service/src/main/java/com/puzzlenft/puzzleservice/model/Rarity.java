package com.puzzlenft.puzzleservice.model;

import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;

/**
 * Rarity tier stamped on an asset when its puzzle is solved
 */
public enum Rarity {
    LEGENDARY("Legendary"),
    EPIC("Epic"),
    RARE("Rare"),
    COMMON("Common");

    private final String displayName;

    Rarity(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Rarity fromDisplayName(String displayName) {
        for (Rarity rarity : values()) {
            if (rarity.displayName.equals(displayName)) {
                return rarity;
            }
        }
        throw new PuzzleException(PuzzleErrorCode.FAILED_TO_PARSE_PUZZLE_DATA, "Unknown rarity: " + displayName);
    }
}
