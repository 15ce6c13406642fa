package com.puzzlenft.puzzleservice.exception;

/**
 * Every way a puzzle operation can be rejected
 */
public enum PuzzleErrorCode {
    INCORRECT_SOLUTION("The provided solution is incorrect"),
    PUZZLE_NOT_FOUND("Puzzle not found in NFT attributes"),
    ATTRIBUTE_NOT_FOUND("Attribute not found"),
    NOT_NFT_OWNER("Only the NFT owner can attempt to solve the puzzle"),
    ALREADY_SOLVED("NFT has already been solved"),
    INVALID_PUZZLE_TYPE("Invalid puzzle type"),
    FAILED_TO_PARSE_PUZZLE_DATA("Failed to parse puzzle data"),
    INVALID_ASSET_DATA("Invalid asset data"),
    UNAUTHORIZED_UPDATE("Unauthorized update attempt"),
    INVALID_COLLECTION_AUTHORITY("Invalid collection authority");

    private final String message;

    PuzzleErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
