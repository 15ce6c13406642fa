package com.puzzlenft.puzzleservice.exception;

/**
 * Rejection of a puzzle operation. Nothing has been persisted when this is thrown.
 */
public class PuzzleException extends RuntimeException {

    private final PuzzleErrorCode errorCode;

    public PuzzleException(PuzzleErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public PuzzleException(PuzzleErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + ": " + detail);
        this.errorCode = errorCode;
    }

    public PuzzleException(PuzzleErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.getMessage() + ": " + detail, cause);
        this.errorCode = errorCode;
    }

    public PuzzleErrorCode getErrorCode() {
        return errorCode;
    }
}
