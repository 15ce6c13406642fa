package com.puzzlenft.puzzleservice.controller;

import com.puzzlenft.puzzleservice.dto.ErrorResponse;
import com.puzzlenft.puzzleservice.exception.AssetNotFoundException;
import com.puzzlenft.puzzleservice.exception.PuzzleErrorCode;
import com.puzzlenft.puzzleservice.exception.PuzzleException;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Turns rejections into {@code {error, message}} bodies
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PuzzleException.class)
    public ResponseEntity<ErrorResponse> handlePuzzle(PuzzleException e) {
        return ResponseEntity.status(statusFor(e.getErrorCode()))
                .body(new ErrorResponse(e.getErrorCode().name(), e.getMessage()));
    }

    @ExceptionHandler(AssetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AssetNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleStale(ObjectOptimisticLockingFailureException e) {
        log.warn("Rejected write against stale asset state: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("STALE_ASSET_STATE", "Asset changed concurrently, re-read and retry"));
    }

    @ExceptionHandler({JwtException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleUnauthenticated(Exception e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse("UNAUTHENTICATED", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    static HttpStatus statusFor(PuzzleErrorCode code) {
        return switch (code) {
            case INVALID_PUZZLE_TYPE -> HttpStatus.BAD_REQUEST;
            case NOT_NFT_OWNER, UNAUTHORIZED_UPDATE, INVALID_COLLECTION_AUTHORITY -> HttpStatus.FORBIDDEN;
            case ALREADY_SOLVED -> HttpStatus.CONFLICT;
            case INCORRECT_SOLUTION, PUZZLE_NOT_FOUND, ATTRIBUTE_NOT_FOUND,
                    FAILED_TO_PARSE_PUZZLE_DATA, INVALID_ASSET_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
