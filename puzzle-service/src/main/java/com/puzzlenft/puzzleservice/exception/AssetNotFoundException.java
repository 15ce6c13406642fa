package com.puzzlenft.puzzleservice.exception;

public class AssetNotFoundException extends RuntimeException {

    public AssetNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
