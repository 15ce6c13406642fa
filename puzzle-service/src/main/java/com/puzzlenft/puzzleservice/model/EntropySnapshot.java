package com.puzzlenft.puzzleservice.model;

import lombok.Value;

/**
 * Slot counter and unix timestamp (seconds) observed at the moment of a request.
 * Not a secure randomness source.
 */
@Value
public class EntropySnapshot {
    long slot;
    long timestamp;
}
