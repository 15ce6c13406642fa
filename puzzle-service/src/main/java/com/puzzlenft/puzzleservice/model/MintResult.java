package com.puzzlenft.puzzleservice.model;

import com.puzzlenft.puzzleservice.event.MintedEvent;
import lombok.Value;

/**
 * Attribute list to persist for a new asset and the event describing it
 */
@Value
public class MintResult {
    PuzzleInstance puzzle;
    AttributeList attributes;
    MintedEvent event;
}
