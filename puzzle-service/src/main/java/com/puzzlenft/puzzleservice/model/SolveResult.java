package com.puzzlenft.puzzleservice.model;

import com.puzzlenft.puzzleservice.event.SolvedEvent;
import lombok.Value;

/**
 * Complete outcome of an accepted solve: the attribute list to persist, the new URI if one was
 * supplied, and the event to emit.
 */
@Value
public class SolveResult {
    PuzzleInstance puzzle;
    AttributeList attributes;
    String newUri;
    SolvedEvent event;
}
