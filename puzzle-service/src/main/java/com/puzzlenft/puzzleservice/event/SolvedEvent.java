package com.puzzlenft.puzzleservice.event;

import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.Rarity;
import lombok.Value;

/**
 * Emitted when an asset's puzzle is solved
 */
@Value
public class SolvedEvent {
    String assetId;
    Identity solver;
    long solveTimestamp;
    Rarity rarity;
}
