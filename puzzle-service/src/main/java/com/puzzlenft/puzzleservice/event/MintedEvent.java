package com.puzzlenft.puzzleservice.event;

import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.model.PuzzleType;
import lombok.Value;

/**
 * Emitted when an asset is minted with a fresh puzzle
 */
@Value
public class MintedEvent {
    String assetId;
    PuzzleType puzzleType;
    Long puzzleNumber;
    Identity minter;
}
