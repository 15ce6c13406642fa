package com.puzzlenft.puzzleservice.model;

import lombok.Value;

/**
 * Balance of an asset's holding token for one holder.
 */
@Value
public class HoldingRecord {
    Identity holder;
    String assetId;
    long amount;
}
