package com.puzzlenft.puzzleservice.model;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of an asset as read from the ledger: who owns it, who may update it, its URI and
 * its attribute list. {@code holding} is only set when ownership is also tracked by a holding token.
 */
@Value
@Builder
public class AssetRecord {
    String assetId;
    Identity owner;
    Identity updateAuthority;
    String uri;
    AttributeList attributes;
    HoldingRecord holding;
}
