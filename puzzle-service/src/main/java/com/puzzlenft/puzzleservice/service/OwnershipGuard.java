package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.model.AssetRecord;
import com.puzzlenft.puzzleservice.model.HoldingRecord;
import com.puzzlenft.puzzleservice.model.Identity;
import org.springframework.stereotype.Component;

/**
 * Ownership and update-authority checks. Both return false on mismatch; callers pick the error.
 */
@Component
public class OwnershipGuard {

    /**
     * Owner check against the asset's recorded owner.
     */
    public boolean verifyOwner(Identity claimed, AssetRecord asset) {
        return claimed != null && claimed.equals(asset.getOwner());
    }

    /**
     * Owner check that also requires the claimant to hold at least one holding token for this asset.
     */
    public boolean verifyOwner(Identity claimed, AssetRecord asset, HoldingRecord holding) {
        if (!verifyOwner(claimed, asset)) {
            return false;
        }
        if (holding == null || !claimed.equals(holding.getHolder())) {
            return false;
        }
        if (holding.getAmount() < 1) {
            return false;
        }
        return asset.getAssetId() != null && asset.getAssetId().equals(holding.getAssetId());
    }

    /**
     * Metadata-only updates (URI changes) need the asset's update authority, not ownership.
     */
    public boolean verifyUpdateAuthority(Identity caller, AssetRecord asset) {
        return caller != null && caller.equals(asset.getUpdateAuthority());
    }
}
