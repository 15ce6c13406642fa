package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.model.Rarity;
import org.springframework.stereotype.Component;

/**
 * Buckets a solve into a rarity tier from its timestamp.
 * <p>
 * The submitter can observe and steer the timestamp, so tiers are not fair against an adversary.
 */
@Component
public class RarityAssigner {

    public Rarity assign(long timestamp) {
        long bucket = Math.floorMod(timestamp, 100L);
        if (bucket < 10) return Rarity.LEGENDARY;
        if (bucket < 30) return Rarity.EPIC;
        if (bucket < 60) return Rarity.RARE;
        return Rarity.COMMON;
    }
}
