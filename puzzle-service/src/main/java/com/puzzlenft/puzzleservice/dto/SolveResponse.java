package com.puzzlenft.puzzleservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SolveResponse {
    private String assetId;
    private String solver;
    private long solveTimestamp;
    private String rarity;
    private AssetResponse asset;
}
