package com.puzzlenft.puzzleservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MintResponse {
    private String assetId;
    private String puzzleType;
    private Long puzzleNumber; // null for seed-prefix hash riddles
    private String minter;
    private AssetResponse asset;
}
