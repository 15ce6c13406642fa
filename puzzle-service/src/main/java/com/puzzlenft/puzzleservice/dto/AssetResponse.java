package com.puzzlenft.puzzleservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class AssetResponse {
    private String id;
    private String collectionId;
    private String name;
    private String uri;
    private String owner;
    private String updateAuthority;
    private List<AttributeDto> attributes;
    private Instant createdAt;
    private Instant updatedAt;
}
