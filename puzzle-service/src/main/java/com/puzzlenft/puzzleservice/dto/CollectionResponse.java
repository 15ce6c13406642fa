package com.puzzlenft.puzzleservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class CollectionResponse {
    private String id;
    private String name;
    private String uri;
    private String updateAuthority;
    private String createdBy;
    private Instant createdAt;
}
