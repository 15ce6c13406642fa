package com.puzzlenft.puzzleservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CollectionRequest {
    @Size(max = 100)
    private String name; // defaults from configuration when absent

    @Size(max = 500)
    private String uri;
}
