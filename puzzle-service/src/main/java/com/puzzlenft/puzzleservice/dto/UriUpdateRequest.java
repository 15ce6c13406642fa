package com.puzzlenft.puzzleservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UriUpdateRequest {
    @NotBlank
    @Size(max = 500)
    private String uri;
}
