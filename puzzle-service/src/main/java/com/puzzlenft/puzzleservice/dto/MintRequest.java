package com.puzzlenft.puzzleservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MintRequest {
    @NotBlank
    @Size(max = 100)
    private String name;

    @NotBlank
    @Size(max = 500)
    private String uri;

    @NotNull
    private Integer puzzleType; // 0 math_factor, 1 hash_riddle, 2 pattern

    @NotNull
    @Min(0)
    @Max(255)
    private Integer difficulty;

    private String collectionId;

    @Valid
    private List<AttributeDto> attributes = new ArrayList<>(); // extra metadata, appended after the puzzle keys
}
