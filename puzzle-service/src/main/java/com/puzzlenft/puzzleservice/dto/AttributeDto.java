package com.puzzlenft.puzzleservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttributeDto {
    @NotBlank
    @Size(max = 64)
    private String key;
    @NotNull
    @Size(max = 256)
    private String value;
}
