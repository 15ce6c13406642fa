package com.puzzlenft.puzzleservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SolveRequest {
    @NotNull
    private Long solution;

    @Size(max = 500)
    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String newUri; // optional, null keeps the current URI
}
