package com.critter.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainerRequest {

    @NotNull(message = "User id is required")
    private Long userId;

    @Size(max = 64, message = "Display name must be at most 64 characters")
    private String displayName;
}
