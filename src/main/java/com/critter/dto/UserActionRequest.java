package com.critter.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO carrying the acting user for commands with no other payload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserActionRequest {

    @NotNull(message = "User id is required")
    private Long userId;
}
