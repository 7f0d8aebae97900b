package com.critter.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for granting experience to a creature outside of battle.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExperienceRequest {

    @Min(value = 0, message = "Experience amount must not be negative")
    private long amount;
}
