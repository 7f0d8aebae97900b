package com.critter.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TeamRequest {

    @NotNull(message = "Creature ids are required")
    @Size(max = 6, message = "A team holds at most 6 creatures")
    private List<String> creatureIds;
}
