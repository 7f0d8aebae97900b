package com.critter.controller;

import com.critter.dto.CreatureDTO;
import com.critter.dto.ExperienceRequest;
import com.critter.dto.ProgressionResult;
import com.critter.service.ProgressionService;
import com.critter.service.TrainerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/creatures")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CreatureController {

    private final TrainerService trainerService;
    private final ProgressionService progressionService;

    @GetMapping("/{creatureId}")
    public ResponseEntity<CreatureDTO> getCreature(@PathVariable String creatureId) {
        return ResponseEntity.ok(trainerService.getCreature(creatureId));
    }

    /**
     * Grant experience; levels up and evolves as thresholds are crossed.
     */
    @PostMapping("/{creatureId}/experience")
    public ResponseEntity<ProgressionResult> awardExperience(@PathVariable String creatureId,
                                                             @Valid @RequestBody ExperienceRequest request) {
        return ResponseEntity.ok(progressionService.awardExperience(creatureId, request.getAmount()));
    }
}
