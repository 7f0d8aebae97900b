package com.critter.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.critter.dto.ExperienceRequest;
import com.critter.dto.ProgressionResult;
import com.critter.service.ProgressionService;
import com.critter.service.TrainerService;

@ExtendWith(MockitoExtension.class)
class CreatureControllerTest {

    @Mock private TrainerService trainerService;
    @Mock private ProgressionService progressionService;

    @InjectMocks
    private CreatureController controller;

    private ProgressionResult applied() {
        return ProgressionResult.builder()
                .outcome(ProgressionResult.Outcome.APPLIED)
                .subjectId("c-1")
                .levelBefore(5)
                .levelAfter(6)
                .evolutions(List.of())
                .build();
    }

    @Test
    @DisplayName("should grant experience and return the progression result")
    void shouldAwardExperience() {
        when(progressionService.awardExperience("c-1", 50L)).thenReturn(applied());

        ProgressionResult result = controller.awardExperience("c-1", new ExperienceRequest(50L)).getBody();

        assertEquals(ProgressionResult.Outcome.APPLIED, result.getOutcome());
        assertEquals(6, result.getLevelAfter());
    }
}
