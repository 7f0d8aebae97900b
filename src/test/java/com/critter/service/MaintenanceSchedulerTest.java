package com.critter.service;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.critter.coordination.CoordinationStore;
import com.critter.exception.StoreUnavailableException;

/**
 * Unit tests for the maintenance sweep.
 */
@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    @Mock private SpawnService spawnService;
    @Mock private BattleService battleService;
    @Mock private TradeService tradeService;
    @Mock private CoordinationStore coordinationStore;

    @InjectMocks
    private MaintenanceScheduler scheduler;

    @Test
    @DisplayName("a failing step should not stop the rest of the sweep")
    void shouldContinueAfterFailure() {
        when(spawnService.expireOverdueSpawns())
                .thenThrow(new StoreUnavailableException("Redis unreachable", new RuntimeException()));

        scheduler.sweep();

        verify(battleService).timeOutInactiveBattles();
        verify(tradeService).expireOverdueTrades();
        verify(coordinationStore).sweepExpired();
    }
}
