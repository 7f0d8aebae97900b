package com.critter.service;

import com.critter.coordination.CoordinationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.function.IntSupplier;

/**
 * Periodic sweep of overdue spawns, battles and trades, plus expired coordination keys.
 * Reads apply the same expiry lazily; the sweep only keeps storage tidy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaintenanceScheduler {

    private final SpawnService spawnService;
    private final BattleService battleService;
    private final TradeService tradeService;
    private final CoordinationStore coordinationStore;

    @Scheduled(fixedDelayString = "${game.coordination.sweep-interval:PT1M}",
            initialDelayString = "${game.coordination.sweep-interval:PT1M}")
    public void sweep() {
        run("spawns", spawnService::expireOverdueSpawns);
        run("battles", battleService::timeOutInactiveBattles);
        run("trades", tradeService::expireOverdueTrades);
        run("coordination keys", coordinationStore::sweepExpired);
    }

    private void run(String what, IntSupplier step) {
        try {
            int count = step.getAsInt();
            if (count > 0) {
                log.debug("Sweep closed {} {}", count, what);
            }
        } catch (RuntimeException e) {
            log.error("Sweep of {} failed", what, e);
        }
    }
}
