package com.critter.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.critter.dto.ClaimResult;
import com.critter.dto.TradeOfferRequest;
import com.critter.dto.TradeResult;
import com.critter.model.TradeStatus;
import com.critter.repository.CreatureRepository;
import com.critter.repository.TrainerRepository;
import com.critter.service.SpawnService;
import com.critter.service.TradeService;
import com.critter.service.TrainerService;

/**
 * Trade escrow end to end: catch, propose, counter, confirm, against the real database.
 */
@SpringBootTest
class TradeSettlementIntegrationTest {

    @Autowired private SpawnService spawnService;
    @Autowired private TradeService tradeService;
    @Autowired private TrainerService trainerService;
    @Autowired private TrainerRepository trainerRepository;
    @Autowired private CreatureRepository creatureRepository;

    private String catchOne(long chatId, long userId) {
        String spawnId = spawnService.triggerSpawn(chatId).getSpawn().getId();
        ClaimResult result = spawnService.claim(spawnId, userId);
        assertTrue(result.isCaught());
        return result.getCreature().getId();
    }

    private long coins(long userId) {
        return trainerRepository.findById(userId).orElseThrow().getCoins();
    }

    @Test
    @DisplayName("both confirmations should swap every offered holding at once")
    void shouldSettleTrade() {
        long alice = 61_001L;
        long bob = 61_002L;
        String aliceCreature = catchOne(9101L, alice);
        String bobCreature = catchOne(9102L, bob);
        trainerService.setTeam(alice, List.of(aliceCreature));
        trainerService.purchaseItem(bob, "potion", 2);
        long aliceCoins = coins(alice);
        long bobCoins = coins(bob);

        String tradeId = tradeService.propose(alice, bob, TradeOfferRequest.builder()
                .creatureIds(Set.of(aliceCreature)).coins(150).build()).getTrade().getId();
        tradeService.addCounterOffer(tradeId, bob, TradeOfferRequest.builder()
                .creatureIds(Set.of(bobCreature)).items(Map.of("potion", 1)).build());

        assertEquals(TradeResult.Outcome.CONFIRMATION_RECORDED, tradeService.confirm(tradeId, alice).getOutcome());
        assertEquals(TradeResult.Outcome.ALREADY_CONFIRMED, tradeService.confirm(tradeId, alice).getOutcome());
        TradeResult settled = tradeService.confirm(tradeId, bob);

        assertEquals(TradeResult.Outcome.SETTLED, settled.getOutcome());
        assertEquals(TradeStatus.CONFIRMED, settled.getTrade().getStatus());
        assertEquals(bob, creatureRepository.findById(aliceCreature).orElseThrow().getOwnerId());
        assertEquals(alice, creatureRepository.findById(bobCreature).orElseThrow().getOwnerId());
        assertEquals(aliceCoins - 150, coins(alice));
        assertEquals(bobCoins + 150, coins(bob));
        assertTrue(trainerRepository.findById(alice).orElseThrow().getTeam().isEmpty());
        assertEquals(1, trainerService.getInventory(alice).size());
    }

    @Test
    @DisplayName("coins spent before the exchange should cancel the trade and move nothing")
    void shouldCancelStaleTrade() {
        long alice = 62_001L;
        long bob = 62_002L;
        String bobCreature = catchOne(9201L, bob);
        trainerService.getOrCreateTrainer(alice, "alice");
        long offered = coins(alice) - 100;

        String tradeId = tradeService.propose(alice, bob, TradeOfferRequest.builder().coins(offered).build())
                .getTrade().getId();
        tradeService.addCounterOffer(tradeId, bob, TradeOfferRequest.builder()
                .creatureIds(Set.of(bobCreature)).build());
        tradeService.confirm(tradeId, bob);
        trainerService.purchaseItem(alice, "potion", 1);
        long bobCoins = coins(bob);

        TradeResult result = tradeService.confirm(tradeId, alice);

        assertEquals(TradeResult.Outcome.STALE_OFFER, result.getOutcome());
        assertEquals(TradeStatus.CANCELLED, tradeService.getTrade(tradeId).getStatus());
        assertEquals(bob, creatureRepository.findById(bobCreature).orElseThrow().getOwnerId());
        assertEquals(bobCoins, coins(bob));
        assertFalse(tradeService.listOpenTrades(alice).stream().anyMatch(t -> t.getId().equals(tradeId)));
    }
}
