package com.critter.service;

import com.critter.config.Catalog;
import com.critter.config.GameProperties;
import com.critter.config.ItemDefinition;
import com.critter.dto.CreatureDTO;
import com.critter.dto.DailyRewardResult;
import com.critter.dto.InventoryItemDTO;
import com.critter.dto.TrainerDTO;
import com.critter.model.Creature;
import com.critter.model.Trainer;
import com.critter.repository.CreatureRepository;
import com.critter.repository.TrainerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for trainer profiles, team management, the daily reward and the item shop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainerService {

    private final TrainerRepository trainerRepository;
    private final CreatureRepository creatureRepository;
    private final InventoryService inventoryService;
    private final Catalog catalog;
    private final GameProperties properties;
    private final Clock clock;

    /**
     * Returns the trainer, registering it with the starting coins on first contact.
     * Must be called outside a surrounding transaction: a lost insert race is resolved by re-reading.
     */
    public Trainer getOrCreateTrainer(Long userId, String displayName) {
        if (userId == null) {
            throw new IllegalArgumentException("User id is required");
        }
        return trainerRepository.findById(userId).orElseGet(() -> register(userId, displayName));
    }

    private Trainer register(Long userId, String displayName) {
        Trainer trainer = Trainer.builder()
                .id(userId)
                .displayName(displayName)
                .coins(properties.economy().startingCoins())
                .createdAt(clock.instant())
                .build();
        try {
            Trainer saved = trainerRepository.saveAndFlush(trainer);
            log.info("Registered trainer {} ({})", userId, displayName);
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.debug("Trainer {} registered concurrently, re-reading", userId);
            return trainerRepository.findById(userId).orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Trainer getTrainer(Long userId) {
        return trainerRepository.findById(userId)
                .orElseThrow(() -> new IllegalArgumentException("Trainer not found: " + userId));
    }

    @Transactional(readOnly = true)
    public TrainerDTO getProfile(Long userId) {
        return TrainerDTO.fromTrainer(getTrainer(userId));
    }

    @Transactional(readOnly = true)
    public CreatureDTO getCreature(String creatureId) {
        return creatureRepository.findById(creatureId)
                .map(CreatureDTO::fromCreature)
                .orElseThrow(() -> new IllegalArgumentException("Creature not found: " + creatureId));
    }

    @Transactional(readOnly = true)
    public List<CreatureDTO> listCreatures(Long userId) {
        return creatureRepository.findByOwnerIdOrderByCreatedAtAsc(userId).stream()
                .map(CreatureDTO::fromCreature)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TrainerDTO> getLeaderboard() {
        return trainerRepository.findTop10ByOrderByTrainerLevelDescExperienceDesc().stream()
                .map(TrainerDTO::fromTrainer)
                .toList();
    }

    // ── team ────────────────────────────────────────────────────────────

    /**
     * Replace the active team. Order is preserved.
     *
     * @throws IllegalArgumentException if the list has duplicates, exceeds the team size
     *                                  or names a creature the trainer does not own
     */
    @Transactional
    public TrainerDTO setTeam(Long userId, List<String> creatureIds) {
        Trainer trainer = getTrainer(userId);
        validateTeam(userId, creatureIds);

        List<String> previous = new ArrayList<>(trainer.getTeam());
        if (!previous.isEmpty()) {
            creatureRepository.updateTeamFlag(userId, previous, false);
        }
        if (!creatureIds.isEmpty()) {
            int flagged = creatureRepository.updateTeamFlag(userId, creatureIds, true);
            if (flagged != creatureIds.size()) {
                // ownership changed after validation, roll back
                throw new IllegalArgumentException("Team changed hands while saving, you no longer own every creature");
            }
        }

        // bulk updates cleared the persistence context
        trainer = getTrainer(userId);
        trainer.getTeam().clear();
        trainer.getTeam().addAll(creatureIds);
        Trainer saved = trainerRepository.save(trainer);
        log.info("Trainer {} set team {}", userId, creatureIds);
        return TrainerDTO.fromTrainer(saved);
    }

    @Transactional
    public TrainerDTO addToTeam(Long userId, String creatureId) {
        List<String> team = new ArrayList<>(getTrainer(userId).getTeam());
        if (team.contains(creatureId)) {
            throw new IllegalArgumentException("Creature already in team: " + creatureId);
        }
        team.add(creatureId);
        return setTeam(userId, team);
    }

    @Transactional
    public TrainerDTO removeFromTeam(Long userId, String creatureId) {
        List<String> team = new ArrayList<>(getTrainer(userId).getTeam());
        if (!team.remove(creatureId)) {
            throw new IllegalArgumentException("Creature not in team: " + creatureId);
        }
        return setTeam(userId, team);
    }

    private void validateTeam(Long userId, List<String> creatureIds) {
        if (creatureIds == null) {
            throw new IllegalArgumentException("Team must not be null");
        }
        if (creatureIds.size() > Trainer.MAX_TEAM_SIZE) {
            throw new IllegalArgumentException("A team holds at most " + Trainer.MAX_TEAM_SIZE + " creatures");
        }
        Set<String> distinct = new HashSet<>(creatureIds);
        if (distinct.size() != creatureIds.size()) {
            throw new IllegalArgumentException("Team contains the same creature twice");
        }
        if (distinct.isEmpty()) {
            return;
        }
        Map<String, Creature> owned = creatureRepository.findByIdInAndOwnerId(distinct, userId).stream()
                .collect(Collectors.toMap(Creature::getId, Function.identity()));
        for (String id : creatureIds) {
            if (!owned.containsKey(id)) {
                throw new IllegalArgumentException("You don't own creature " + id);
            }
        }
    }

    // ── daily reward ────────────────────────────────────────────────────

    /**
     * Claim the daily coin reward. The streak continues if the previous claim is within the
     * streak window, otherwise it restarts at 1.
     */
    @Transactional
    public DailyRewardResult claimDaily(Long userId) {
        Trainer trainer = getTrainer(userId);
        GameProperties.EconomyParams economy = properties.economy();
        Instant now = clock.instant();
        Instant last = trainer.getLastDailyClaim();

        if (last != null && now.isBefore(last.plus(economy.dailyCooldown()))) {
            return DailyRewardResult.builder()
                    .outcome(DailyRewardResult.Outcome.ON_COOLDOWN)
                    .streak(trainer.getDailyStreak())
                    .nextClaimAt(last.plus(economy.dailyCooldown()))
                    .build();
        }

        boolean continues = last != null && !now.isAfter(last.plus(economy.streakWindow()));
        int streak = continues ? trainer.getDailyStreak() + 1 : 1;
        long reward = economy.dailyBase() + Math.min(streak * economy.streakBonusStep(), economy.streakBonusCap());

        int updated = last == null
                ? trainerRepository.recordFirstDailyClaim(userId, now, streak, reward)
                : trainerRepository.recordDailyClaim(userId, last, now, streak, reward);
        if (updated == 0) {
            log.debug("Daily claim for trainer {} raced with another claim", userId);
            return DailyRewardResult.builder().outcome(DailyRewardResult.Outcome.CONTENDED).build();
        }

        log.info("Trainer {} claimed daily reward of {} coins (streak {})", userId, reward, streak);
        return DailyRewardResult.builder()
                .outcome(DailyRewardResult.Outcome.CLAIMED)
                .coinsAwarded(reward)
                .streak(streak)
                .nextClaimAt(now.plus(economy.dailyCooldown()))
                .build();
    }

    // ── shop ────────────────────────────────────────────────────────────

    /**
     * Buy items with coins.
     *
     * @throws IllegalArgumentException if the item is unknown or the trainer cannot afford it
     */
    @Transactional
    public List<InventoryItemDTO> purchaseItem(Long userId, String itemCode, int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity must be at least 1");
        }
        ItemDefinition item = catalog.getItem(itemCode);
        getTrainer(userId);

        long cost = item.price() * quantity;
        if (trainerRepository.debitCoins(userId, cost) == 0) {
            throw new IllegalArgumentException("Not enough coins! Need " + cost + " coins.");
        }
        inventoryService.credit(userId, itemCode, quantity);
        log.info("Trainer {} bought {} x {} for {} coins", userId, quantity, itemCode, cost);
        return inventoryService.getInventory(userId);
    }

    @Transactional(readOnly = true)
    public List<InventoryItemDTO> getInventory(Long userId) {
        getTrainer(userId);
        return inventoryService.getInventory(userId);
    }
}
