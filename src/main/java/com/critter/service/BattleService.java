package com.critter.service;

import com.critter.config.GameProperties;
import com.critter.coordination.CoordinationKeys;
import com.critter.coordination.CoordinationStore;
import com.critter.coordination.LockToken;
import com.critter.dto.BattleStateDTO;
import com.critter.dto.TurnResult;
import com.critter.event.BattleCompletedEvent;
import com.critter.model.AiDifficulty;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleSide;
import com.critter.model.BattleStatus;
import com.critter.model.OpponentType;
import com.critter.model.Trainer;
import com.critter.repository.BattleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Service responsible for starting battles and serializing turn submissions.
 * <p>
 * Every mutation of a battle runs under its coordination-store lock; a submission that
 * cannot get the lock is told to retry instead of waiting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BattleService {

    private final BattleRepository battleRepository;
    private final BattleTurnProcessor processor;
    private final BattleTeamFactory teamFactory;
    private final BattleRewardService rewardService;
    private final TrainerService trainerService;
    private final CoordinationStore coordinationStore;
    private final GameProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Random random;

    /**
     * Start a battle between two trainers' active teams.
     *
     * @throws IllegalArgumentException if either trainer is unknown or has no valid team
     * @throws IllegalStateException    if either trainer is already in a battle
     */
    public BattleStateDTO startPlayerBattle(Long challengerId, Long opponentId) {
        if (challengerId == null || opponentId == null) {
            throw new IllegalArgumentException("Both trainers are required");
        }
        if (challengerId.equals(opponentId)) {
            throw new IllegalArgumentException("Cannot battle yourself");
        }
        Trainer challenger = trainerService.getTrainer(challengerId);
        Trainer opponent = trainerService.getTrainer(opponentId);

        Battle battle = withStartLocks(List.of(challengerId, opponentId), () -> {
            requireNotBattling(challengerId);
            requireNotBattling(opponentId);

            List<BattleCombatant> combatants = new ArrayList<>(teamFactory.snapshotTeam(challenger, BattleSide.A));
            combatants.addAll(teamFactory.snapshotTeam(opponent, BattleSide.B));
            return newBattle(challengerId, opponentId, OpponentType.PLAYER, null, random.nextLong(), combatants);
        });
        log.info("Battle {} started: trainer {} vs trainer {}", battle.getId(), challengerId, opponentId);
        return BattleStateDTO.fromBattle(battle);
    }

    /**
     * Start a battle against a generated opponent team.
     */
    public BattleStateDTO startAiBattle(Long challengerId, AiDifficulty difficulty) {
        Trainer challenger = trainerService.getTrainer(challengerId);
        AiDifficulty level = difficulty != null ? difficulty : AiDifficulty.NORMAL;

        Battle battle = withStartLocks(List.of(challengerId), () -> {
            requireNotBattling(challengerId);

            long seed = random.nextLong();
            List<BattleCombatant> team = teamFactory.snapshotTeam(challenger, BattleSide.A);
            List<BattleCombatant> combatants = new ArrayList<>(team);
            combatants.addAll(teamFactory.generateAiTeam(team, new Random(seed)));
            return newBattle(challengerId, null, OpponentType.AI, level, seed, combatants);
        });
        log.info("Battle {} started: trainer {} vs {} AI", battle.getId(), challengerId, level);
        return BattleStateDTO.fromBattle(battle);
    }

    private Battle newBattle(Long challengerId, Long opponentId, OpponentType type, AiDifficulty difficulty,
                             long seed, List<BattleCombatant> combatants) {
        Instant now = clock.instant();
        return battleRepository.save(Battle.builder()
                .status(BattleStatus.IN_PROGRESS)
                .challengerId(challengerId)
                .opponentId(opponentId)
                .opponentType(type)
                .aiDifficulty(difficulty)
                .rngSeed(seed)
                .turnNumber(1)
                .activeSlotA(0)
                .activeSlotB(0)
                .combatants(combatants)
                .createdAt(now)
                .lastActivityAt(now)
                .build());
    }

    /**
     * Runs a battle start while holding every participant's start lock, so the
     * "not already battling" check and the insert cannot interleave with another start.
     */
    private Battle withStartLocks(List<Long> trainerIds, Supplier<Battle> start) {
        List<LockToken> held = new ArrayList<>();
        try {
            for (Long trainerId : trainerIds.stream().sorted().toList()) {
                LockToken token = coordinationStore.tryAcquire(
                                CoordinationKeys.trainerBattleStartLock(trainerId), properties.battle().lockTtl())
                        .orElseThrow(() -> new IllegalStateException("Trainer " + trainerId + " is busy, try again"));
                held.add(token);
            }
            return start.get();
        } finally {
            held.forEach(coordinationStore::release);
        }
    }

    private void requireNotBattling(Long trainerId) {
        if (battleRepository.existsByParticipantAndStatus(trainerId, BattleStatus.IN_PROGRESS)) {
            throw new IllegalStateException("Trainer " + trainerId + " is already in a battle");
        }
    }

    /**
     * Submit an action for the given turn. The turn resolves once both sides have submitted
     * (immediately against a generated opponent).
     *
     * @throws IllegalArgumentException if the user is not a participant or the action is invalid
     */
    public TurnResult submitTurn(String battleId, Long userId, int turnNumber, BattleAction action) {
        Battle battle = find(battleId);
        BattleSide side = sideOf(battle, userId);

        Optional<LockToken> lock = coordinationStore.tryAcquire(
                CoordinationKeys.battleLock(battleId), properties.battle().lockTtl());
        if (lock.isEmpty()) {
            log.debug("Turn submission for battle {} contended", battleId);
            return TurnResult.of(TurnResult.Outcome.CONTENDED, BattleStateDTO.fromBattle(battle));
        }

        BattleTurnProcessor.Step step;
        try {
            step = processor.submit(battleId, side, userId, turnNumber, action, clock.instant());
        } finally {
            coordinationStore.release(lock.get());
        }

        BattleStateDTO state = BattleStateDTO.fromBattle(step.battle());
        if (step.completedNow()) {
            finish(step.battle(), state);
        }
        return TurnResult.of(step.outcome(), state);
    }

    /**
     * Give up an in-progress battle; the other side wins.
     *
     * @throws IllegalStateException if the battle is busy or already complete
     */
    public BattleStateDTO forfeit(String battleId, Long userId) {
        Battle battle = find(battleId);
        BattleSide side = sideOf(battle, userId);

        LockToken lock = coordinationStore.tryAcquire(
                        CoordinationKeys.battleLock(battleId), properties.battle().lockTtl())
                .orElseThrow(() -> new IllegalStateException("Battle is busy, try again"));
        Battle ended;
        try {
            ended = processor.forfeit(battleId, side, clock.instant());
        } finally {
            coordinationStore.release(lock);
        }

        BattleStateDTO state = BattleStateDTO.fromBattle(ended);
        finish(ended, state);
        return state;
    }

    /**
     * Battle state with the full log. Applies the inactivity timeout if it has passed.
     */
    public BattleStateDTO getBattle(String battleId) {
        Battle battle = find(battleId);
        if (battle.isInProgress() && processor.isInactive(battle, clock.instant())) {
            return timeOut(battleId).map(BattleStateDTO::fromBattle).orElseGet(() -> BattleStateDTO.fromBattle(find(battleId)));
        }
        return BattleStateDTO.fromBattle(battle);
    }

    /**
     * Sweep safety net; reads and submissions apply the timeout on their own.
     */
    public int timeOutInactiveBattles() {
        Instant cutoff = clock.instant().minus(properties.battle().inactivityTimeout());
        int closed = 0;
        for (Battle battle : battleRepository.findByStatusAndLastActivityAtLessThanEqual(BattleStatus.IN_PROGRESS, cutoff)) {
            if (timeOut(battle.getId()).isPresent()) {
                closed++;
            }
        }
        return closed;
    }

    private Optional<Battle> timeOut(String battleId) {
        Optional<LockToken> lock = coordinationStore.tryAcquire(
                CoordinationKeys.battleLock(battleId), properties.battle().lockTtl());
        if (lock.isEmpty()) {
            return Optional.empty();
        }
        Optional<Battle> closed;
        try {
            closed = processor.timeOut(battleId, clock.instant());
        } finally {
            coordinationStore.release(lock.get());
        }
        closed.ifPresent(b -> finish(b, BattleStateDTO.fromBattle(b)));
        return closed;
    }

    private void finish(Battle battle, BattleStateDTO state) {
        rewardService.grant(battle);
        eventPublisher.publishEvent(new BattleCompletedEvent(state));
    }

    private Battle find(String battleId) {
        return battleRepository.findById(battleId)
                .orElseThrow(() -> new IllegalArgumentException("Battle not found: " + battleId));
    }

    private BattleSide sideOf(Battle battle, Long userId) {
        return battle.sideOf(userId)
                .orElseThrow(() -> new IllegalArgumentException("User " + userId + " is not part of battle " + battle.getId()));
    }
}
