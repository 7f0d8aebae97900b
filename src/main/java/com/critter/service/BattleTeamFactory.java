package com.critter.service;

import com.critter.config.Catalog;
import com.critter.config.GameProperties;
import com.critter.config.SpeciesDefinition;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleSide;
import com.critter.model.Creature;
import com.critter.model.Nature;
import com.critter.model.RarityTier;
import com.critter.model.StatBlock;
import com.critter.model.Trainer;
import com.critter.repository.CreatureRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the team snapshots a battle fights with. Stats are copied at battle start.
 */
@Component
@RequiredArgsConstructor
public class BattleTeamFactory {

    static final int MAX_MOVES = 4;
    private static final Set<RarityTier> AI_EXCLUDED = EnumSet.of(RarityTier.LEGENDARY, RarityTier.MYTHICAL);

    private final CreatureRepository creatureRepository;
    private final Catalog catalog;
    private final StatCalculator statCalculator;
    private final GameProperties properties;

    /**
     * Snapshot the trainer's active team in team order.
     *
     * @throws IllegalArgumentException if the team is empty or a member is no longer owned
     */
    public List<BattleCombatant> snapshotTeam(Trainer trainer, BattleSide side) {
        List<String> team = trainer.getTeam();
        if (team.isEmpty()) {
            throw new IllegalArgumentException("Trainer " + trainer.getId() + " has no active team");
        }
        Map<String, Creature> creatures = creatureRepository.findAllById(team).stream()
                .collect(Collectors.toMap(Creature::getId, Function.identity()));

        List<BattleCombatant> snapshot = new ArrayList<>();
        for (int slot = 0; slot < team.size(); slot++) {
            Creature creature = creatures.get(team.get(slot));
            if (creature == null || !creature.isOwnedBy(trainer.getId())) {
                throw new IllegalArgumentException("Team member " + team.get(slot)
                        + " is no longer owned by trainer " + trainer.getId());
            }
            snapshot.add(combatant(side, slot, creature.getId(), trainer.getId(),
                    creature.getSpeciesCode(), creature.getLevel(), creature.getStats()));
        }
        snapshot.get(0).setParticipated(true);
        return snapshot;
    }

    /**
     * Generate an opponent team: one member per challenger member up to the configured cap,
     * non-legendary species, levels around the challenger average.
     */
    public List<BattleCombatant> generateAiTeam(List<BattleCombatant> challengerTeam, Random random) {
        GameProperties.BattleParams params = properties.battle();
        List<SpeciesDefinition> candidates = catalog.allSpecies().stream()
                .filter(s -> !AI_EXCLUDED.contains(s.rarity()))
                .toList();
        if (candidates.isEmpty()) {
            throw new IllegalStateException("Catalog has no species for generated opponents");
        }

        int size = Math.min(challengerTeam.size(), params.aiTeamSizeCap());
        int averageLevel = (int) Math.round(challengerTeam.stream()
                .mapToInt(BattleCombatant::getLevel)
                .average()
                .orElse(5));
        int spread = params.aiLevelSpread();

        List<BattleCombatant> team = new ArrayList<>();
        for (int slot = 0; slot < size; slot++) {
            SpeciesDefinition species = candidates.get(random.nextInt(candidates.size()));
            int level = averageLevel + random.nextInt(2 * spread + 1) - spread;
            level = Math.max(1, Math.min(100, level));
            StatBlock stats = statCalculator.compute(species, level, Nature.HARDY, false);
            team.add(combatant(BattleSide.B, slot, null, null, species.code(), level, stats));
        }
        team.get(0).setParticipated(true);
        return team;
    }

    private BattleCombatant combatant(BattleSide side, int slot, String creatureId, Long ownerId,
                                      String speciesCode, int level, StatBlock stats) {
        List<String> pool = catalog.getSpecies(speciesCode).movePool();
        List<String> moves = new ArrayList<>(pool.subList(0, Math.min(MAX_MOVES, pool.size())));
        if (moves.isEmpty()) {
            throw new IllegalStateException("Species " + speciesCode + " has an empty move pool");
        }
        return BattleCombatant.builder()
                .side(side)
                .slot(slot)
                .creatureId(creatureId)
                .ownerId(ownerId)
                .speciesCode(speciesCode)
                .level(level)
                .maxHp(stats.getHp())
                .currentHp(stats.getHp())
                .attack(stats.getAttack())
                .defense(stats.getDefense())
                .specialAttack(stats.getSpecialAttack())
                .specialDefense(stats.getSpecialDefense())
                .speed(stats.getSpeed())
                .moveCodes(moves)
                .participated(false)
                .build();
    }
}
