package com.critter.config;

import com.critter.model.RarityTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads the creature catalog at startup.
 * <p>
 * Catalog files are read from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:catalog/*.json} – species, moves and items shipped with the app</li>
 *   <li>External folder: {@code ./catalog/} next to the running jar – operator overrides</li>
 * </ol>
 * An entry with the same code as an earlier one replaces it.
 */
@Component
@Slf4j
public class CatalogLoader implements Catalog {

    private final ObjectMapper objectMapper;

    private final Map<String, SpeciesDefinition> species = new LinkedHashMap<>();
    private final Map<String, MoveDefinition> moves = new LinkedHashMap<>();
    private final Map<String, ItemDefinition> items = new LinkedHashMap<>();
    private final Map<RarityTier, List<SpeciesDefinition>> speciesByRarity = new EnumMap<>(RarityTier.class);
    private List<Long> levelThresholds = List.of();
    private ExperienceCurve experienceCurve = ExperienceCurve.cubic();

    public CatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadCatalog() {
        loadClasspathCatalog();
        loadExternalCatalog();
        index();

        if (species.isEmpty()) {
            log.warn("No species definitions found! Spawns will not work without at least one species.");
        } else {
            log.info("Loaded catalog: {} species, {} moves, {} items", species.size(), moves.size(), items.size());
        }
    }

    @Override
    public SpeciesDefinition getSpecies(String code) {
        SpeciesDefinition definition = species.get(code);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown species: " + code);
        }
        return definition;
    }

    @Override
    public List<SpeciesDefinition> speciesOfRarity(RarityTier rarity) {
        return speciesByRarity.getOrDefault(rarity, List.of());
    }

    @Override
    public List<SpeciesDefinition> allSpecies() {
        return List.copyOf(species.values());
    }

    @Override
    public MoveDefinition getMove(String code) {
        MoveDefinition move = moves.get(code);
        if (move == null) {
            throw new IllegalArgumentException("Unknown move: " + code);
        }
        return move;
    }

    @Override
    public ItemDefinition getItem(String code) {
        ItemDefinition item = items.get(code);
        if (item == null) {
            throw new IllegalArgumentException("Unknown item: " + code + ". Available items: " + items.keySet());
        }
        return item;
    }

    @Override
    public List<ItemDefinition> allItems() {
        return List.copyOf(items.values());
    }

    @Override
    public ExperienceCurve experienceCurve() {
        return experienceCurve;
    }

    void register(CatalogDefinition definition) {
        if (definition.species() != null) {
            definition.species().forEach(s -> species.put(s.code(), s));
        }
        if (definition.moves() != null) {
            definition.moves().forEach(m -> moves.put(m.code(), m));
        }
        if (definition.items() != null) {
            definition.items().forEach(i -> items.put(i.code(), i));
        }
        if (definition.levelThresholds() != null && !definition.levelThresholds().isEmpty()) {
            levelThresholds = definition.levelThresholds();
        }
    }

    void index() {
        speciesByRarity.clear();
        for (SpeciesDefinition definition : species.values()) {
            speciesByRarity.computeIfAbsent(definition.rarity(), r -> new ArrayList<>()).add(definition);
            if (definition.evolution() != null && !species.containsKey(definition.evolution().targetSpecies())) {
                log.warn("Species '{}' evolves into unknown species '{}'", definition.code(),
                        definition.evolution().targetSpecies());
            }
        }
        speciesByRarity.replaceAll((rarity, list) -> List.copyOf(list));
        experienceCurve = levelThresholds.isEmpty() ? ExperienceCurve.cubic() : ExperienceCurve.table(levelThresholds);
    }

    // ── classpath catalog ───────────────────────────────────────────────

    private void loadClasspathCatalog() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:catalog/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    register(objectMapper.readValue(is, CatalogDefinition.class));
                    log.info("Loaded built-in catalog file '{}'", resource.getFilename());
                } catch (IOException e) {
                    log.error("Failed to load classpath catalog file: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for catalog files: {}", e.getMessage());
        }
    }

    // ── external catalog (./catalog/ folder) ────────────────────────────

    private void loadExternalCatalog() {
        Path externalDir = Paths.get("catalog");
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external catalog directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalFile);
        } catch (IOException e) {
            log.error("Error reading external catalog directory", e);
        }
    }

    private void loadExternalFile(Path path) {
        try {
            register(objectMapper.readValue(path.toFile(), CatalogDefinition.class));
            log.info("Loaded custom catalog file {}", path);
        } catch (IOException e) {
            log.error("Failed to load custom catalog file: {}", path, e);
        }
    }
}
