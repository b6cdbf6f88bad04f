package com.sweeper.config;

import com.sweeper.model.Board;
import com.sweeper.model.GameSettings;
import com.sweeper.model.ValidationResult;
import com.sweeper.service.BoardValidator;
import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads all available level definitions at startup.
 * <p>
 * Levels are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:levels/*.json} – built-in levels</li>
 *   <li>External folder: {@code ./levels/} next to the running jar – custom levels</li>
 * </ol>
 * A custom level with the same {@code id} as a built-in one replaces it.
 * Levels with a fixed layout must pass {@link BoardValidator}; rejected ones are skipped.
 */
@Component
@Slf4j
public class LevelLoader {

    private final ObjectMapper objectMapper;
    private final BoardValidator boardValidator;

    /** All accepted levels keyed by their id. */
    @Getter
    private final Map<String, LevelDefinition> levels = new LinkedHashMap<>();

    private final Map<String, GameSettings> settings = new HashMap<>();

    public LevelLoader(ObjectMapper objectMapper, BoardValidator boardValidator) {
        this.objectMapper = objectMapper;
        this.boardValidator = boardValidator;
    }

    @PostConstruct
    public void loadLevels() {
        loadClasspathLevels();
        loadExternalLevels(Paths.get("levels"));

        if (levels.isEmpty()) {
            log.warn("No level definitions found! Games can only be created with explicit settings.");
        } else {
            log.info("Loaded {} level(s): {}", levels.size(),
                    levels.values().stream().map(LevelDefinition::name).toList());
        }
    }

    /**
     * Returns an unmodifiable list of every loaded level.
     */
    public List<LevelDefinition> getAvailableLevels() {
        return List.copyOf(levels.values());
    }

    /**
     * Get a specific level by its id.
     *
     * @throws IllegalArgumentException if the level id is unknown
     */
    public LevelDefinition getLevel(String levelId) {
        LevelDefinition level = levels.get(levelId);
        if (level == null) {
            throw new IllegalArgumentException("Unknown level: " + levelId
                    + ". Available levels: " + levels.keySet());
        }
        return level;
    }

    /**
     * Game settings for a level: its fixed layout when it has one, random placement otherwise.
     *
     * @throws IllegalArgumentException if the level id is unknown
     */
    public GameSettings getSettings(String levelId) {
        getLevel(levelId);
        return settings.get(levelId);
    }

    /**
     * Adds a level after checking it. Returns false when the level was rejected.
     */
    public boolean register(LevelDefinition level, String source) {
        if (level.id() == null || level.id().isBlank()) {
            log.error("Level from {} has no id", source);
            return false;
        }
        GameSettings levelSettings;
        if (level.hasLayout()) {
            ValidationResult result = boardValidator.validate(level.layoutText());
            if (!result.isOk()) {
                log.error("Level '{}' from {} has an invalid layout: {}", level.id(), source, result.getMessage());
                return false;
            }
            levelSettings = GameSettings.fixed(result.getLayout());
        } else {
            if (level.rows() <= 0 || level.columns() <= 0
                    || level.rows() > Board.MAX_DIMENSION || level.columns() > Board.MAX_DIMENSION
                    || level.treasures() < 1
                    || level.mines() < 0 || level.mines() + level.treasures() >= level.rows() * level.columns()) {
                log.error("Level '{}' from {} does not fit: {}x{} with {} mines and {} treasure(s)",
                        level.id(), source, level.rows(), level.columns(), level.mines(), level.treasures());
                return false;
            }
            levelSettings = GameSettings.random(level.rows(), level.columns(), level.mines(), level.treasures());
        }
        levels.put(level.id(), level);
        settings.put(level.id(), levelSettings);
        return true;
    }

    // ── classpath levels ────────────────────────────────────────────────

    private void loadClasspathLevels() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:levels/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    LevelDefinition level = objectMapper.readValue(is, LevelDefinition.class);
                    if (register(level, resource.getFilename())) {
                        log.info("Loaded built-in level '{}' ({}) from classpath", level.name(), level.id());
                    }
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to load classpath level: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for levels: {}", e.getMessage());
        }
    }

    // ── external levels (./levels/ folder) ──────────────────────────────

    void loadExternalLevels(Path externalDir) {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external levels directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalLevelFile);
        } catch (IOException e) {
            log.error("Error reading external levels directory", e);
        }
    }

    private void loadExternalLevelFile(Path path) {
        try {
            LevelDefinition level = objectMapper.readValue(path.toFile(), LevelDefinition.class);
            if (register(level, path.toString())) {
                log.info("Loaded custom level '{}' ({}) from {}", level.name(), level.id(), path);
            }
        } catch (Exception e) {
            log.error("Failed to load custom level: {}", path, e);
        }
    }
}
