package com.sweeper.config;

import com.sweeper.TestLayouts;
import com.sweeper.model.GameSettings;
import com.sweeper.service.BoardValidator;
import tools.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.*;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LevelLoader: classpath and external level loading.
 */
class LevelLoaderTest {

    private LevelLoader loader;

    @BeforeEach
    void setUp() {
        loader = new LevelLoader(new ObjectMapper(), new BoardValidator());
    }

    private static List<String> layoutLines(int[][] matrix) {
        return Arrays.asList(TestLayouts.toText(matrix).split("\n"));
    }

    // ── built-in levels ─────────────────────────────────────────────────

    @Test
    @DisplayName("loadLevels() should load every built-in level from classpath")
    void shouldLoadClasspathLevels() {
        loader.loadLevels();

        assertTrue(loader.getLevels().keySet().containsAll(List.of("classic", "beginner", "expert", "test-board")));
    }

    @Test
    @DisplayName("classic level should be a random 10x10 board")
    void classicSettings() {
        loader.loadLevels();

        GameSettings settings = loader.getSettings("classic");

        assertFalse(settings.isFixed());
        assertEquals(10, settings.rows());
        assertEquals(10, settings.columns());
        assertEquals(10, settings.mineCount());
        assertEquals(1, settings.treasureCount());
    }

    @Test
    @DisplayName("test-board level should carry its validated fixed layout")
    void testBoardSettings() {
        loader.loadLevels();

        GameSettings settings = loader.getSettings("test-board");

        assertTrue(settings.isFixed());
        assertTrue(Arrays.deepEquals(TestLayouts.VALID, settings.layout().toMatrix()));
        assertEquals(10, settings.mineCount());
        assertTrue(loader.getLevel("test-board").hasLayout());
    }

    @Test
    @DisplayName("getAvailableLevels() should return an unmodifiable list")
    void shouldReturnUnmodifiableList() {
        loader.loadLevels();

        List<LevelDefinition> levels = loader.getAvailableLevels();

        assertFalse(levels.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> levels.add(null));
    }

    @Test
    @DisplayName("getLevel() should name the available levels for an unknown id")
    void shouldThrowForUnknownLevel() {
        loader.loadLevels();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> loader.getLevel("does-not-exist"));

        assertTrue(ex.getMessage().contains("Unknown level"));
        assertTrue(ex.getMessage().contains("classic"));
        assertThrows(IllegalArgumentException.class, () -> loader.getSettings("does-not-exist"));
    }

    // ── register() ──────────────────────────────────────────────────────

    @Test
    @DisplayName("register() should reject a layout that breaks a structural rule")
    void shouldRejectInvalidLayout() {
        int[][] matrix = TestLayouts.copy(TestLayouts.VALID);
        matrix[7][3] = 0;
        LevelDefinition level = new LevelDefinition("broken", "Broken", "", 8, 8, 9, 1, layoutLines(matrix));

        assertFalse(loader.register(level, "test"));
        assertFalse(loader.getLevels().containsKey("broken"));
    }

    @Test
    @DisplayName("register() should reject random levels that leave no free cell")
    void shouldRejectOverfullLevel() {
        LevelDefinition level = new LevelDefinition("full", "Full", "", 3, 3, 8, 1, null);

        assertFalse(loader.register(level, "test"));
    }

    @Test
    @DisplayName("register() should reject random levels larger than the maximum board")
    void shouldRejectOversizedLevel() {
        LevelDefinition level = new LevelDefinition("huge", "Huge", "", 200, 200, 10, 1, null);

        assertFalse(loader.register(level, "test"));
        assertFalse(loader.getLevels().containsKey("huge"));
    }

    @Test
    @DisplayName("register() should reject a level without id")
    void shouldRejectMissingId() {
        LevelDefinition level = new LevelDefinition(" ", "No id", "", 5, 5, 3, 1, null);

        assertFalse(loader.register(level, "test"));
        assertTrue(loader.getLevels().isEmpty());
    }

    @Test
    @DisplayName("register() should replace a level with the same id")
    void shouldOverrideBuiltInLevel() {
        loader.loadLevels();

        LevelDefinition override = new LevelDefinition("classic", "Custom Classic", "", 12, 12, 20, 2, null);
        assertTrue(loader.register(override, "test"));

        assertEquals("Custom Classic", loader.getLevel("classic").name());
        assertEquals(12, loader.getSettings("classic").rows());
        assertEquals(2, loader.getSettings("classic").treasureCount());
    }

    // ── external levels ─────────────────────────────────────────────────

    @Test
    @DisplayName("loadExternalLevels() should load JSON files and skip others")
    void shouldLoadExternalLevels(@TempDir Path tempDir) throws IOException {
        String json = """
                {
                  "id": "wide",
                  "name": "Wide",
                  "description": "A wide field",
                  "rows": 5,
                  "columns": 20,
                  "mines": 15,
                  "treasures": 2
                }
                """;
        Files.writeString(tempDir.resolve("wide.json"), json);
        Files.writeString(tempDir.resolve("readme.txt"), "not a level");

        loader.loadExternalLevels(tempDir);

        assertEquals(1, loader.getLevels().size());
        GameSettings settings = loader.getSettings("wide");
        assertEquals(20, settings.columns());
        assertEquals(15, settings.mineCount());
        assertEquals(2, settings.treasureCount());
    }

    @Test
    @DisplayName("loadExternalLevels() should skip malformed JSON without crashing")
    void shouldSkipMalformedJson(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("bad.json"), "{ invalid json }}");

        assertDoesNotThrow(() -> loader.loadExternalLevels(tempDir));
        assertTrue(loader.getLevels().isEmpty());
    }

    @Test
    @DisplayName("loadExternalLevels() should ignore a missing directory")
    void shouldHandleMissingDirectory(@TempDir Path tempDir) {
        assertDoesNotThrow(() -> loader.loadExternalLevels(tempDir.resolve("nothing-here")));
        assertTrue(loader.getLevels().isEmpty());
    }
}
