package com.sweeper.persistence;

import com.sweeper.model.GameStatus;

import java.time.Instant;
import java.util.List;

/**
 * Versioned, storage-facing form of a game in progress. Decoupled from the
 * in-memory model: adjacency counts are not stored and are recomputed on restore.
 *
 * @param version       format version, currently {@value SavedGameCodec#CURRENT_VERSION}
 * @param rows          board height
 * @param columns       board width
 * @param mineCount     mine count of the settings the game was built from
 * @param treasureCount treasure count of the settings the game was built from
 * @param layout        fixed layout the game was built from, or {@code null} for random placement
 * @param cells         per-cell flags in row-major order
 * @param clickedCount  cells revealed so far
 * @param flagCount     flags currently placed
 * @param startedAt     first reveal, or {@code null}
 * @param status        game status
 */
public record SavedGame(
        int version,
        int rows,
        int columns,
        int mineCount,
        int treasureCount,
        List<List<Integer>> layout,
        List<SavedCell> cells,
        int clickedCount,
        int flagCount,
        Instant startedAt,
        GameStatus status
) {

    public record SavedCell(boolean mine, boolean treasure, boolean flagged, boolean revealed) {}
}
