package com.sweeper.persistence;

import com.sweeper.exception.ConfigurationException;
import com.sweeper.model.Board;
import com.sweeper.model.Cell;
import com.sweeper.model.Coordinate;
import com.sweeper.model.FixedLayout;
import com.sweeper.model.GameSettings;
import com.sweeper.model.GameState;
import com.sweeper.model.GameStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Converts between {@link GameState} and the persisted {@link SavedGame} form,
 * and between {@link SavedGame} and JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SavedGameCodec {

    public static final int CURRENT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public SavedGame toSavedGame(GameState state) {
        Board board = state.getBoard();
        GameSettings settings = state.getSettings();
        List<SavedGame.SavedCell> cells = new ArrayList<>(board.getCellCount());
        for (Cell cell : board.cells()) {
            cells.add(new SavedGame.SavedCell(cell.isMine(), cell.isTreasure(), cell.isFlagged(), cell.isRevealed()));
        }
        return new SavedGame(
                CURRENT_VERSION,
                board.getRows(),
                board.getColumns(),
                settings.mineCount(),
                settings.treasureCount(),
                settings.isFixed() ? settings.layout().toRows() : null,
                List.copyOf(cells),
                state.getClickedCount(),
                state.getFlagCount(),
                state.getStartedAt(),
                state.getStatus());
    }

    /**
     * Rebuilds a game. Adjacency counts are recomputed from the saved mines.
     *
     * @throws ConfigurationException if the saved game is of an unknown version, too large,
     *                                incomplete, or its cells contradict its counters or status
     */
    public GameState fromSavedGame(SavedGame saved) {
        if (saved.version() != CURRENT_VERSION) {
            throw new ConfigurationException("Unsupported saved game version: " + saved.version());
        }
        if (saved.rows() <= 0 || saved.columns() <= 0
                || saved.rows() > Board.MAX_DIMENSION || saved.columns() > Board.MAX_DIMENSION) {
            throw new ConfigurationException(String.format("Saved board size %dx%d is outside 1..%d",
                    saved.rows(), saved.columns(), Board.MAX_DIMENSION));
        }
        int cellCount = saved.rows() * saved.columns();
        if (saved.cells() == null || saved.cells().size() != cellCount) {
            throw new ConfigurationException(String.format("Saved game has %d cells, expected %d",
                    saved.cells() == null ? 0 : saved.cells().size(), cellCount));
        }
        for (int i = 0; i < cellCount; i++) {
            if (saved.cells().get(i) == null) {
                throw new ConfigurationException("Saved cell " + i + " is missing");
            }
        }
        if (saved.status() == null) {
            throw new ConfigurationException("Saved game has no status");
        }

        GameSettings settings = saved.layout() != null
                ? GameSettings.fixed(FixedLayout.fromRows(saved.layout()))
                : GameSettings.random(saved.rows(), saved.columns(), saved.mineCount(), saved.treasureCount());

        if (settings.isFixed() && (settings.rows() != saved.rows() || settings.columns() != saved.columns())) {
            throw new ConfigurationException("Saved layout does not match the saved board size");
        }

        Board board = new Board(saved.rows(), saved.columns(), settings.isFixed());
        try {
            forEachCell(saved, (coordinate, cell) -> {
                if (cell.mine()) {
                    board.placeMine(coordinate);
                }
                if (cell.treasure()) {
                    board.placeTreasure(coordinate);
                }
            });
        } catch (IllegalStateException e) {
            throw new ConfigurationException("Saved game has a cell that is both mine and treasure", e);
        }
        if (board.getTreasureCount() == 0) {
            throw new ConfigurationException("Saved game contains no treasure");
        }
        if (board.getMineCount() != settings.mineCount() || board.getTreasureCount() != settings.treasureCount()) {
            throw new ConfigurationException("Saved cells do not match the saved mine and treasure counts");
        }
        if (settings.isFixed() && !FixedLayout.of(board.toLayoutMatrix()).equals(settings.layout())) {
            throw new ConfigurationException("Saved cells do not match the saved layout");
        }
        board.computeAdjacentMineCounts();

        int revealed = 0;
        int flagged = 0;
        for (int i = 0; i < saved.cells().size(); i++) {
            SavedGame.SavedCell cell = saved.cells().get(i);
            if (cell.revealed() && cell.flagged()) {
                throw new ConfigurationException("Saved cell " + i + " is both revealed and flagged");
            }
            revealed += cell.revealed() ? 1 : 0;
            flagged += cell.flagged() ? 1 : 0;
        }
        forEachCell(saved, (coordinate, cell) -> board.restoreCellState(coordinate, cell.flagged(), cell.revealed()));

        if (saved.clickedCount() != revealed || saved.flagCount() != flagged) {
            throw new ConfigurationException(String.format(
                    "Saved counters do not match cells: clicked %d vs %d revealed, flags %d vs %d flagged",
                    saved.clickedCount(), revealed, saved.flagCount(), flagged));
        }

        GameStatus implied = impliedStatus(board, revealed);
        if (saved.status() != implied) {
            throw new ConfigurationException(String.format(
                    "Saved status %s contradicts the cells, which imply %s", saved.status(), implied));
        }
        if (implied == GameStatus.NOT_STARTED && saved.startedAt() != null) {
            throw new ConfigurationException("Saved game has a start time but no revealed cell");
        }
        if (implied != GameStatus.NOT_STARTED && saved.startedAt() == null) {
            throw new ConfigurationException("Saved game has revealed cells but no start time");
        }
        return GameState.restore(board, settings, saved.clickedCount(), saved.flagCount(), saved.startedAt(), implied);
    }

    /**
     * Status the engine would have reached for these revealed cells: one mine means LOST,
     * one treasure or every safe cell means WON.
     */
    private GameStatus impliedStatus(Board board, int revealed) {
        int minesRevealed = 0;
        int treasuresRevealed = 0;
        int safeRevealed = 0;
        for (Cell cell : board.cells()) {
            if (!cell.isRevealed()) {
                continue;
            }
            if (cell.isMine()) {
                minesRevealed++;
            } else if (cell.isTreasure()) {
                treasuresRevealed++;
            } else {
                safeRevealed++;
            }
        }
        int terminalRevealed = minesRevealed + treasuresRevealed;
        boolean allSafeRevealed = board.getSafeCellCount() > 0 && safeRevealed == board.getSafeCellCount();
        if (terminalRevealed > 1) {
            throw new ConfigurationException("Saved game reveals more than one mine or treasure");
        }
        if (terminalRevealed == 1 && allSafeRevealed) {
            throw new ConfigurationException("Saved game continued after every safe cell was revealed");
        }
        if (minesRevealed == 1) {
            return GameStatus.LOST;
        }
        if (treasuresRevealed == 1 || allSafeRevealed) {
            return GameStatus.WON;
        }
        return revealed == 0 ? GameStatus.NOT_STARTED : GameStatus.IN_PROGRESS;
    }

    public String write(SavedGame saved) {
        try {
            return objectMapper.writeValueAsString(saved);
        } catch (JacksonException e) {
            throw new IllegalStateException("Could not serialize saved game", e);
        }
    }

    /**
     * @throws ConfigurationException if the JSON cannot be parsed
     */
    public SavedGame read(String json) {
        try {
            return objectMapper.readValue(json, SavedGame.class);
        } catch (JacksonException e) {
            log.warn("Rejected saved game: {}", e.getOriginalMessage());
            throw new ConfigurationException("Malformed saved game", e);
        }
    }

    private void forEachCell(SavedGame saved, BiConsumer<Coordinate, SavedGame.SavedCell> action) {
        for (int i = 0; i < saved.cells().size(); i++) {
            action.accept(new Coordinate(i / saved.columns(), i % saved.columns()), saved.cells().get(i));
        }
    }
}
