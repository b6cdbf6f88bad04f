package com.sweeper.service;

import com.sweeper.dto.CellDTO;
import com.sweeper.dto.GameSnapshotDTO;
import com.sweeper.model.GameStatus;

import java.util.List;

/**
 * Callbacks for presentation adapters. Every method defaults to a no-op so an
 * adapter overrides only what it renders.
 * <p>
 * Observers receive read-only views and must not call back into the session
 * that notified them.
 */
public interface CellObserver {

    default void onCellsRevealed(String sessionId, List<CellDTO> cells) {
    }

    default void onFlagChanged(String sessionId, CellDTO cell, int flagCount) {
    }

    default void onGameOver(String sessionId, GameStatus status) {
    }

    default void onRestarted(String sessionId, GameSnapshotDTO snapshot) {
    }
}
