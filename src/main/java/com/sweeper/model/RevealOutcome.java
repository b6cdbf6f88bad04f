package com.sweeper.model;

import lombok.Value;

import java.util.List;

/**
 * Result of revealing one cell.
 */
@Value
public class RevealOutcome {

    public enum Type {
        /** Cell was already revealed or carries a flag; nothing changed. */
        ALREADY_REVEALED_OR_FLAGGED,
        HIT_MINE,
        FOUND_TREASURE,
        REVEALED
    }

    Type type;

    /** Cells revealed by this call, starting cell first. Empty for a no-op. */
    List<Coordinate> revealedCells;

    public static RevealOutcome alreadyRevealedOrFlagged() {
        return new RevealOutcome(Type.ALREADY_REVEALED_OR_FLAGGED, List.of());
    }

    public static RevealOutcome hitMine(Coordinate coordinate) {
        return new RevealOutcome(Type.HIT_MINE, List.of(coordinate));
    }

    public static RevealOutcome foundTreasure(Coordinate coordinate) {
        return new RevealOutcome(Type.FOUND_TREASURE, List.of(coordinate));
    }

    public static RevealOutcome revealed(List<Coordinate> cells) {
        return new RevealOutcome(Type.REVEALED, List.copyOf(cells));
    }

    public boolean isNoOp() {
        return type == Type.ALREADY_REVEALED_OR_FLAGGED;
    }
}
