package com.sweeper.model;

import lombok.Value;

/**
 * Result of toggling the flag on one cell.
 */
@Value
public class FlagOutcome {

    public enum Type {
        FLAGGED,
        UNFLAGGED,
        /** Cell is revealed; flags cannot be placed on it. */
        IGNORED
    }

    Type type;
    Coordinate coordinate;
    int flagCount;

    public boolean isChanged() {
        return type != Type.IGNORED;
    }
}
