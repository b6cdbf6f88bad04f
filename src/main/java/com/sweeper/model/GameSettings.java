package com.sweeper.model;

/**
 * Construction parameters of a game, kept so a restart can rebuild it.
 * <p>
 * In fixed mode {@code layout} is set and the counts are derived from it.
 *
 * @param rows          board height
 * @param columns       board width
 * @param mineCount     mines to place
 * @param treasureCount treasures to place
 * @param layout        externally supplied layout, or {@code null} for random placement
 */
public record GameSettings(int rows, int columns, int mineCount, int treasureCount, FixedLayout layout) {

    public static GameSettings random(int rows, int columns, int mineCount, int treasureCount) {
        return new GameSettings(rows, columns, mineCount, treasureCount, null);
    }

    public static GameSettings fixed(FixedLayout layout) {
        return new GameSettings(layout.getRows(), layout.getColumns(),
                layout.count(FixedLayout.MINE), layout.count(FixedLayout.TREASURE), layout);
    }

    public boolean isFixed() {
        return layout != null;
    }
}
