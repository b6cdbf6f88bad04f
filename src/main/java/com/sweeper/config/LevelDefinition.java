package com.sweeper.config;

import java.util.List;

/**
 * A playable level, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "classic"
 * @param name        human-readable name
 * @param description short description
 * @param rows        board height
 * @param columns     board width
 * @param mines       mines placed at random; ignored when {@code layout} is set
 * @param treasures   treasures placed at random; ignored when {@code layout} is set
 * @param layout      optional fixed layout, one comma-separated line per row
 */
public record LevelDefinition(
        String id,
        String name,
        String description,
        int rows,
        int columns,
        int mines,
        int treasures,
        List<String> layout
) {

    public boolean hasLayout() {
        return layout != null && !layout.isEmpty();
    }

    public String layoutText() {
        return hasLayout() ? String.join("\n", layout) : "";
    }
}
