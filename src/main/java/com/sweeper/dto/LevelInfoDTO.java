package com.sweeper.dto;

import com.sweeper.config.LevelDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for exposing available level information.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LevelInfoDTO {

    private String id;
    private String name;
    private String description;
    private int rows;
    private int columns;
    private int mines;
    private int treasures;
    private boolean fixedLayout;

    public static LevelInfoDTO fromDefinition(LevelDefinition def) {
        return LevelInfoDTO.builder()
                .id(def.id())
                .name(def.name())
                .description(def.description())
                .rows(def.rows())
                .columns(def.columns())
                .mines(def.mines())
                .treasures(def.treasures())
                .fixedLayout(def.hasLayout())
                .build();
    }
}
