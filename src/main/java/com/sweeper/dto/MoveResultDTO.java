package com.sweeper.dto;

import com.sweeper.model.Coordinate;
import com.sweeper.model.FlagOutcome;
import com.sweeper.model.RevealOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a reveal or flag move together with the resulting game view.
 */
@Value
@Builder
public class MoveResultDTO {

    /** Outcome name, e.g. {@code REVEALED}, {@code HIT_MINE}, {@code FLAGGED}. */
    String outcome;
    List<Coordinate> changedCells;
    GameSnapshotDTO game;

    public static MoveResultDTO fromReveal(RevealOutcome outcome, GameSnapshotDTO game) {
        return MoveResultDTO.builder()
                .outcome(outcome.getType().name())
                .changedCells(outcome.getRevealedCells())
                .game(game)
                .build();
    }

    public static MoveResultDTO fromFlag(FlagOutcome outcome, GameSnapshotDTO game) {
        return MoveResultDTO.builder()
                .outcome(outcome.getType().name())
                .changedCells(outcome.isChanged() ? List.of(outcome.getCoordinate()) : List.of())
                .game(game)
                .build();
    }
}
