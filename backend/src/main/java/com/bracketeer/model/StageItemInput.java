package com.bracketeer.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

/**
 * A seeded slot of a stage item. Final inputs are bound to a team, tentative inputs refer to the
 * team that finishes at {@code winnerPosition} of an upstream stage item, and inputs with neither
 * are placeholders.
 */
@Getter
@Setter
@Entity
@Table(
        name = "stage_item_inputs",
        uniqueConstraints = @UniqueConstraint(columnNames = {"stage_item_id", "slot"})
)
public class StageItemInput {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private Long tournamentId;

    @Column(name = "stage_item_id", nullable = false, updatable = false)
    private Long stageItemId;

    @Column(name = "slot", nullable = false)
    private Integer slot;

    @Column(name = "team_id")
    private Long teamId;

    @Column(name = "winner_from_stage_item_id")
    private Long winnerFromStageItemId;

    @Column(name = "winner_position")
    private Integer winnerPosition;

    public boolean isFinal() {
        return teamId != null;
    }

    public boolean isTentative() {
        return teamId == null && winnerFromStageItemId != null && winnerPosition != null;
    }
}
