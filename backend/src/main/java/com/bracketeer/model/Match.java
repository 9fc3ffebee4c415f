package com.bracketeer.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Node of a stage item's match graph.
 * <p>
 * Each side stores its source (a stage item input, or the winner/loser of an earlier match) and the
 * resolved {@code stageItemInput*Id}. For direct sources the two coincide; for match references the
 * resolved id is filled in by result propagation. Scores of 0/0 mean the match is not played yet.
 */
@Getter
@Setter
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_id", nullable = false, updatable = false)
    private Long roundId;

    @Column(name = "stage_item_input1_id")
    private Long stageItemInput1Id;

    @Column(name = "stage_item_input2_id")
    private Long stageItemInput2Id;

    @Column(name = "stage_item_input1_winner_from_match_id")
    private Long stageItemInput1WinnerFromMatchId;

    @Column(name = "stage_item_input2_winner_from_match_id")
    private Long stageItemInput2WinnerFromMatchId;

    @Column(name = "stage_item_input1_loser_from_match_id")
    private Long stageItemInput1LoserFromMatchId;

    @Column(name = "stage_item_input2_loser_from_match_id")
    private Long stageItemInput2LoserFromMatchId;

    @Column(name = "stage_item_input1_score", nullable = false)
    private int stageItemInput1Score = 0;

    @Column(name = "stage_item_input2_score", nullable = false)
    private int stageItemInput2Score = 0;

    @Column(name = "court_id")
    private Long courtId;

    @Column(name = "start_time")
    private OffsetDateTime startTime;

    @Column(name = "position_in_schedule")
    private Integer positionInSchedule;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "margin_minutes", nullable = false)
    private int marginMinutes;

    @Column(name = "custom_duration_minutes")
    private Integer customDurationMinutes;

    @Column(name = "custom_margin_minutes")
    private Integer customMarginMinutes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public MatchInputSource getInput1Source() {
        return sourceOf(stageItemInput1WinnerFromMatchId, stageItemInput1LoserFromMatchId, stageItemInput1Id);
    }

    public MatchInputSource getInput2Source() {
        return sourceOf(stageItemInput2WinnerFromMatchId, stageItemInput2LoserFromMatchId, stageItemInput2Id);
    }

    public void setInput1Source(MatchInputSource source) {
        stageItemInput1WinnerFromMatchId = referenceOf(source, MatchInputSource.Kind.WINNER_OF);
        stageItemInput1LoserFromMatchId = referenceOf(source, MatchInputSource.Kind.LOSER_OF);
        stageItemInput1Id = referenceOf(source, MatchInputSource.Kind.DIRECT);
    }

    public void setInput2Source(MatchInputSource source) {
        stageItemInput2WinnerFromMatchId = referenceOf(source, MatchInputSource.Kind.WINNER_OF);
        stageItemInput2LoserFromMatchId = referenceOf(source, MatchInputSource.Kind.LOSER_OF);
        stageItemInput2Id = referenceOf(source, MatchInputSource.Kind.DIRECT);
    }

    public boolean hasInput1() {
        return stageItemInput1Id != null;
    }

    public boolean hasInput2() {
        return stageItemInput2Id != null;
    }

    public boolean isPlayed() {
        return stageItemInput1Score != 0 || stageItemInput2Score != 0;
    }

    public boolean isScheduled() {
        return startTime != null && courtId != null;
    }

    private static MatchInputSource sourceOf(Long winnerFromMatchId, Long loserFromMatchId, Long inputId) {
        if (winnerFromMatchId != null) {
            return MatchInputSource.winnerOf(winnerFromMatchId);
        }
        if (loserFromMatchId != null) {
            return MatchInputSource.loserOf(loserFromMatchId);
        }
        return MatchInputSource.direct(inputId);
    }

    private static Long referenceOf(MatchInputSource source, MatchInputSource.Kind kind) {
        return source != null && source.kind() == kind ? source.referenceId() : null;
    }
}
