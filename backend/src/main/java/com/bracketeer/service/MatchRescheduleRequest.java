package com.bracketeer.service;

/**
 * A drag-and-drop move of a scheduled match from one court slot to another.
 */
public record MatchRescheduleRequest(
        Long oldCourtId,
        int oldPosition,
        Long newCourtId,
        int newPosition
) {
    public MatchRescheduleRequest {
        if (oldCourtId == null || newCourtId == null) {
            throw new IllegalArgumentException("Reschedule request requires both old and new court ids");
        }
    }

    public boolean isNoOp() {
        return oldPosition == newPosition && oldCourtId.equals(newCourtId);
    }
}
