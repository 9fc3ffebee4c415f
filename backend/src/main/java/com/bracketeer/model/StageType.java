package com.bracketeer.model;

public enum StageType {
    SINGLE_ELIMINATION,
    DOUBLE_ELIMINATION,
    ROUND_ROBIN,
    REGULAR_SEASON_MATCHUP,
    SWISS;

    public boolean isElimination() {
        return this == SINGLE_ELIMINATION || this == DOUBLE_ELIMINATION;
    }
}
