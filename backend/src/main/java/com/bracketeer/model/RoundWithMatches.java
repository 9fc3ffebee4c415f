package com.bracketeer.model;

import java.util.List;

public record RoundWithMatches(
        Round round,
        List<Match> matches
) {
    public Long id() {
        return round.getId();
    }
}
