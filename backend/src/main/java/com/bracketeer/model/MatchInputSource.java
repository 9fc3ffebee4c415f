package com.bracketeer.model;

import java.util.Objects;

/**
 * Where one side of a match takes its participant from.
 */
public record MatchInputSource(Kind kind, Long referenceId) {

    private static final MatchInputSource EMPTY = new MatchInputSource(Kind.EMPTY, null);

    public enum Kind {
        EMPTY,
        DIRECT,
        WINNER_OF,
        LOSER_OF
    }

    public MatchInputSource {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.EMPTY && referenceId != null) {
            throw new IllegalArgumentException("Empty input source cannot carry a reference");
        }
        if (kind != Kind.EMPTY && referenceId == null) {
            throw new IllegalArgumentException("Input source " + kind + " requires a reference id");
        }
    }

    public static MatchInputSource empty() {
        return EMPTY;
    }

    public static MatchInputSource direct(Long stageItemInputId) {
        return stageItemInputId == null ? EMPTY : new MatchInputSource(Kind.DIRECT, stageItemInputId);
    }

    public static MatchInputSource winnerOf(Long matchId) {
        return new MatchInputSource(Kind.WINNER_OF, matchId);
    }

    public static MatchInputSource loserOf(Long matchId) {
        return new MatchInputSource(Kind.LOSER_OF, matchId);
    }

    public boolean isMatchReference() {
        return kind == Kind.WINNER_OF || kind == Kind.LOSER_OF;
    }
}
