package com.bracketeer.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracket sizing and classic seed ordering for elimination stage items.
 */
public final class BracketSeeding {

    public static final int MAX_ELIMINATION_TEAM_COUNT = 64;
    static final int MIN_SINGLE_ELIMINATION_TEAM_COUNT = 2;
    static final int MIN_DOUBLE_ELIMINATION_TEAM_COUNT = 3;

    private BracketSeeding() {
    }

    /**
     * Smallest power of two that fits {@code teamCount} participants, or 0 for an empty field.
     */
    public static int bracketSize(int teamCount) {
        if (teamCount < 1) {
            return 0;
        }
        int size = 1;
        while (size < teamCount) {
            size <<= 1;
        }
        return size;
    }

    /**
     * Seed sequence in bracket order, e.g. {@code [1, 8, 4, 5, 2, 7, 3, 6]} for a bracket of 8.
     * Adjacent pairs meet in the first round.
     */
    public static List<Integer> seedOrder(int bracketSize) {
        if (bracketSize <= 1) {
            return List.of(1);
        }

        List<Integer> previous = seedOrder(bracketSize / 2);
        List<Integer> seeds = new ArrayList<>(bracketSize);
        for (int seed : previous) {
            seeds.add(seed);
            seeds.add(bracketSize + 1 - seed);
        }
        return List.copyOf(seeds);
    }

    public static int singleEliminationRoundCount(int teamCount) {
        if (teamCount < 1) {
            return 0;
        }
        validateTeamCount(teamCount, MIN_SINGLE_ELIMINATION_TEAM_COUNT);
        return Integer.numberOfTrailingZeros(bracketSize(teamCount));
    }

    public static int doubleEliminationRoundCount(int teamCount) {
        if (teamCount < 1) {
            return 0;
        }
        validateTeamCount(teamCount, MIN_DOUBLE_ELIMINATION_TEAM_COUNT);
        int winnersRoundCount = singleEliminationRoundCount(teamCount);
        return winnersRoundCount + losersRoundCount(winnersRoundCount) + 2;
    }

    static int losersRoundCount(int winnersRoundCount) {
        return 2 * winnersRoundCount - 2;
    }

    static void validateTeamCount(int teamCount, int minimum) {
        if (teamCount < minimum || teamCount > MAX_ELIMINATION_TEAM_COUNT) {
            throw BracketValidationException.teamCountOutOfBounds(minimum, MAX_ELIMINATION_TEAM_COUNT);
        }
    }
}
