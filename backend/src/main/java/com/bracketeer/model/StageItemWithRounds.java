package com.bracketeer.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A stage item together with its inputs and its rounds (ordered by id), each round carrying its
 * matches (ordered by id).
 */
public record StageItemWithRounds(
        StageItem stageItem,
        List<StageItemInput> inputs,
        List<RoundWithMatches> rounds
) {
    public StageItemWithRounds {
        inputs = List.copyOf(inputs);
        rounds = rounds.stream()
                .sorted(Comparator.comparing(RoundWithMatches::id))
                .toList();
    }

    public Long id() {
        return stageItem.getId();
    }

    public Optional<RoundWithMatches> findRound(Long roundId) {
        return rounds.stream()
                .filter(round -> round.id().equals(roundId))
                .findFirst();
    }

    public List<Match> allMatches() {
        return rounds.stream()
                .flatMap(round -> round.matches().stream())
                .toList();
    }
}
