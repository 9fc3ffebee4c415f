package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.MatchInputSource;
import com.bracketeer.model.Round;
import com.bracketeer.model.RoundWithMatches;
import com.bracketeer.model.StageItemInput;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.Tournament;
import com.bracketeer.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SingleEliminationBuilder {

    private static final Comparator<StageItemInput> SLOT_ORDER =
            Comparator.comparing(StageItemInput::getSlot, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(StageItemInput::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final MatchRepository matchRepository;

    /**
     * Creates the matches of every round of a single elimination stage item and returns them in
     * round order.
     */
    public List<Match> build(StageItemWithRounds stageItem, Tournament tournament) {
        List<Round> rounds = stageItem.rounds().stream()
                .map(RoundWithMatches::round)
                .toList();
        return buildWinnersBracket(stageItem.id(), rounds, stageItem.inputs(), tournament).stream()
                .flatMap(List::stream)
                .toList();
    }

    /**
     * Builds and persists the bracket round by round, since each round refers to the ids of the
     * previous one. The result holds one match list per round.
     */
    List<List<Match>> buildWinnersBracket(
            Long stageItemId,
            List<Round> rounds,
            List<StageItemInput> inputs,
            Tournament tournament
    ) {
        if (rounds.isEmpty()) {
            throw new IllegalStateException("Elimination stage item " + stageItemId + " has no rounds");
        }

        List<List<Match>> matchesPerRound = new ArrayList<>(rounds.size());
        List<Match> previousMatches = matchRepository.saveAll(firstRoundMatches(rounds.get(0), inputs, tournament));
        matchesPerRound.add(previousMatches);
        for (Round round : rounds.subList(1, rounds.size())) {
            previousMatches = matchRepository.saveAll(subsequentRoundMatches(previousMatches, round, tournament));
            matchesPerRound.add(previousMatches);
        }
        return matchesPerRound;
    }

    public List<Match> firstRoundMatches(Round round, List<StageItemInput> inputs, Tournament tournament) {
        List<StageItemInput> seededInputs = new ArrayList<>(inputs);
        seededInputs.sort(SLOT_ORDER);

        int bracketSize = BracketSeeding.bracketSize(seededInputs.size());
        List<Integer> orderedSeeds = BracketSeeding.seedOrder(bracketSize);
        Map<Integer, Long> seedLookup = new HashMap<>();
        for (int i = 0; i < seededInputs.size(); i++) {
            seedLookup.put(i + 1, seededInputs.get(i).getId());
        }

        List<Match> matches = new ArrayList<>();
        for (int i = 0; i + 1 < orderedSeeds.size(); i += 2) {
            Long input1 = seedLookup.get(orderedSeeds.get(i));
            Long input2 = seedLookup.get(orderedSeeds.get(i + 1));

            if (input1 == null && input2 == null) {
                continue;
            }
            if (input1 == null) {
                input1 = input2;
                input2 = null;
            }

            Match match = newMatch(round, tournament);
            match.setInput1Source(MatchInputSource.direct(input1));
            match.setInput2Source(MatchInputSource.direct(input2));
            if (input2 == null) {
                match.setStageItemInput1Score(1);
            }
            matches.add(match);
        }
        return matches;
    }

    public List<Match> subsequentRoundMatches(List<Match> previousMatches, Round round, Tournament tournament) {
        if (previousMatches.size() % 2 != 0) {
            throw BracketValidationException.oddMatchCount(
                    "Cannot generate elimination round from an odd number of matches"
            );
        }

        List<Match> matches = new ArrayList<>(previousMatches.size() / 2);
        for (int i = 0; i < previousMatches.size(); i += 2) {
            Match match = newMatch(round, tournament);
            match.setInput1Source(MatchInputSource.winnerOf(previousMatches.get(i).getId()));
            match.setInput2Source(MatchInputSource.winnerOf(previousMatches.get(i + 1).getId()));
            matches.add(match);
        }
        return matches;
    }

    static Match newMatch(Round round, Tournament tournament) {
        Match match = new Match();
        match.setRoundId(round.getId());
        match.setDurationMinutes(tournament.getDurationMinutes());
        match.setMarginMinutes(tournament.getMarginMinutes());
        return match;
    }
}
