package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.Round;
import com.bracketeer.model.RoundWithMatches;
import com.bracketeer.model.StageItem;
import com.bracketeer.model.StageItemInput;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageType;
import com.bracketeer.model.Tournament;
import com.bracketeer.repository.MatchRepository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.lenient;

/**
 * In-memory tournaments, stage items and match graphs for service tests.
 */
final class BracketTestData {

    static final Long TOURNAMENT_ID = 1L;
    static final OffsetDateTime TOURNAMENT_START = OffsetDateTime.parse("2026-03-14T09:00:00Z");

    private BracketTestData() {
    }

    static Tournament tournament() {
        Tournament tournament = new Tournament();
        tournament.setId(TOURNAMENT_ID);
        tournament.setName("Spring Open");
        tournament.setStartTime(TOURNAMENT_START);
        tournament.setDurationMinutes(15);
        tournament.setMarginMinutes(5);
        return tournament;
    }

    static StageItem stageItem(Long id, StageType type, int teamCount) {
        StageItem stageItem = new StageItem();
        stageItem.setId(id);
        stageItem.setStageId(1L);
        stageItem.setName("Group " + id);
        stageItem.setType(type);
        stageItem.setTeamCount(teamCount);
        return stageItem;
    }

    /**
     * Inputs for slots 1..count; the input of slot n has id 100 + n.
     */
    static List<StageItemInput> inputs(Long stageItemId, int count) {
        List<StageItemInput> inputs = new ArrayList<>(count);
        for (int slot = 1; slot <= count; slot++) {
            StageItemInput input = new StageItemInput();
            input.setId(inputId(slot));
            input.setTournamentId(TOURNAMENT_ID);
            input.setStageItemId(stageItemId);
            input.setSlot(slot);
            input.setTeamId(1_000L + slot);
            inputs.add(input);
        }
        return inputs;
    }

    static Long inputId(int slot) {
        return 100L + slot;
    }

    /**
     * Rounds with ids 11, 12, ... for the given stage item.
     */
    static List<Round> rounds(Long stageItemId, int count) {
        List<Round> rounds = new ArrayList<>(count);
        for (int index = 1; index <= count; index++) {
            Round round = new Round();
            round.setId(10L + index);
            round.setStageItemId(stageItemId);
            round.setName("Round " + index);
            rounds.add(round);
        }
        return rounds;
    }

    static StageItemWithRounds graph(
            StageItem stageItem,
            List<StageItemInput> inputs,
            List<Round> rounds,
            List<Match> matches
    ) {
        Map<Long, List<Match>> matchesByRound = matches.stream()
                .collect(Collectors.groupingBy(Match::getRoundId));
        List<RoundWithMatches> roundsWithMatches = rounds.stream()
                .map(round -> new RoundWithMatches(round, matchesByRound.getOrDefault(round.getId(), List.of())))
                .toList();
        return new StageItemWithRounds(stageItem, inputs, roundsWithMatches);
    }

    static Match match(Long id, Long roundId) {
        Match match = new Match();
        match.setId(id);
        match.setRoundId(roundId);
        match.setDurationMinutes(15);
        match.setMarginMinutes(5);
        return match;
    }

    static Match matchById(StageItemWithRounds stageItem, Long matchId) {
        return stageItem.allMatches().stream()
                .filter(match -> match.getId().equals(matchId))
                .findFirst()
                .orElseThrow();
    }

    /**
     * Makes the mocked repository hand out ids from {@code ids} the way the database would.
     */
    static void assignIdsOnSave(MatchRepository matchRepository, AtomicLong ids) {
        lenient().when(matchRepository.saveAll(anyIterable())).thenAnswer(invocation -> {
            Iterable<Match> matches = invocation.getArgument(0);
            List<Match> saved = new ArrayList<>();
            for (Match match : matches) {
                if (match.getId() == null) {
                    match.setId(ids.incrementAndGet());
                }
                saved.add(match);
            }
            return saved;
        });
        lenient().when(matchRepository.save(any(Match.class))).thenAnswer(invocation -> {
            Match match = invocation.getArgument(0);
            if (match.getId() == null) {
                match.setId(ids.incrementAndGet());
            }
            return match;
        });
    }

    static void score(Match match, int input1Score, int input2Score) {
        match.setStageItemInput1Score(input1Score);
        match.setStageItemInput2Score(input2Score);
    }
}
