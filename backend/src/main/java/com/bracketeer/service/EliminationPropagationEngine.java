package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.MatchInputSource;
import com.bracketeer.model.RoundWithMatches;
import com.bracketeer.model.StageItemWithRounds;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Works out how results in one round change the inputs of later rounds of an elimination stage
 * item. Entering a winner influences subsequent rounds because of the tree-like structure of the
 * bracket; a single call follows the references forward through every later round.
 */
@Component
public class EliminationPropagationEngine {

    public Map<Long, InputUpdate> determineInputUpdates(Long roundId, StageItemWithRounds stageItem) {
        RoundWithMatches round = requireRound(roundId, stageItem);
        Set<Long> matchIds = round.matches().stream()
                .map(Match::getId)
                .collect(Collectors.toSet());
        return determineInputUpdates(roundId, stageItem, matchIds);
    }

    /**
     * @param matchIds the matches of {@code roundId} whose results changed; they are the cause of
     *                 the updates and never part of the result
     * @return new resolved inputs keyed by match id, in the order the matches were visited
     */
    public Map<Long, InputUpdate> determineInputUpdates(
            Long roundId,
            StageItemWithRounds stageItem,
            Set<Long> matchIds
    ) {
        RoundWithMatches currentRound = requireRound(roundId, stageItem);

        Map<Long, ResolvedMatch> affectedMatches = new LinkedHashMap<>();
        for (Match match : currentRound.matches()) {
            if (matchIds.contains(match.getId())) {
                affectedMatches.put(match.getId(), ResolvedMatch.of(match));
            }
        }

        List<Match> subsequentMatches = stageItem.rounds().stream()
                .filter(round -> round.id() > roundId)
                .flatMap(round -> round.matches().stream())
                .toList();

        Map<Long, InputUpdate> updates = new LinkedHashMap<>();
        for (Match subsequentMatch : subsequentMatches) {
            Long input1 = resolveSide(subsequentMatch.getInput1Source(), subsequentMatch.getStageItemInput1Id(), affectedMatches);
            Long input2 = resolveSide(subsequentMatch.getInput2Source(), subsequentMatch.getStageItemInput2Id(), affectedMatches);

            if (!Objects.equals(input1, subsequentMatch.getStageItemInput1Id())
                    || !Objects.equals(input2, subsequentMatch.getStageItemInput2Id())) {
                affectedMatches.put(subsequentMatch.getId(), new ResolvedMatch(subsequentMatch, input1, input2));
                if (!matchIds.contains(subsequentMatch.getId())) {
                    updates.put(
                            subsequentMatch.getId(),
                            new InputUpdate(subsequentMatch.getId(), subsequentMatch.getRoundId(), input1, input2)
                    );
                }
            }
        }
        return updates;
    }

    private static Long resolveSide(
            MatchInputSource source,
            Long currentInputId,
            Map<Long, ResolvedMatch> affectedMatches
    ) {
        if (!source.isMatchReference()) {
            return currentInputId;
        }
        ResolvedMatch upstream = affectedMatches.get(source.referenceId());
        if (upstream == null) {
            return currentInputId;
        }
        return source.kind() == MatchInputSource.Kind.WINNER_OF ? upstream.winner() : upstream.loser();
    }

    private static RoundWithMatches requireRound(Long roundId, StageItemWithRounds stageItem) {
        return stageItem.findRound(roundId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Round " + roundId + " does not belong to stage item " + stageItem.id()
                ));
    }

    public record InputUpdate(
            Long matchId,
            Long roundId,
            Long stageItemInput1Id,
            Long stageItemInput2Id
    ) {
        public void applyTo(Match match) {
            match.setStageItemInput1Id(stageItemInput1Id);
            match.setStageItemInput2Id(stageItemInput2Id);
        }
    }

    /**
     * A match as seen by the current pass: its scores, with inputs that may already reflect updates
     * made earlier in the same pass.
     */
    private record ResolvedMatch(Match match, Long input1Id, Long input2Id) {

        static ResolvedMatch of(Match match) {
            return new ResolvedMatch(match, match.getStageItemInput1Id(), match.getStageItemInput2Id());
        }

        Long winner() {
            int score1 = match.getStageItemInput1Score();
            int score2 = match.getStageItemInput2Score();
            if (score1 == score2) {
                return null;
            }
            return score1 > score2 ? input1Id : input2Id;
        }

        Long loser() {
            int score1 = match.getStageItemInput1Score();
            int score2 = match.getStageItemInput2Score();
            if (score1 == score2) {
                return null;
            }
            return score1 > score2 ? input2Id : input1Id;
        }
    }
}
