package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.MatchInputSource;
import com.bracketeer.model.Round;
import com.bracketeer.model.RoundWithMatches;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.Tournament;
import com.bracketeer.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a double elimination stage item. The expected round layout is the winners bracket rounds,
 * then {@code 2 * winners - 2} losers bracket rounds, then the grand final and its reset.
 * <p>
 * Losers round 1 pairs the losers of winners round 1. After that, every later winners round feeds
 * its losers into a cross round against the surviving losers bracket players, and all but the
 * last cross round are followed by a consolidation round that halves the field again.
 */
@Component
@RequiredArgsConstructor
public class DoubleEliminationBuilder {

    private final SingleEliminationBuilder singleEliminationBuilder;
    private final MatchRepository matchRepository;

    public List<Match> build(StageItemWithRounds stageItem, Tournament tournament) {
        int teamCount = stageItem.stageItem().getTeamCount();
        BracketSeeding.validateTeamCount(teamCount, BracketSeeding.MIN_DOUBLE_ELIMINATION_TEAM_COUNT);

        int winnersRoundCount = BracketSeeding.singleEliminationRoundCount(teamCount);
        int losersRoundCount = BracketSeeding.losersRoundCount(winnersRoundCount);
        int totalRoundCount = winnersRoundCount + losersRoundCount + 2;

        List<Round> rounds = stageItem.rounds().stream()
                .map(RoundWithMatches::round)
                .toList();
        if (rounds.size() != totalRoundCount) {
            throw BracketValidationException.roundCountMismatch(
                    "Double elimination for " + teamCount + " teams expects " + totalRoundCount + " rounds"
            );
        }

        List<Round> winnersRounds = rounds.subList(0, winnersRoundCount);
        List<Round> losersRounds = rounds.subList(winnersRoundCount, winnersRoundCount + losersRoundCount);
        Round grandFinalRound = rounds.get(totalRoundCount - 2);
        Round grandFinalResetRound = rounds.get(totalRoundCount - 1);

        List<Match> created = new ArrayList<>();
        List<List<Match>> winnersMatchesPerRound = singleEliminationBuilder.buildWinnersBracket(
                stageItem.id(),
                winnersRounds,
                stageItem.inputs(),
                tournament
        );
        winnersMatchesPerRound.forEach(created::addAll);

        int losersRoundCursor = 0;
        List<Match> losersMatches = matchRepository.saveAll(
                matchesFromLosers(winnersMatchesPerRound.get(0), losersRounds.get(losersRoundCursor), tournament)
        );
        created.addAll(losersMatches);
        losersRoundCursor++;

        for (int winnersRoundIndex = 1; winnersRoundIndex < winnersRoundCount; winnersRoundIndex++) {
            losersMatches = matchRepository.saveAll(loserWinnerCrossMatches(
                    losersMatches,
                    winnersMatchesPerRound.get(winnersRoundIndex),
                    losersRounds.get(losersRoundCursor),
                    tournament
            ));
            created.addAll(losersMatches);
            losersRoundCursor++;

            boolean lastWinnersRound = winnersRoundIndex == winnersRoundCount - 1;
            if (!lastWinnersRound) {
                losersMatches = matchRepository.saveAll(singleEliminationBuilder.subsequentRoundMatches(
                        losersMatches,
                        losersRounds.get(losersRoundCursor),
                        tournament
                ));
                created.addAll(losersMatches);
                losersRoundCursor++;
            }
        }

        if (losersRoundCursor != losersRounds.size()) {
            throw BracketValidationException.bracketConstructionIncomplete(
                    "Failed to construct all loser bracket rounds"
            );
        }

        List<Match> winnersFinalRound = winnersMatchesPerRound.get(winnersMatchesPerRound.size() - 1);
        Match grandFinal = matchRepository.save(
                grandFinal(winnersFinalRound.get(0), losersMatches.get(0), grandFinalRound, tournament)
        );
        created.add(grandFinal);
        created.add(matchRepository.save(grandFinalReset(grandFinal, grandFinalResetRound, tournament)));
        return created;
    }

    public List<Match> matchesFromLosers(List<Match> sourceMatches, Round round, Tournament tournament) {
        if (sourceMatches.size() % 2 != 0) {
            throw BracketValidationException.oddMatchCount(
                    "Cannot generate losers round from an odd number of matches"
            );
        }

        List<Match> matches = new ArrayList<>(sourceMatches.size() / 2);
        for (int i = 0; i < sourceMatches.size(); i += 2) {
            Match match = SingleEliminationBuilder.newMatch(round, tournament);
            match.setInput1Source(MatchInputSource.loserOf(sourceMatches.get(i).getId()));
            match.setInput2Source(MatchInputSource.loserOf(sourceMatches.get(i + 1).getId()));
            matches.add(match);
        }
        return matches;
    }

    public List<Match> loserWinnerCrossMatches(
            List<Match> losersMatches,
            List<Match> winnersMatches,
            Round round,
            Tournament tournament
    ) {
        if (losersMatches.size() != winnersMatches.size()) {
            throw BracketValidationException.bracketShapeMismatch("Double elimination bracket shape mismatch");
        }

        List<Match> matches = new ArrayList<>(losersMatches.size());
        for (int i = 0; i < losersMatches.size(); i++) {
            Match match = SingleEliminationBuilder.newMatch(round, tournament);
            match.setInput1Source(MatchInputSource.winnerOf(losersMatches.get(i).getId()));
            match.setInput2Source(MatchInputSource.loserOf(winnersMatches.get(i).getId()));
            matches.add(match);
        }
        return matches;
    }

    Match grandFinal(Match winnersFinal, Match losersFinal, Round round, Tournament tournament) {
        Match match = SingleEliminationBuilder.newMatch(round, tournament);
        match.setInput1Source(MatchInputSource.winnerOf(winnersFinal.getId()));
        match.setInput2Source(MatchInputSource.winnerOf(losersFinal.getId()));
        return match;
    }

    Match grandFinalReset(Match grandFinal, Round round, Tournament tournament) {
        Match match = SingleEliminationBuilder.newMatch(round, tournament);
        match.setInput1Source(MatchInputSource.winnerOf(grandFinal.getId()));
        match.setInput2Source(MatchInputSource.loserOf(grandFinal.getId()));
        return match;
    }
}
