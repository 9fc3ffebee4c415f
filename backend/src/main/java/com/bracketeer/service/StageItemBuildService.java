package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.Round;
import com.bracketeer.model.StageItem;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageType;
import com.bracketeer.model.Tournament;
import com.bracketeer.repository.MatchRepository;
import com.bracketeer.repository.RoundRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates the rounds and matches of a new stage item and settles its initial byes.
 */
@Service
public class StageItemBuildService {

    private static final Logger log = LoggerFactory.getLogger(StageItemBuildService.class);

    private final TournamentGraphLoader tournamentGraphLoader;
    private final RoundRepository roundRepository;
    private final MatchRepository matchRepository;
    private final SingleEliminationBuilder singleEliminationBuilder;
    private final DoubleEliminationBuilder doubleEliminationBuilder;
    private final MatchProgressionService matchProgressionService;
    private final Optional<RoundRobinMatchGenerator> roundRobinMatchGenerator;

    public StageItemBuildService(
            TournamentGraphLoader tournamentGraphLoader,
            RoundRepository roundRepository,
            MatchRepository matchRepository,
            SingleEliminationBuilder singleEliminationBuilder,
            DoubleEliminationBuilder doubleEliminationBuilder,
            MatchProgressionService matchProgressionService,
            Optional<RoundRobinMatchGenerator> roundRobinMatchGenerator
    ) {
        this.tournamentGraphLoader = tournamentGraphLoader;
        this.roundRepository = roundRepository;
        this.matchRepository = matchRepository;
        this.singleEliminationBuilder = singleEliminationBuilder;
        this.doubleEliminationBuilder = doubleEliminationBuilder;
        this.matchProgressionService = matchProgressionService;
        this.roundRobinMatchGenerator = roundRobinMatchGenerator;
    }

    @Transactional
    public StageItemWithRounds buildBracketForStageItem(Long tournamentId, Long stageItemId) {
        Tournament tournament = tournamentGraphLoader.lockTournament(tournamentId);
        StageItem stageItem = tournamentGraphLoader.loadStageItem(tournamentId, stageItemId).stageItem();

        List<Long> existingRoundIds = roundRepository.findByStageItemIdOrderByIdAsc(stageItemId).stream()
                .map(Round::getId)
                .toList();
        if (!existingRoundIds.isEmpty() && matchRepository.existsByRoundIdIn(existingRoundIds)) {
            throw new IllegalStateException("Stage item " + stageItemId + " already has matches");
        }

        List<String> roundNames = roundNames(stageItem);
        if (existingRoundIds.isEmpty()) {
            roundRepository.saveAll(newRounds(stageItemId, roundNames));
        } else if (existingRoundIds.size() != roundNames.size()) {
            throw BracketValidationException.roundCountMismatch(
                    "Stage item " + stageItemId + " has " + existingRoundIds.size()
                            + " rounds, expected " + roundNames.size()
            );
        }

        StageItemWithRounds stageItemWithRounds = tournamentGraphLoader.loadStageItem(tournamentId, stageItemId);
        List<Match> created = switch (stageItem.getType()) {
            case SINGLE_ELIMINATION -> singleEliminationBuilder.build(stageItemWithRounds, tournament);
            case DOUBLE_ELIMINATION -> doubleEliminationBuilder.build(stageItemWithRounds, tournament);
            case ROUND_ROBIN, REGULAR_SEASON_MATCHUP ->
                    matchRepository.saveAll(requireRoundRobinGenerator(stageItem).generateMatches(stageItemWithRounds, tournament));
            case SWISS -> List.of();
        };

        if (stageItem.getType().isElimination()) {
            matchProgressionService.updateInputsInCompleteStageItem(tournamentId, stageItemId);
            matchProgressionService.autoAdvanceByes(tournamentId, stageItemId);
        }

        log.info(
                "Built {} stage item {} with {} round(s) and {} match(es)",
                stageItem.getType(),
                stageItemId,
                roundNames.size(),
                created.size()
        );
        return tournamentGraphLoader.loadStageItem(tournamentId, stageItemId);
    }

    /**
     * Round names in creation order; rounds are ordered by id, so this is also bracket order.
     * Swiss stage items start without rounds, they are added one at a time.
     */
    List<String> roundNames(StageItem stageItem) {
        int teamCount = stageItem.getTeamCount();
        return switch (stageItem.getType()) {
            case SINGLE_ELIMINATION -> numbered("Round", BracketSeeding.singleEliminationRoundCount(teamCount));
            case DOUBLE_ELIMINATION -> {
                BracketSeeding.validateTeamCount(teamCount, BracketSeeding.MIN_DOUBLE_ELIMINATION_TEAM_COUNT);
                int winnersRoundCount = BracketSeeding.singleEliminationRoundCount(teamCount);
                List<String> names = new ArrayList<>(numbered("WB Round", winnersRoundCount));
                names.addAll(numbered("LB Round", BracketSeeding.losersRoundCount(winnersRoundCount)));
                names.add("Grand Final");
                names.add("Grand Final Reset");
                yield names;
            }
            case ROUND_ROBIN, REGULAR_SEASON_MATCHUP ->
                    numbered("Round", requireRoundRobinGenerator(stageItem).roundCount(teamCount));
            case SWISS -> List.of();
        };
    }

    private RoundRobinMatchGenerator requireRoundRobinGenerator(StageItem stageItem) {
        return roundRobinMatchGenerator.orElseThrow(() -> BracketValidationException.pairingGeneratorMissing(
                "No round robin match generator configured for stage item " + stageItem.getId()
        ));
    }

    private static List<Round> newRounds(Long stageItemId, List<String> names) {
        OffsetDateTime now = OffsetDateTime.now();
        List<Round> rounds = new ArrayList<>(names.size());
        for (String name : names) {
            Round round = new Round();
            round.setStageItemId(stageItemId);
            round.setName(name);
            round.setDraft(false);
            round.setCreatedAt(now);
            rounds.add(round);
        }
        return rounds;
    }

    private static List<String> numbered(String prefix, int count) {
        List<String> names = new ArrayList<>(count);
        for (int index = 1; index <= count; index++) {
            names.add(prefix + " " + index);
        }
        return names;
    }
}
