package com.bracketeer.service;

import com.bracketeer.config.BracketeerRuntimeProperties;
import com.bracketeer.model.Match;
import com.bracketeer.model.MatchInputSource;
import com.bracketeer.model.Round;
import com.bracketeer.model.RoundWithMatches;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageType;
import com.bracketeer.repository.MatchRepository;
import com.bracketeer.repository.RoundRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps elimination match graphs consistent as results come in: forwards winners and losers to the
 * matches that reference them, resolves byes and short-circuits an unneeded grand final reset.
 */
@Service
@RequiredArgsConstructor
public class MatchProgressionService {

    private static final Logger log = LoggerFactory.getLogger(MatchProgressionService.class);

    private final TournamentGraphLoader tournamentGraphLoader;
    private final RoundRepository roundRepository;
    private final MatchRepository matchRepository;
    private final EliminationPropagationEngine eliminationPropagationEngine;
    private final BracketeerRuntimeProperties bracketeerRuntimeProperties;

    /**
     * Forwards the results of {@code changedMatchIds} (all in {@code roundId}) to later rounds.
     *
     * @return number of matches whose inputs changed
     */
    @Transactional
    public int propagateResults(Long tournamentId, Long roundId, Set<Long> changedMatchIds) {
        tournamentGraphLoader.lockTournament(tournamentId);
        StageItemWithRounds stageItem = loadStageItemOfRound(tournamentId, roundId);
        return propagate(stageItem, roundId, changedMatchIds);
    }

    /**
     * Propagates every round of a stage item, earliest first. A single pass only moves results
     * forward from one round, so this is what settles a freshly built or recomputed bracket.
     */
    @Transactional
    public int updateInputsInCompleteStageItem(Long tournamentId, Long stageItemId) {
        tournamentGraphLoader.lockTournament(tournamentId);
        StageItemWithRounds stageItem = tournamentGraphLoader.loadStageItem(tournamentId, stageItemId);

        int updated = 0;
        for (RoundWithMatches round : stageItem.rounds()) {
            Set<Long> matchIdsInRound = round.matches().stream()
                    .map(Match::getId)
                    .collect(Collectors.toSet());
            updated += propagate(stageItem, round.id(), matchIdsInRound);
        }
        log.debug("Recomputed inputs of stage item {}: {} match(es) updated", stageItemId, updated);
        return updated;
    }

    /**
     * Resolves matches that can only ever have one participant by scoring them 1-0 for that
     * participant, until none is left.
     *
     * @return number of byes resolved
     */
    @Transactional
    public int autoAdvanceByes(Long tournamentId, Long stageItemId) {
        tournamentGraphLoader.lockTournament(tournamentId);
        StageItemWithRounds stageItem = tournamentGraphLoader.loadStageItem(tournamentId, stageItemId);
        return advanceByes(stageItem);
    }

    /**
     * Stores a reported score and brings the rest of the bracket in line with it.
     */
    @Transactional
    public Match recordMatchResult(Long tournamentId, Long matchId, int input1Score, int input2Score) {
        if (input1Score < 0 || input2Score < 0) {
            throw new IllegalArgumentException("Scores must not be negative");
        }
        tournamentGraphLoader.lockTournament(tournamentId);
        Match storedMatch = matchRepository.findById(matchId)
                .orElseThrow(() -> new IllegalArgumentException("Match not found: " + matchId));
        StageItemWithRounds stageItem = loadStageItemOfRound(tournamentId, storedMatch.getRoundId());
        Match match = stageItem.allMatches().stream()
                .filter(candidate -> candidate.getId().equals(matchId))
                .findFirst()
                .orElse(storedMatch);

        StageType type = stageItem.stageItem().getType();
        if (type.isElimination() && input1Score == input2Score && input1Score > 0) {
            throw BracketValidationException.tiedEliminationResult(
                    "Match " + matchId + " is an elimination match and cannot end " + input1Score + "-" + input2Score
            );
        }

        match.setStageItemInput1Score(input1Score);
        match.setStageItemInput2Score(input2Score);
        match.setUpdatedAt(OffsetDateTime.now());
        Match saved = matchRepository.save(match);

        if (type.isElimination()) {
            propagate(stageItem, match.getRoundId(), Set.of(matchId));
            advanceByes(stageItem);
            if (type == StageType.DOUBLE_ELIMINATION) {
                maybeCompleteGrandFinalReset(stageItem, matchId);
            }
        }
        return saved;
    }

    /**
     * When the winners bracket finalist wins the grand final, the reset is not played: it is scored
     * 1-0 so the stage item completes.
     *
     * @return whether the reset was scored
     */
    boolean maybeCompleteGrandFinalReset(StageItemWithRounds stageItem, Long updatedMatchId) {
        List<RoundWithMatches> rounds = stageItem.rounds();
        if (rounds.size() < 2) {
            return false;
        }

        RoundWithMatches grandFinalRound = rounds.get(rounds.size() - 2);
        RoundWithMatches resetRound = rounds.get(rounds.size() - 1);
        if (grandFinalRound.matches().size() != 1 || resetRound.matches().size() != 1) {
            return false;
        }

        Match grandFinal = grandFinalRound.matches().get(0);
        Match reset = resetRound.matches().get(0);
        if (!grandFinal.getId().equals(updatedMatchId)) {
            return false;
        }
        if (grandFinal.getStageItemInput1Score() <= grandFinal.getStageItemInput2Score()) {
            return false;
        }
        if (reset.isPlayed()) {
            return false;
        }

        reset.setStageItemInput1Score(1);
        reset.setStageItemInput2Score(0);
        reset.setUpdatedAt(OffsetDateTime.now());
        matchRepository.save(reset);
        log.info("Grand final {} won by winners bracket finalist, reset match {} completed", grandFinal.getId(), reset.getId());
        return true;
    }

    private int advanceByes(StageItemWithRounds stageItem) {
        int maxIterations = bracketeerRuntimeProperties.getProgression().getMaxByeIterations();
        int resolved = 0;
        while (true) {
            Optional<Match> candidate = findNextBye(stageItem);
            if (candidate.isEmpty()) {
                break;
            }
            if (resolved >= maxIterations) {
                throw new IllegalStateException(
                        "Bye resolution for stage item " + stageItem.id() + " did not settle after "
                                + maxIterations + " iterations"
                );
            }

            Match bye = candidate.get();
            bye.setStageItemInput1Score(bye.hasInput1() ? 1 : 0);
            bye.setStageItemInput2Score(bye.hasInput2() ? 1 : 0);
            bye.setUpdatedAt(OffsetDateTime.now());
            matchRepository.save(bye);
            log.debug("Auto-advanced bye in match {} of stage item {}", bye.getId(), stageItem.id());

            propagate(stageItem, bye.getRoundId(), Set.of(bye.getId()));
            resolved++;
        }

        if (resolved > 0) {
            log.info("Auto-advanced {} bye(s) in stage item {}", resolved, stageItem.id());
        }
        return resolved;
    }

    /**
     * First unplayed match, earliest round first, with exactly one participant where the empty side
     * cannot be filled any more. A side still waiting on an unplayed upstream match is pending, not
     * empty.
     */
    private Optional<Match> findNextBye(StageItemWithRounds stageItem) {
        Map<Long, Match> matchesById = stageItem.allMatches().stream()
                .collect(Collectors.toMap(Match::getId, Function.identity()));
        Map<Long, Boolean> liveness = new HashMap<>();

        for (RoundWithMatches round : stageItem.rounds()) {
            for (Match match : round.matches()) {
                boolean singleInput = match.hasInput1() != match.hasInput2();
                boolean noResultYet = match.getStageItemInput1Score() == match.getStageItemInput2Score();
                if (!singleInput || !noResultYet) {
                    continue;
                }

                MatchInputSource emptySide = match.hasInput1() ? match.getInput2Source() : match.getInput1Source();
                if (!isPending(emptySide, matchesById, liveness)) {
                    return Optional.of(match);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isPending(
            MatchInputSource source,
            Map<Long, Match> matchesById,
            Map<Long, Boolean> liveness
    ) {
        if (!source.isMatchReference()) {
            return false;
        }
        Match upstream = matchesById.get(source.referenceId());
        return upstream != null && canStillProduceParticipant(upstream, matchesById, liveness);
    }

    /**
     * An unplayed match can still send a participant forward if either side is filled or pending.
     * References always point at earlier rounds, so the recursion ends.
     */
    private static boolean canStillProduceParticipant(
            Match match,
            Map<Long, Match> matchesById,
            Map<Long, Boolean> liveness
    ) {
        if (match.isPlayed()) {
            return false;
        }
        Boolean known = liveness.get(match.getId());
        if (known != null) {
            return known;
        }

        boolean live = match.hasInput1()
                || match.hasInput2()
                || isPending(match.getInput1Source(), matchesById, liveness)
                || isPending(match.getInput2Source(), matchesById, liveness);
        liveness.put(match.getId(), live);
        return live;
    }

    private int propagate(StageItemWithRounds stageItem, Long roundId, Set<Long> matchIds) {
        Map<Long, EliminationPropagationEngine.InputUpdate> updates =
                eliminationPropagationEngine.determineInputUpdates(roundId, stageItem, matchIds);
        if (updates.isEmpty()) {
            return 0;
        }

        OffsetDateTime now = OffsetDateTime.now();
        List<Match> changed = new ArrayList<>(updates.size());
        for (Match match : stageItem.allMatches()) {
            EliminationPropagationEngine.InputUpdate update = updates.get(match.getId());
            if (update != null) {
                update.applyTo(match);
                match.setUpdatedAt(now);
                changed.add(match);
            }
        }
        matchRepository.saveAll(changed);
        return changed.size();
    }

    private StageItemWithRounds loadStageItemOfRound(Long tournamentId, Long roundId) {
        Round round = roundRepository.findById(roundId)
                .orElseThrow(() -> new IllegalArgumentException("Round not found: " + roundId));
        return tournamentGraphLoader.loadStageItem(tournamentId, round.getStageItemId());
    }
}
