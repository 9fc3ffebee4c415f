package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.Round;
import com.bracketeer.model.RoundWithMatches;
import com.bracketeer.model.Stage;
import com.bracketeer.model.StageItem;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageWithStageItems;
import com.bracketeer.model.Tournament;
import com.bracketeer.repository.MatchRepository;
import com.bracketeer.repository.RoundRepository;
import com.bracketeer.repository.StageItemInputRepository;
import com.bracketeer.repository.StageItemRepository;
import com.bracketeer.repository.StageRepository;
import com.bracketeer.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads stage items, rounds and matches into the in-memory graphs the engines work on. The returned
 * entities are managed, so changes made by the engines are written back when the caller saves them.
 */
@Component
@RequiredArgsConstructor
public class TournamentGraphLoader {

    private final TournamentRepository tournamentRepository;
    private final StageRepository stageRepository;
    private final StageItemRepository stageItemRepository;
    private final StageItemInputRepository stageItemInputRepository;
    private final RoundRepository roundRepository;
    private final MatchRepository matchRepository;

    /**
     * Locks the tournament row for the rest of the transaction. Every scheduling or propagation pass
     * goes through here first, which serializes passes on the same tournament.
     */
    public Tournament lockTournament(Long tournamentId) {
        return tournamentRepository.findByIdForUpdate(tournamentId)
                .orElseThrow(() -> new IllegalArgumentException("Tournament not found: " + tournamentId));
    }

    /**
     * Loads a stage item of {@code tournamentId}. A stage item that belongs to another tournament is
     * reported as not found, so the caller's tournament lock always covers the graph it mutates.
     */
    public StageItemWithRounds loadStageItem(Long tournamentId, Long stageItemId) {
        StageItem stageItem = stageItemRepository.findById(stageItemId)
                .orElseThrow(() -> new IllegalArgumentException("Stage item not found: " + stageItemId));
        boolean ownedByTournament = stageRepository.findById(stageItem.getStageId())
                .map(stage -> tournamentId.equals(stage.getTournamentId()))
                .orElse(false);
        if (!ownedByTournament) {
            throw new IllegalArgumentException(
                    "Stage item " + stageItemId + " does not belong to tournament " + tournamentId
            );
        }
        List<Round> rounds = roundRepository.findByStageItemIdOrderByIdAsc(stageItemId);
        return new StageItemWithRounds(
                stageItem,
                stageItemInputRepository.findByStageItemIdOrderBySlotAsc(stageItemId),
                withMatches(rounds)
        );
    }

    /**
     * Stages ordered by id, each with its stage items, rounds and matches. Stage item inputs are not
     * loaded; scheduling does not need them.
     */
    public List<StageWithStageItems> loadTournament(Long tournamentId) {
        List<Stage> stages = stageRepository.findByTournamentIdOrderByIdAsc(tournamentId);
        if (stages.isEmpty()) {
            return List.of();
        }

        List<StageItem> stageItems = stageItemRepository.findByStageIdInOrderByIdAsc(
                stages.stream().map(Stage::getId).toList()
        );
        List<Round> rounds = stageItems.isEmpty()
                ? List.of()
                : roundRepository.findByStageItemIdInOrderByIdAsc(stageItems.stream().map(StageItem::getId).toList());
        Map<Long, List<RoundWithMatches>> roundsByStageItem = withMatches(rounds).stream()
                .collect(Collectors.groupingBy(
                        round -> round.round().getStageItemId(),
                        LinkedHashMap::new,
                        Collectors.toList()
                ));
        Map<Long, List<StageItemWithRounds>> stageItemsByStage = stageItems.stream()
                .map(stageItem -> new StageItemWithRounds(
                        stageItem,
                        List.of(),
                        roundsByStageItem.getOrDefault(stageItem.getId(), List.of())
                ))
                .collect(Collectors.groupingBy(
                        stageItem -> stageItem.stageItem().getStageId(),
                        LinkedHashMap::new,
                        Collectors.toList()
                ));

        return stages.stream()
                .map(stage -> new StageWithStageItems(stage, stageItemsByStage.getOrDefault(stage.getId(), List.of())))
                .toList();
    }

    private List<RoundWithMatches> withMatches(List<Round> rounds) {
        if (rounds.isEmpty()) {
            return List.of();
        }
        Map<Long, List<Match>> matchesByRound = matchRepository
                .findByRoundIdInOrderByIdAsc(rounds.stream().map(Round::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(Match::getRoundId, LinkedHashMap::new, Collectors.toList()));
        return rounds.stream()
                .map(round -> new RoundWithMatches(round, matchesByRound.getOrDefault(round.getId(), List.of())))
                .toList();
    }
}
