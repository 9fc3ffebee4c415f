package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.Round;
import com.bracketeer.model.Stage;
import com.bracketeer.model.StageItem;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageType;
import com.bracketeer.model.StageWithStageItems;
import com.bracketeer.repository.MatchRepository;
import com.bracketeer.repository.RoundRepository;
import com.bracketeer.repository.StageItemInputRepository;
import com.bracketeer.repository.StageItemRepository;
import com.bracketeer.repository.StageRepository;
import com.bracketeer.repository.TournamentRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TournamentGraphLoaderTest {

    @Mock
    private TournamentRepository tournamentRepository;

    @Mock
    private StageRepository stageRepository;

    @Mock
    private StageItemRepository stageItemRepository;

    @Mock
    private StageItemInputRepository stageItemInputRepository;

    @Mock
    private RoundRepository roundRepository;

    @Mock
    private MatchRepository matchRepository;

    @InjectMocks
    private TournamentGraphLoader tournamentGraphLoader;

    @Test
    void lockTournamentFailsForUnknownTournament() {
        when(tournamentRepository.findByIdForUpdate(42L)).thenReturn(Optional.empty());

        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> tournamentGraphLoader.lockTournament(42L)
        );

        assertEquals("Tournament not found: 42", ex.getMessage());
    }

    @Test
    void loadStageItemAttachesMatchesToTheirRounds() {
        StageItem stageItem = BracketTestData.stageItem(9L, StageType.SINGLE_ELIMINATION, 4);
        List<Round> rounds = BracketTestData.rounds(9L, 2);
        Match semifinalOne = BracketTestData.match(1L, 11L);
        Match semifinalTwo = BracketTestData.match(2L, 11L);
        Match finalMatch = BracketTestData.match(3L, 12L);
        when(stageItemRepository.findById(9L)).thenReturn(Optional.of(stageItem));
        when(stageRepository.findById(1L)).thenReturn(Optional.of(stage(1L)));
        when(roundRepository.findByStageItemIdOrderByIdAsc(9L)).thenReturn(rounds);
        when(stageItemInputRepository.findByStageItemIdOrderBySlotAsc(9L)).thenReturn(BracketTestData.inputs(9L, 4));
        when(matchRepository.findByRoundIdInOrderByIdAsc(List.of(11L, 12L)))
                .thenReturn(List.of(semifinalOne, semifinalTwo, finalMatch));

        StageItemWithRounds loaded = tournamentGraphLoader.loadStageItem(BracketTestData.TOURNAMENT_ID, 9L);

        assertEquals(4, loaded.inputs().size());
        assertEquals(List.of(semifinalOne, semifinalTwo), loaded.rounds().get(0).matches());
        assertEquals(List.of(finalMatch), loaded.rounds().get(1).matches());
        assertEquals(List.of(semifinalOne, semifinalTwo, finalMatch), loaded.allMatches());
    }

    @Test
    void loadStageItemRejectsStageItemOfAnotherTournament() {
        StageItem stageItem = BracketTestData.stageItem(9L, StageType.SINGLE_ELIMINATION, 4);
        when(stageItemRepository.findById(9L)).thenReturn(Optional.of(stageItem));
        when(stageRepository.findById(1L)).thenReturn(Optional.of(stage(1L)));

        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> tournamentGraphLoader.loadStageItem(99L, 9L)
        );

        assertEquals("Stage item 9 does not belong to tournament 99", ex.getMessage());
        verifyNoInteractions(roundRepository, matchRepository, stageItemInputRepository);
    }

    @Test
    void loadStageItemRejectsStageItemWithoutStage() {
        StageItem stageItem = BracketTestData.stageItem(9L, StageType.SINGLE_ELIMINATION, 4);
        when(stageItemRepository.findById(9L)).thenReturn(Optional.of(stageItem));
        when(stageRepository.findById(1L)).thenReturn(Optional.empty());

        assertThrows(
                IllegalArgumentException.class,
                () -> tournamentGraphLoader.loadStageItem(BracketTestData.TOURNAMENT_ID, 9L)
        );
    }

    @Test
    void loadTournamentGroupsStageItemsUnderTheirStages() {
        Stage groups = stage(1L);
        Stage playoffs = stage(2L);
        StageItem groupA = BracketTestData.stageItem(7L, StageType.ROUND_ROBIN, 4);
        StageItem bracket = BracketTestData.stageItem(8L, StageType.SINGLE_ELIMINATION, 4);
        bracket.setStageId(2L);
        Round groupRound = BracketTestData.rounds(7L, 1).get(0);
        Round bracketRound = BracketTestData.rounds(8L, 1).get(0);
        bracketRound.setId(21L);
        Match groupMatch = BracketTestData.match(1L, 11L);
        when(stageRepository.findByTournamentIdOrderByIdAsc(BracketTestData.TOURNAMENT_ID))
                .thenReturn(List.of(groups, playoffs));
        when(stageItemRepository.findByStageIdInOrderByIdAsc(List.of(1L, 2L))).thenReturn(List.of(groupA, bracket));
        when(roundRepository.findByStageItemIdInOrderByIdAsc(List.of(7L, 8L))).thenReturn(List.of(groupRound, bracketRound));
        when(matchRepository.findByRoundIdInOrderByIdAsc(List.of(11L, 21L))).thenReturn(List.of(groupMatch));

        List<StageWithStageItems> loaded = tournamentGraphLoader.loadTournament(BracketTestData.TOURNAMENT_ID);

        assertEquals(2, loaded.size());
        assertEquals(List.of(7L), loaded.get(0).stageItems().stream().map(StageItemWithRounds::id).toList());
        assertEquals(List.of(groupMatch), loaded.get(0).stageItems().get(0).allMatches());
        assertEquals(List.of(8L), loaded.get(1).stageItems().stream().map(StageItemWithRounds::id).toList());
        assertTrue(loaded.get(1).stageItems().get(0).allMatches().isEmpty());
    }

    @Test
    void loadTournamentWithoutStagesQueriesNothingElse() {
        when(stageRepository.findByTournamentIdOrderByIdAsc(BracketTestData.TOURNAMENT_ID)).thenReturn(List.of());

        assertTrue(tournamentGraphLoader.loadTournament(BracketTestData.TOURNAMENT_ID).isEmpty());
        verifyNoInteractions(stageItemRepository, roundRepository, matchRepository);
    }

    private static Stage stage(Long id) {
        Stage stage = new Stage();
        stage.setId(id);
        stage.setTournamentId(BracketTestData.TOURNAMENT_ID);
        stage.setName("Stage " + id);
        return stage;
    }
}
