package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.MatchInputSource;
import com.bracketeer.model.Round;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageType;
import com.bracketeer.repository.MatchRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class EliminationPropagationEngineTest {

    private static final Long FIRST_ROUND_ID = 11L;

    private final EliminationPropagationEngine engine = new EliminationPropagationEngine();

    @Mock
    private MatchRepository matchRepository;

    @Test
    void firstRoundWinnersFillEverySecondRoundMatch() {
        StageItemWithRounds stageItem = sixteenTeamBracket();
        for (long matchId = 1; matchId <= 8; matchId++) {
            BracketTestData.score(BracketTestData.matchById(stageItem, matchId), 2, 1);
        }
        BracketTestData.score(BracketTestData.matchById(stageItem, 2L), 0, 3);

        Map<Long, EliminationPropagationEngine.InputUpdate> updates =
                engine.determineInputUpdates(FIRST_ROUND_ID, stageItem);

        assertEquals(Set.of(9L, 10L, 11L, 12L), updates.keySet());
        // seeds 1, 9, 4, 5, 2, 7, 3, 6 go through
        assertUpdate(updates.get(9L), 1, 9);
        assertUpdate(updates.get(10L), 4, 5);
        assertUpdate(updates.get(11L), 2, 7);
        assertUpdate(updates.get(12L), 3, 6);
        assertEquals(12L, updates.get(9L).roundId());

        Match firstMatch = BracketTestData.matchById(stageItem, 1L);
        assertEquals(BracketTestData.inputId(1), firstMatch.getStageItemInput1Id());
        assertEquals(BracketTestData.inputId(16), firstMatch.getStageItemInput2Id());
        assertNull(BracketTestData.matchById(stageItem, 9L).getStageItemInput1Id());
    }

    @Test
    void changedMatchesAreNeverPartOfTheirOwnUpdates() {
        StageItemWithRounds stageItem = sixteenTeamBracket();
        BracketTestData.score(BracketTestData.matchById(stageItem, 1L), 2, 0);

        Map<Long, EliminationPropagationEngine.InputUpdate> updates =
                engine.determineInputUpdates(FIRST_ROUND_ID, stageItem, Set.of(1L));

        assertEquals(Set.of(9L), updates.keySet());
        assertEquals(BracketTestData.inputId(1), updates.get(9L).stageItemInput1Id());
        assertNull(updates.get(9L).stageItemInput2Id());
    }

    @Test
    void resultsChainThroughAlreadyPlayedLaterMatchesInOnePass() {
        StageItemWithRounds stageItem = sixteenTeamBracket();
        BracketTestData.score(BracketTestData.matchById(stageItem, 1L), 2, 0);
        BracketTestData.score(BracketTestData.matchById(stageItem, 2L), 0, 2);
        BracketTestData.score(BracketTestData.matchById(stageItem, 9L), 1, 0);

        Map<Long, EliminationPropagationEngine.InputUpdate> updates =
                engine.determineInputUpdates(FIRST_ROUND_ID, stageItem, Set.of(1L, 2L));

        assertEquals(List.of(9L, 13L), List.copyOf(updates.keySet()));
        assertEquals(BracketTestData.inputId(1), updates.get(13L).stageItemInput1Id());
        assertNull(updates.get(13L).stageItemInput2Id());
    }

    @Test
    void rescoringFlipsTheForwardedParticipant() {
        StageItemWithRounds stageItem = sixteenTeamBracket();
        Match first = BracketTestData.matchById(stageItem, 1L);
        Match next = BracketTestData.matchById(stageItem, 9L);
        next.setStageItemInput1Id(BracketTestData.inputId(1));
        BracketTestData.score(first, 0, 2);

        Map<Long, EliminationPropagationEngine.InputUpdate> updates =
                engine.determineInputUpdates(FIRST_ROUND_ID, stageItem, Set.of(1L));

        assertEquals(BracketTestData.inputId(16), updates.get(9L).stageItemInput1Id());
        updates.get(9L).applyTo(next);
        assertEquals(BracketTestData.inputId(16), next.getStageItemInput1Id());
    }

    @Test
    void levelScoresForwardNobody() {
        StageItemWithRounds stageItem = sixteenTeamBracket();
        Match next = BracketTestData.matchById(stageItem, 9L);
        next.setStageItemInput1Id(BracketTestData.inputId(1));

        Map<Long, EliminationPropagationEngine.InputUpdate> updates =
                engine.determineInputUpdates(FIRST_ROUND_ID, stageItem, Set.of(1L));

        assertNull(updates.get(9L).stageItemInput1Id());
    }

    @Test
    void losersAreRoutedIntoTheLosersBracket() {
        List<Round> rounds = BracketTestData.rounds(9L, 3);
        Match first = direct(1L, 11L, 1, 4);
        Match second = direct(2L, 11L, 2, 3);
        Match winnersFinal = BracketTestData.match(3L, 12L);
        winnersFinal.setInput1Source(MatchInputSource.winnerOf(1L));
        winnersFinal.setInput2Source(MatchInputSource.winnerOf(2L));
        Match losersMatch = BracketTestData.match(4L, 13L);
        losersMatch.setInput1Source(MatchInputSource.loserOf(1L));
        losersMatch.setInput2Source(MatchInputSource.loserOf(2L));
        BracketTestData.score(first, 2, 0);
        BracketTestData.score(second, 0, 3);
        StageItemWithRounds stageItem = BracketTestData.graph(
                BracketTestData.stageItem(9L, StageType.DOUBLE_ELIMINATION, 4),
                BracketTestData.inputs(9L, 4),
                rounds,
                List.of(first, second, winnersFinal, losersMatch)
        );

        Map<Long, EliminationPropagationEngine.InputUpdate> updates =
                engine.determineInputUpdates(FIRST_ROUND_ID, stageItem);

        assertUpdate(updates.get(3L), 1, 3);
        assertUpdate(updates.get(4L), 4, 2);
    }

    @Test
    void unknownRoundIsRejected() {
        StageItemWithRounds stageItem = sixteenTeamBracket();

        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> engine.determineInputUpdates(99L, stageItem)
        );

        assertTrue(ex.getMessage().contains("99"));
    }

    /**
     * Matches 1-8 in round 11, 9-12 in round 12, 13-14 in round 13 and the final, 15, in round 14.
     */
    private StageItemWithRounds sixteenTeamBracket() {
        BracketTestData.assignIdsOnSave(matchRepository, new AtomicLong());
        List<Round> rounds = BracketTestData.rounds(5L, 4);
        StageItemWithRounds empty = BracketTestData.graph(
                BracketTestData.stageItem(5L, StageType.SINGLE_ELIMINATION, 16),
                BracketTestData.inputs(5L, 16),
                rounds,
                List.of()
        );
        List<Match> matches = new SingleEliminationBuilder(matchRepository).build(empty, BracketTestData.tournament());
        return BracketTestData.graph(empty.stageItem(), empty.inputs(), rounds, matches);
    }

    private static Match direct(Long id, Long roundId, int slot1, int slot2) {
        Match match = BracketTestData.match(id, roundId);
        match.setInput1Source(MatchInputSource.direct(BracketTestData.inputId(slot1)));
        match.setInput2Source(MatchInputSource.direct(BracketTestData.inputId(slot2)));
        return match;
    }

    private static void assertUpdate(EliminationPropagationEngine.InputUpdate update, int slot1, int slot2) {
        assertEquals(BracketTestData.inputId(slot1), update.stageItemInput1Id());
        assertEquals(BracketTestData.inputId(slot2), update.stageItemInput2Id());
    }
}
