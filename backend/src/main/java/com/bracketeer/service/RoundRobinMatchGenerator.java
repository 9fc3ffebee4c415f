package com.bracketeer.service;

import com.bracketeer.model.Match;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.Tournament;

import java.util.List;

/**
 * Pairing strategy for round robin and regular season stage items, supplied by the host
 * application. The returned matches are inserted as they are.
 */
public interface RoundRobinMatchGenerator {

    int roundCount(int teamCount);

    List<Match> generateMatches(StageItemWithRounds stageItem, Tournament tournament);
}
