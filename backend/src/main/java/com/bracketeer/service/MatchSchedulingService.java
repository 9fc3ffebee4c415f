package com.bracketeer.service;

import com.bracketeer.config.BracketeerRuntimeProperties;
import com.bracketeer.model.Court;
import com.bracketeer.model.Match;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageWithStageItems;
import com.bracketeer.model.Tournament;
import com.bracketeer.repository.CourtRepository;
import com.bracketeer.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class MatchSchedulingService {

    private static final Logger log = LoggerFactory.getLogger(MatchSchedulingService.class);

    private final TournamentGraphLoader tournamentGraphLoader;
    private final CourtRepository courtRepository;
    private final MatchRepository matchRepository;
    private final MatchSchedulePlanner matchSchedulePlanner;
    private final BracketeerRuntimeProperties bracketeerRuntimeProperties;

    /**
     * Places every match that has no slot yet and then normalizes start times across the tournament.
     *
     * @return number of matches that received a court and start time
     */
    @Transactional
    public int scheduleAllUnscheduled(Long tournamentId) {
        if (!bracketeerRuntimeProperties.getScheduling().isEnabled()) {
            log.debug("Scheduling disabled, skipping tournament {}", tournamentId);
            return 0;
        }

        Tournament tournament = tournamentGraphLoader.lockTournament(tournamentId);
        List<Court> courts = courtRepository.findByTournamentIdOrderByIdAsc(tournamentId);
        List<StageWithStageItems> stages = tournamentGraphLoader.loadTournament(tournamentId);
        if (courts.isEmpty()) {
            log.warn("Tournament {} has no courts, nothing scheduled", tournamentId);
            return 0;
        }

        List<Match> scheduled = matchSchedulePlanner.scheduleUnscheduled(stages, courts, tournament);
        List<Match> allMatches = allMatches(stages);
        Set<Match> changed = new LinkedHashSet<>(scheduled);
        changed.addAll(matchSchedulePlanner.normalizeStartTimes(allMatches, tournament));
        save(changed);

        log.info("Scheduled {} match(es) on {} court(s) for tournament {}", scheduled.size(), courts.size(), tournamentId);
        return scheduled.size();
    }

    @Transactional
    public void rescheduleMatch(Long tournamentId, Long matchId, MatchRescheduleRequest request) {
        Tournament tournament = tournamentGraphLoader.lockTournament(tournamentId);
        if (request.isNoOp()) {
            return;
        }

        List<Match> allMatches = allMatches(tournamentGraphLoader.loadTournament(tournamentId));
        Set<Match> changed = new LinkedHashSet<>(
                matchSchedulePlanner.rescheduleMatch(allMatches, matchId, request, tournament)
        );
        changed.addAll(matchSchedulePlanner.normalizeStartTimes(allMatches, tournament));
        save(changed);

        log.info(
                "Rescheduled match {} from court {} position {} to court {} position {}",
                matchId,
                request.oldCourtId(),
                request.oldPosition(),
                request.newCourtId(),
                request.newPosition()
        );
    }

    /**
     * Re-lays one court from the tournament start, e.g. after a match on it got a custom duration.
     */
    @Transactional
    public int resequenceCourt(Long tournamentId, Long courtId) {
        Tournament tournament = tournamentGraphLoader.lockTournament(tournamentId);
        List<Match> changed = matchSchedulePlanner.resequenceCourt(
                allMatches(tournamentGraphLoader.loadTournament(tournamentId)),
                courtId,
                tournament
        );
        save(changed);
        return changed.size();
    }

    @Transactional
    public int renormalizeSchedule(Long tournamentId) {
        Tournament tournament = tournamentGraphLoader.lockTournament(tournamentId);
        List<Match> changed = matchSchedulePlanner.normalizeStartTimes(
                allMatches(tournamentGraphLoader.loadTournament(tournamentId)),
                tournament
        );
        save(changed);
        log.debug("Normalized start times of tournament {}: {} match(es) changed", tournamentId, changed.size());
        return changed.size();
    }

    private void save(Iterable<Match> matches) {
        OffsetDateTime now = OffsetDateTime.now();
        matches.forEach(match -> match.setUpdatedAt(now));
        matchRepository.saveAll(matches);
    }

    private static List<Match> allMatches(List<StageWithStageItems> stages) {
        return stages.stream()
                .flatMap(stage -> stage.stageItems().stream())
                .map(StageItemWithRounds::allMatches)
                .flatMap(List::stream)
                .toList();
    }
}
