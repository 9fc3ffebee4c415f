package com.bracketeer.service;

import com.bracketeer.model.Court;
import com.bracketeer.model.Match;
import com.bracketeer.model.RoundWithMatches;
import com.bracketeer.model.StageItemWithRounds;
import com.bracketeer.model.StageWithStageItems;
import com.bracketeer.model.Tournament;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assigns courts, schedule positions and start times to matches. Works on in-memory matches and
 * returns the ones it touched; persisting them is up to the caller.
 * <p>
 * A position groups matches that start together. Each match occupies its court for its slot
 * minutes: the custom duration and margin when set, the tournament defaults otherwise.
 */
@Component
public class MatchSchedulePlanner {

    private static final Comparator<Match> BY_ID = Comparator.comparing(Match::getId);

    public static int slotMinutes(Match match, Tournament tournament) {
        return effectiveDuration(match, tournament) + effectiveMargin(match, tournament);
    }

    /**
     * Places every match without a start time or position. Matches are taken stage by stage, stage
     * items by name, rounds and matches by id. Each round is cut into batches of one match per court;
     * a batch starts when the longest match of the previous batch ends.
     */
    public List<Match> scheduleUnscheduled(
            List<StageWithStageItems> stages,
            List<Court> courts,
            Tournament tournament
    ) {
        List<Match> scheduled = new ArrayList<>();
        if (stages.isEmpty() || courts.isEmpty()) {
            return scheduled;
        }

        OffsetDateTime timeLastMatchFromPreviousStage = tournament.getStartTime();
        int positionLastMatchFromPreviousStage = 0;

        for (StageWithStageItems stage : stages) {
            List<StageItemWithRounds> stageItems = new ArrayList<>(stage.stageItems());
            stageItems.sort(Comparator.comparing(stageItem -> stageItem.stageItem().getName()));
            OffsetDateTime stageStartTime = timeLastMatchFromPreviousStage;
            int stagePosition = positionLastMatchFromPreviousStage;

            for (StageItemWithRounds stageItem : stageItems) {
                OffsetDateTime roundStartTime = stageStartTime;
                int roundPosition = stagePosition;

                for (RoundWithMatches round : stageItem.rounds()) {
                    List<Match> matches = new ArrayList<>(round.matches());
                    if (matches.isEmpty()) {
                        continue;
                    }
                    matches.sort(BY_ID);

                    OffsetDateTime batchStartTime = roundStartTime;
                    int batchCount = 0;
                    for (int start = 0; start < matches.size(); start += courts.size()) {
                        List<Match> batch = matches.subList(start, Math.min(start + courts.size(), matches.size()));
                        int position = roundPosition + batchCount;
                        OffsetDateTime slotEndTime = batchStartTime;

                        for (int courtIndex = 0; courtIndex < batch.size(); courtIndex++) {
                            Match match = batch.get(courtIndex);
                            if (match.getStartTime() == null && match.getPositionInSchedule() == null) {
                                place(match, courts.get(courtIndex).getId(), batchStartTime, position, tournament);
                                scheduled.add(match);
                            }
                            OffsetDateTime matchEnd = batchStartTime.plusMinutes(slotMinutes(match, tournament));
                            if (matchEnd.isAfter(slotEndTime)) {
                                slotEndTime = matchEnd;
                            }
                        }

                        batchStartTime = slotEndTime;
                        batchCount++;
                    }

                    roundStartTime = batchStartTime;
                    roundPosition += batchCount;
                }

                stageStartTime = roundStartTime;
                stagePosition = roundPosition;
            }

            if (stageStartTime.isAfter(timeLastMatchFromPreviousStage)) {
                timeLastMatchFromPreviousStage = stageStartTime;
            }
            positionLastMatchFromPreviousStage = Math.max(positionLastMatchFromPreviousStage, stagePosition);
        }
        return scheduled;
    }

    /**
     * Moves one match and re-sequences the courts involved. The moved match sorts half a position
     * before its target when it moves up or to another court, and half a position after when it
     * moves down, so it lands on the requested slot once positions are renumbered.
     */
    public List<Match> rescheduleMatch(
            List<Match> matches,
            Long matchId,
            MatchRescheduleRequest request,
            Tournament tournament
    ) {
        if (request.isNoOp()) {
            return List.of();
        }

        List<MatchPosition> positions = new ArrayList<>();
        boolean found = false;
        for (Match match : scheduledMatches(matches)) {
            if (!match.getId().equals(matchId)) {
                positions.add(new MatchPosition(match, match.getCourtId(), match.getPositionInSchedule()));
                continue;
            }

            if (match.getPositionInSchedule() != request.oldPosition()
                    || !request.oldCourtId().equals(match.getCourtId())) {
                throw BracketValidationException.matchPositionMismatch(
                        "Match " + matchId + " is not at court " + request.oldCourtId()
                                + ", position " + request.oldPosition()
                );
            }
            boolean movesUpOrAcross = request.newPosition() < request.oldPosition()
                    || !request.newCourtId().equals(request.oldCourtId());
            double offset = movesUpOrAcross ? -0.5 : 0.5;
            positions.add(new MatchPosition(match, request.newCourtId(), request.newPosition() + offset));
            found = true;
        }
        if (!found) {
            throw BracketValidationException.matchPositionMismatch("Match " + matchId + " is not scheduled");
        }

        List<Match> changed = new ArrayList<>(resequencePositions(positions, request.newCourtId(), tournament));
        if (!request.newCourtId().equals(request.oldCourtId())) {
            changed.addAll(resequencePositions(positions, request.oldCourtId(), tournament));
        }
        return changed;
    }

    /**
     * Lays the matches of one court back to back from the tournament start, in their current order.
     */
    public List<Match> resequenceCourt(List<Match> matches, Long courtId, Tournament tournament) {
        List<MatchPosition> positions = scheduledMatches(matches).stream()
                .map(match -> new MatchPosition(match, match.getCourtId(), match.getPositionInSchedule()))
                .toList();
        return resequencePositions(positions, courtId, tournament);
    }

    /**
     * Gives every match sharing a position the same start time, ordered by court and id, and
     * renumbers positions densely from 0. A position lasts as long as its longest match.
     * Running it twice in a row changes nothing the second time.
     */
    public List<Match> normalizeStartTimes(List<Match> matches, Tournament tournament) {
        Map<Integer, List<Match>> matchesByPosition = new TreeMap<>();
        for (Match match : scheduledMatches(matches)) {
            if (match.getCourtId() == null) {
                continue;
            }
            matchesByPosition.computeIfAbsent(match.getPositionInSchedule(), position -> new ArrayList<>()).add(match);
        }

        List<Match> changed = new ArrayList<>();
        OffsetDateTime slotStartTime = tournament.getStartTime();
        int normalizedPosition = 0;
        for (List<Match> slotMatches : matchesByPosition.values()) {
            slotMatches.sort(Comparator.comparing(Match::getCourtId).thenComparing(Match::getId));
            int longestSlotMinutes = 0;
            for (Match match : slotMatches) {
                if (place(match, match.getCourtId(), slotStartTime, normalizedPosition, tournament)) {
                    changed.add(match);
                }
                longestSlotMinutes = Math.max(longestSlotMinutes, slotMinutes(match, tournament));
            }
            slotStartTime = slotStartTime.plusMinutes(longestSlotMinutes);
            normalizedPosition++;
        }
        return changed;
    }

    private List<Match> resequencePositions(List<MatchPosition> positions, Long courtId, Tournament tournament) {
        List<MatchPosition> onCourt = positions.stream()
                .filter(position -> courtId.equals(position.courtId()))
                .sorted(Comparator.comparingDouble(MatchPosition::position))
                .toList();

        List<Match> changed = new ArrayList<>(onCourt.size());
        OffsetDateTime startTime = tournament.getStartTime();
        for (int i = 0; i < onCourt.size(); i++) {
            Match match = onCourt.get(i).match();
            place(match, courtId, startTime, i, tournament);
            changed.add(match);
            startTime = startTime.plusMinutes(slotMinutes(match, tournament));
        }
        return changed;
    }

    private static List<Match> scheduledMatches(List<Match> matches) {
        return matches.stream()
                .filter(match -> match.getStartTime() != null && match.getPositionInSchedule() != null)
                .toList();
    }

    /**
     * @return whether anything about the match's placement changed
     */
    private static boolean place(
            Match match,
            Long courtId,
            OffsetDateTime startTime,
            int position,
            Tournament tournament
    ) {
        int duration = effectiveDuration(match, tournament);
        int margin = effectiveMargin(match, tournament);
        boolean changed = !courtId.equals(match.getCourtId())
                || match.getStartTime() == null
                || !match.getStartTime().isEqual(startTime)
                || match.getPositionInSchedule() == null
                || match.getPositionInSchedule() != position
                || match.getDurationMinutes() != duration
                || match.getMarginMinutes() != margin;

        match.setCourtId(courtId);
        match.setStartTime(startTime);
        match.setPositionInSchedule(position);
        match.setDurationMinutes(duration);
        match.setMarginMinutes(margin);
        return changed;
    }

    private static int effectiveDuration(Match match, Tournament tournament) {
        Integer custom = match.getCustomDurationMinutes();
        return custom != null ? custom : tournament.getDurationMinutes();
    }

    private static int effectiveMargin(Match match, Tournament tournament) {
        Integer custom = match.getCustomMarginMinutes();
        return custom != null ? custom : tournament.getMarginMinutes();
    }

    private record MatchPosition(Match match, Long courtId, double position) {
    }
}
