package com.gnovoa.tournament.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single fixture.
 *
 * <p>Created by the fixture generator with status {@link MatchStatus#SCHEDULED}; scores and status
 * are then changed by score entry. A knockout bye is a round-1 entry with {@code bye == true}, a
 * null away team and status {@link MatchStatus#FINISHED}: the home team advances without playing.
 *
 * <p>{@code pitch} and {@code kickoffAt} are opaque scheduling fields supplied from outside.
 *
 * @param round 1-based round number within its stage (group/league round or knockout round)
 * @param bracketPosition 1-based slot within a knockout round, null for league/group matches
 * @param groupName group label for {@link MatchStage#GROUP} matches, otherwise null
 */
public record Match(
        String matchId,
        String tournamentId,
        MatchStage stage,
        String roundLabel,
        int round,
        Integer bracketPosition,
        String groupName,
        String homeTeamId,
        String awayTeamId,
        Integer homeScore,
        Integer awayScore,
        Integer homePenalties,
        Integer awayPenalties,
        MatchStatus status,
        boolean bye,
        String pitch,
        Instant kickoffAt
) {

    public static Match scheduled(
            String matchId,
            String tournamentId,
            MatchStage stage,
            String roundLabel,
            int round,
            Integer bracketPosition,
            String groupName,
            String homeTeamId,
            String awayTeamId
    ) {
        return new Match(matchId, tournamentId, stage, roundLabel, round, bracketPosition, groupName,
                homeTeamId, awayTeamId, null, null, null, null, MatchStatus.SCHEDULED, false, null, null);
    }

    public static Match bye(String matchId, String tournamentId, String roundLabel, int bracketPosition, String teamId) {
        return new Match(matchId, tournamentId, MatchStage.KNOCKOUT, roundLabel, 1, bracketPosition, null,
                teamId, null, null, null, null, null, MatchStatus.FINISHED, true, null, null);
    }

    public boolean isFinished() { return status == MatchStatus.FINISHED; }

    /** Finished and actually played (byes carry no result). */
    public boolean isPlayedResult() {
        return isFinished() && !bye && homeScore != null && awayScore != null;
    }

    public boolean involves(String teamId) {
        return Objects.equals(homeTeamId, teamId) || Objects.equals(awayTeamId, teamId);
    }

    public String opponentOf(String teamId) {
        if (Objects.equals(homeTeamId, teamId)) return awayTeamId;
        if (Objects.equals(awayTeamId, teamId)) return homeTeamId;
        throw new IllegalArgumentException("Team " + teamId + " does not play in match " + matchId);
    }

    /** Goals scored by {@code teamId}; 0 when no score is recorded. */
    public int goalsFor(String teamId) {
        if (Objects.equals(homeTeamId, teamId)) return homeScore == null ? 0 : homeScore;
        if (Objects.equals(awayTeamId, teamId)) return awayScore == null ? 0 : awayScore;
        throw new IllegalArgumentException("Team " + teamId + " does not play in match " + matchId);
    }

    public int goalsAgainst(String teamId) {
        return goalsFor(opponentOf(teamId));
    }

    public Match withScore(Integer home, Integer away) {
        return new Match(matchId, tournamentId, stage, roundLabel, round, bracketPosition, groupName,
                homeTeamId, awayTeamId, home, away, homePenalties, awayPenalties, status, bye, pitch, kickoffAt);
    }

    public Match withPenalties(Integer home, Integer away) {
        return new Match(matchId, tournamentId, stage, roundLabel, round, bracketPosition, groupName,
                homeTeamId, awayTeamId, homeScore, awayScore, home, away, status, bye, pitch, kickoffAt);
    }

    public Match withStatus(MatchStatus next) {
        return new Match(matchId, tournamentId, stage, roundLabel, round, bracketPosition, groupName,
                homeTeamId, awayTeamId, homeScore, awayScore, homePenalties, awayPenalties, next, bye, pitch, kickoffAt);
    }

    public Match withSchedule(String nextPitch, Instant nextKickoff) {
        return new Match(matchId, tournamentId, stage, roundLabel, round, bracketPosition, groupName,
                homeTeamId, awayTeamId, homeScore, awayScore, homePenalties, awayPenalties, status, bye, nextPitch, nextKickoff);
    }
}
