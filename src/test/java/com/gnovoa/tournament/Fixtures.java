package com.gnovoa.tournament;

import com.gnovoa.tournament.model.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/** Test data builders shared by the engine tests. */
public final class Fixtures {

    private Fixtures() {}

    /** Teams t1..tn named "Team 1".."Team n". */
    public static List<Team> teams(int n) {
        return IntStream.rangeClosed(1, n)
                .mapToObj(i -> new Team("t" + i, "Team " + i, "T" + i))
                .toList();
    }

    public static List<Registration> paid(List<Team> teams, String tournamentId) {
        List<Registration> regs = new ArrayList<>();
        for (int i = 0; i < teams.size(); i++) {
            regs.add(new Registration("r" + (i + 1), tournamentId, teams.get(i), RegistrationStatus.PAID,
                    Instant.parse("2026-01-01T10:00:00Z").plusSeconds(i)));
        }
        return regs;
    }

    public static Tournament tournament(String id, TournamentFormat format) {
        return new Tournament(id, "Cup " + id, format, TournamentStatus.CLOSED, 2, 64,
                LocalDate.of(2026, 6, 1), TournamentStructure.initial());
    }

    public static Match finished(Match m, int home, int away) {
        return m.withScore(home, away).withStatus(MatchStatus.FINISHED);
    }

    public static Match played(String id, String home, String away, int homeScore, int awayScore) {
        return finished(Match.scheduled(id, "x", MatchStage.LEAGUE, "Round 1", 1, null, null, home, away),
                homeScore, awayScore);
    }

    /** Finishes every unfinished match: the home side wins 1-0. */
    public static List<Match> homeWins(List<Match> matches) {
        return matches.stream().map(m -> m.isFinished() ? m : finished(m, 1, 0)).toList();
    }
}
