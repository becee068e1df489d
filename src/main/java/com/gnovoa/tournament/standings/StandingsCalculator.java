package com.gnovoa.tournament.standings;

import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.Team;

import java.util.*;

/**
 * League/group table from finished results.
 *
 * <p>Win 3, draw 1, loss 0. Ordered by points, goal difference, goals scored, then by the team's
 * place in the input list (registration order). Byes and unfinished matches are ignored, and a
 * team that has not played yet still gets a zero row. The result does not depend on match order.
 */
public final class StandingsCalculator {

    public static final int POINTS_FOR_WIN = 3;
    public static final int POINTS_FOR_DRAW = 1;

    private static final Comparator<Tally> TABLE_ORDER = Comparator
            .comparingInt(Tally::points).reversed()
            .thenComparing(Comparator.comparingInt(Tally::goalDifference).reversed())
            .thenComparing(Comparator.comparingInt((Tally t) -> t.goalsFor).reversed())
            .thenComparingInt(t -> t.seed);

    /**
     * @param teams table members in registration order; the order is the last tie-break
     * @param matches matches of this table; results involving other teams are skipped
     */
    public List<StandingsRow> computeStandings(List<Team> teams, List<Match> matches) {
        Map<String, Tally> table = new LinkedHashMap<>();
        for (int i = 0; i < teams.size(); i++) {
            Team team = teams.get(i);
            table.putIfAbsent(team.teamId(), new Tally(team, i));
        }

        for (Match m : matches) {
            if (!m.isPlayedResult()) continue;
            Tally home = table.get(m.homeTeamId());
            Tally away = table.get(m.awayTeamId());
            if (home == null || away == null) continue;

            home.record(m.homeScore(), m.awayScore());
            away.record(m.awayScore(), m.homeScore());
        }

        List<Tally> sorted = new ArrayList<>(table.values());
        sorted.sort(TABLE_ORDER);

        List<StandingsRow> rows = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            rows.add(sorted.get(i).toRow(i + 1));
        }
        return rows;
    }

    /** Table over every team that appears in {@code matches}; ties fall back to team id. */
    public List<StandingsRow> computeStandings(List<Match> matches) {
        SortedSet<String> ids = new TreeSet<>();
        for (Match m : matches) {
            if (m.bye()) continue;
            if (m.homeTeamId() != null) ids.add(m.homeTeamId());
            if (m.awayTeamId() != null) ids.add(m.awayTeamId());
        }
        List<Team> teams = ids.stream().map(id -> new Team(id, id, null)).toList();
        return computeStandings(teams, matches);
    }

    private static final class Tally {
        private final Team team;
        private final int seed;
        private int won;
        private int drawn;
        private int lost;
        private int goalsFor;
        private int goalsAgainst;

        private Tally(Team team, int seed) {
            this.team = team;
            this.seed = seed;
        }

        private void record(int scored, int conceded) {
            goalsFor += scored;
            goalsAgainst += conceded;
            if (scored > conceded) won++;
            else if (scored == conceded) drawn++;
            else lost++;
        }

        private int points() { return won * POINTS_FOR_WIN + drawn * POINTS_FOR_DRAW; }

        private int goalDifference() { return goalsFor - goalsAgainst; }

        private StandingsRow toRow(int position) {
            return new StandingsRow(position, team.teamId(), team.name(), won + drawn + lost,
                    won, drawn, lost, goalsFor, goalsAgainst, points());
        }
    }
}
