package com.gnovoa.tournament.stats;

import com.gnovoa.tournament.model.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Goals, assists, appearances and clean sheets from finished matches and their event records.
 *
 * <p>Appearances are inferred: a player appears in a match when they scored or assisted in it, so a
 * player who never touches the score sheet has none. Events of unfinished matches are ignored.
 */
public final class StatsAggregator {

    /**
     * @param players roster used to find each team's goalkeeper; may be empty
     */
    public Leaderboards computeLeaderboards(List<Match> matches,
                                            List<MatchScorer> scorers,
                                            List<MatchAssist> assists,
                                            List<Player> players) {
        Set<String> finished = matches.stream()
                .filter(Match::isPlayedResult)
                .map(Match::matchId)
                .collect(Collectors.toSet());

        Map<String, int[]> counts = new TreeMap<>(); // playerId -> {goals, assists}
        Map<String, String> teamOf = new HashMap<>();
        Map<String, Set<String>> appearances = new HashMap<>();

        for (MatchScorer s : scorers) {
            if (!finished.contains(s.matchId()) || s.playerId() == null) continue;
            counts.computeIfAbsent(s.playerId(), k -> new int[2])[0]++;
            teamOf.putIfAbsent(s.playerId(), s.teamId());
            appearances.computeIfAbsent(s.playerId(), k -> new HashSet<>()).add(s.matchId());
        }
        for (MatchAssist a : assists) {
            if (!finished.contains(a.matchId()) || a.playerId() == null) continue;
            counts.computeIfAbsent(a.playerId(), k -> new int[2])[1]++;
            teamOf.putIfAbsent(a.playerId(), a.teamId());
            appearances.computeIfAbsent(a.playerId(), k -> new HashSet<>()).add(a.matchId());
        }

        List<PlayerTally> tallies = new ArrayList<>(counts.size());
        counts.forEach((playerId, c) -> tallies.add(new PlayerTally(
                playerId, teamOf.get(playerId), c[0], c[1], appearances.get(playerId).size())));
        tallies.sort(Comparator.comparingInt(PlayerTally::contributions).reversed()
                .thenComparing(Comparator.comparingInt(PlayerTally::goals).reversed())
                .thenComparing(PlayerTally::playerId));

        Map<String, Integer> cleanSheets = cleanSheets(matches);
        return new Leaderboards(tallies, cleanSheets, byGoalkeeper(cleanSheets, players));
    }

    /** Team id → number of finished matches in which the opponent scored 0. */
    public Map<String, Integer> cleanSheets(List<Match> matches) {
        Map<String, Integer> sheets = new TreeMap<>();
        for (Match m : matches) {
            if (!m.isPlayedResult()) continue;
            if (m.awayScore() == 0) sheets.merge(m.homeTeamId(), 1, Integer::sum);
            if (m.homeScore() == 0) sheets.merge(m.awayTeamId(), 1, Integer::sum);
        }
        return sheets;
    }

    /** The team's goalkeeper with the lowest shirt number, if the roster has one. */
    public static Optional<Player> goalkeeperOf(String teamId, List<Player> players) {
        return players.stream()
                .filter(p -> teamId.equals(p.teamId()) && p.isGoalkeeper())
                .min(Comparator.comparingInt(Player::shirt).thenComparing(Player::playerId));
    }

    private Map<String, Integer> byGoalkeeper(Map<String, Integer> cleanSheets, List<Player> players) {
        Map<String, Integer> result = new TreeMap<>();
        cleanSheets.forEach((teamId, count) ->
                goalkeeperOf(teamId, players).ifPresent(gk -> result.put(gk.playerId(), count)));
        return result;
    }
}
