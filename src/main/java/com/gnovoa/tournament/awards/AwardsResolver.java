package com.gnovoa.tournament.awards;

import com.gnovoa.tournament.awards.AwardSet.CleanSheetAward;
import com.gnovoa.tournament.awards.AwardSet.MvpAward;
import com.gnovoa.tournament.awards.AwardSet.PlayerAward;
import com.gnovoa.tournament.awards.AwardSet.TeamAward;
import com.gnovoa.tournament.model.*;
import com.gnovoa.tournament.schedule.KnockoutBracketBuilder;
import com.gnovoa.tournament.standings.StandingsCalculator;
import com.gnovoa.tournament.standings.StandingsRow;
import com.gnovoa.tournament.stats.Leaderboards;
import com.gnovoa.tournament.stats.PlayerTally;
import com.gnovoa.tournament.stats.StatsAggregator;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Final awards.
 *
 * <p>Placings come from the table for a league and from the bracket otherwise (third place is the
 * loser of the last semifinal). Top scorer and top assister ties go to the player with fewer
 * appearances, then to the lower player id. The MVP is the organizer's pick when there is one,
 * otherwise the player with most goals plus assists; ties go to more goals, then fewer appearances.
 */
public final class AwardsResolver {

    private final StandingsCalculator standings;
    private final StatsAggregator stats;
    private final KnockoutBracketBuilder bracket;

    public AwardsResolver(StandingsCalculator standings, StatsAggregator stats, KnockoutBracketBuilder bracket) {
        this.standings = standings;
        this.stats = stats;
        this.bracket = bracket;
    }

    /**
     * @param teams competing teams in registration order
     * @return {@link AwardSet#empty()} while no match is finished, apart from a manual MVP
     * @throws com.gnovoa.tournament.errors.UnresolvedDrawException if the finished Final (or the
     *         deciding semifinal) is level without a penalty winner
     */
    public AwardSet computeAwards(Tournament tournament,
                                  List<Team> teams,
                                  List<Match> matches,
                                  List<MatchScorer> scorers,
                                  List<MatchAssist> assists,
                                  List<Player> players) {
        Map<String, Player> playerById = players.stream()
                .collect(Collectors.toMap(Player::playerId, Function.identity(), (a, b) -> a));
        String manualMvp = tournament.structure().selectedMvpPlayerId();

        if (matches.stream().noneMatch(Match::isPlayedResult)) {
            AwardSet empty = AwardSet.empty();
            return manualMvp == null ? empty : empty.withMvp(manualMvp(manualMvp, playerById, Leaderboards.empty()));
        }

        Map<String, Team> teamById = new HashMap<>();
        teams.forEach(t -> teamById.put(t.teamId(), t));

        List<String> podium = placings(tournament, teams, matches);
        Leaderboards boards = stats.computeLeaderboards(matches, scorers, assists, players);

        PlayerAward topScorer = boards.topScorers().stream().findFirst()
                .map(p -> playerAward(p, p.goals(), playerById)).orElse(null);
        PlayerAward topAssister = boards.topAssisters().stream().findFirst()
                .map(p -> playerAward(p, p.assists(), playerById)).orElse(null);

        MvpAward mvp = manualMvp != null
                ? manualMvp(manualMvp, playerById, boards)
                : computedMvp(boards, playerById);

        return new AwardSet(
                teamAward(podium, 0, teamById),
                teamAward(podium, 1, teamById),
                teamAward(podium, 2, teamById),
                topScorer,
                topAssister,
                cleanSheetLeader(boards, teams, matches, players),
                mvp);
    }

    // winner, runner-up, third; shorter while undecided
    private List<String> placings(Tournament tournament, List<Team> teams, List<Match> matches) {
        if (tournament.format() instanceof TournamentFormat.League) {
            List<Match> league = matches.stream().filter(m -> m.stage() == MatchStage.LEAGUE).toList();
            if (league.isEmpty() || !league.stream().allMatch(Match::isFinished)) return List.of();
            return standings.computeStandings(teams, league).stream()
                    .limit(3)
                    .map(StandingsRow::teamId)
                    .toList();
        }

        List<Match> knockout = matches.stream().filter(m -> m.stage() == MatchStage.KNOCKOUT).toList();
        return bracket.resolveOutcome(knockout)
                .map(o -> {
                    List<String> podium = new ArrayList<>();
                    podium.add(o.winnerTeamId());
                    podium.add(o.runnerUpTeamId());
                    if (o.thirdPlaceTeamId() != null) podium.add(o.thirdPlaceTeamId());
                    return podium;
                })
                .orElse(List.of());
    }

    // most clean sheets, then fewer matches played, then registration order
    private CleanSheetAward cleanSheetLeader(Leaderboards boards, List<Team> teams, List<Match> matches, List<Player> players) {
        Team best = null;
        int bestCount = 0;
        long bestPlayed = 0;
        for (Team team : teams) {
            int count = boards.cleanSheetsByTeam().getOrDefault(team.teamId(), 0);
            if (count == 0) continue;
            long played = matchesPlayed(team.teamId(), matches);
            if (count > bestCount || (count == bestCount && played < bestPlayed)) {
                best = team;
                bestCount = count;
                bestPlayed = played;
            }
        }
        if (best == null) return null;

        Optional<Player> keeper = StatsAggregator.goalkeeperOf(best.teamId(), players);
        return new CleanSheetAward(best.teamId(), best.name(),
                keeper.map(Player::playerId).orElse(null),
                keeper.map(Player::name).orElse(null),
                bestCount);
    }

    private static long matchesPlayed(String teamId, List<Match> matches) {
        return matches.stream().filter(m -> m.isPlayedResult() && m.involves(teamId)).count();
    }

    private MvpAward computedMvp(Leaderboards boards, Map<String, Player> playerById) {
        return boards.players().stream()
                .filter(p -> p.contributions() > 0)
                .min(Comparator.comparingInt(PlayerTally::contributions).reversed()
                        .thenComparing(Comparator.comparingInt(PlayerTally::goals).reversed())
                        .thenComparingInt(PlayerTally::appearances)
                        .thenComparing(PlayerTally::playerId))
                .map(p -> new MvpAward(p.playerId(), nameOf(p.playerId(), playerById), p.teamId(),
                        p.goals(), p.assists(), false))
                .orElse(null);
    }

    private MvpAward manualMvp(String playerId, Map<String, Player> playerById, Leaderboards boards) {
        Player player = playerById.get(playerId);
        Optional<PlayerTally> tally = boards.players().stream().filter(p -> p.playerId().equals(playerId)).findFirst();
        return new MvpAward(playerId,
                player == null ? null : player.name(),
                player != null ? player.teamId() : tally.map(PlayerTally::teamId).orElse(null),
                tally.map(PlayerTally::goals).orElse(0),
                tally.map(PlayerTally::assists).orElse(0),
                true);
    }

    private static PlayerAward playerAward(PlayerTally p, int value, Map<String, Player> playerById) {
        return new PlayerAward(p.playerId(), nameOf(p.playerId(), playerById), p.teamId(), value, p.appearances());
    }

    private static TeamAward teamAward(List<String> podium, int index, Map<String, Team> teamById) {
        if (index >= podium.size()) return null;
        String teamId = podium.get(index);
        Team team = teamById.get(teamId);
        return new TeamAward(teamId, team == null ? teamId : team.name());
    }

    private static String nameOf(String playerId, Map<String, Player> playerById) {
        Player p = playerById.get(playerId);
        return p == null ? playerId : p.name();
    }
}
