package com.gnovoa.tournament.stats;

import com.gnovoa.tournament.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gnovoa.tournament.Fixtures.played;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatsAggregatorTest {

    private final StatsAggregator aggregator = new StatsAggregator();

    private final List<Player> players = List.of(
            new Player("gk1", "Keeper One", "t1", Position.GOALKEEPER, 1),
            new Player("gk1b", "Backup Keeper", "t1", Position.GOALKEEPER, 12),
            new Player("f1", "Forward One", "t1", Position.FORWARD, 9),
            new Player("m1", "Mid One", "t1", Position.MIDFIELDER, 8),
            new Player("f2", "Forward Two", "t2", Position.FORWARD, 9));

    private final List<Match> matches = List.of(
            played("m-a", "t1", "t2", 2, 0),
            played("m-b", "t2", "t1", 1, 1),
            Match.scheduled("m-c", "x", MatchStage.LEAGUE, "Round 3", 3, null, null, "t1", "t2").withStatus(MatchStatus.LIVE));

    private final List<MatchScorer> scorers = List.of(
            new MatchScorer("s1", "m-a", "f1", "t1", 10),
            new MatchScorer("s2", "m-a", "f1", "t1", 70),
            new MatchScorer("s3", "m-b", "f2", "t2", 5),
            new MatchScorer("s4", "m-b", "m1", "t1", 80),
            new MatchScorer("s5", "m-c", "f2", "t2", 3));

    private final List<MatchAssist> assists = List.of(
            new MatchAssist("a1", "m-a", "s1", "m1", "t1"),
            new MatchAssist("a2", "m-b", "s4", "f1", "t1"),
            new MatchAssist("a3", "m-c", "s5", "f1", "t1"));

    @Test
    void countsGoalsAndAssistsOfFinishedMatchesOnly() {
        Leaderboards boards = aggregator.computeLeaderboards(matches, scorers, assists, players);

        assertThat(boards.goalsOf("f1")).isEqualTo(2);
        assertThat(boards.goalsOf("f2")).isEqualTo(1);
        assertThat(boards.topScorers()).extracting(PlayerTally::playerId).containsExactly("f1", "f2", "m1");
        assertThat(boards.topAssisters()).extracting(PlayerTally::playerId).containsExactly("f1", "m1");
        assertThat(boards.topAssisters().get(0).assists()).isEqualTo(1);
    }

    @Test
    void appearancesComeFromScoreSheetParticipation() {
        Leaderboards boards = aggregator.computeLeaderboards(matches, scorers, assists, players);

        PlayerTally f1 = tally(boards, "f1");
        PlayerTally m1 = tally(boards, "m1");

        assertThat(f1.appearances()).isEqualTo(2);   // scored twice in m-a, assisted in m-b
        assertThat(m1.appearances()).isEqualTo(2);   // assisted in m-a, scored in m-b
        assertThat(tally(boards, "f2").appearances()).isEqualTo(1);
        assertThat(boards.players()).noneMatch(p -> p.playerId().equals("gk1"));
    }

    @Test
    void ratesArePerAppearance() {
        PlayerTally f1 = tally(aggregator.computeLeaderboards(matches, scorers, assists, players), "f1");

        assertThat(f1.goalsPerGame()).isEqualTo(1.0);
        assertThat(f1.assistsPerGame()).isEqualTo(0.5);
        assertThat(f1.contributionsPerGame()).isCloseTo(1.5, within(1e-9));
        assertThat(new PlayerTally("p", "t", 0, 0, 0).goalsPerGame()).isZero();
    }

    @Test
    void cleanSheetsGoToTeamAndFirstChoiceKeeper() {
        Leaderboards boards = aggregator.computeLeaderboards(matches, scorers, assists, players);

        assertThat(boards.cleanSheetsByTeam()).containsExactly(org.assertj.core.api.Assertions.entry("t1", 1));
        assertThat(boards.cleanSheetsByGoalkeeper()).containsOnlyKeys("gk1");
    }

    @Test
    void goallessDrawCountsForBothSides() {
        assertThat(aggregator.cleanSheets(List.of(played("z", "t1", "t2", 0, 0))))
                .containsEntry("t1", 1)
                .containsEntry("t2", 1);
    }

    @Test
    void nothingFinishedMeansEmptyBoards() {
        Leaderboards boards = aggregator.computeLeaderboards(List.of(matches.get(2)), scorers, assists, players);

        assertThat(boards.players()).isEmpty();
        assertThat(boards.cleanSheetsByTeam()).isEmpty();
    }

    private static PlayerTally tally(Leaderboards boards, String playerId) {
        return boards.players().stream().filter(p -> p.playerId().equals(playerId)).findFirst().orElseThrow();
    }
}
