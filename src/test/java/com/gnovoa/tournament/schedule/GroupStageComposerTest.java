package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.Fixtures;
import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.errors.NotReadyException;
import com.gnovoa.tournament.model.*;
import com.gnovoa.tournament.standings.StandingsCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupStageComposerTest {

    private final GroupStageComposer composer =
            new GroupStageComposer(new RoundRobinScheduler(), new StandingsCalculator());

    @Test
    void groupCountDependsOnFieldSize() {
        assertThat(composer.groupCountFor(8, GroupConfig.auto(2))).isEqualTo(2);
        assertThat(composer.groupCountFor(15, GroupConfig.auto(2))).isEqualTo(2);
        assertThat(composer.groupCountFor(16, GroupConfig.auto(2))).isEqualTo(4);
        assertThat(composer.groupCountFor(16, new GroupConfig(3, 1))).isEqualTo(3);
    }

    @Test
    void customThresholdsAreHonoured() {
        GroupStageComposer custom = new GroupStageComposer(new RoundRobinScheduler(), new StandingsCalculator(), 3, 6, 24);

        assertThat(custom.groupCountFor(20, GroupConfig.auto(1))).isEqualTo(3);
        assertThat(custom.groupCountFor(24, GroupConfig.auto(1))).isEqualTo(6);
    }

    @Test
    @DisplayName("Remainder teams go to the first groups")
    void remainderGoesToEarlyGroups() {
        Map<String, List<Team>> groups = composer.composeGroups(Fixtures.teams(18), GroupConfig.auto(2));

        assertThat(groups).containsOnlyKeys("Group A", "Group B", "Group C", "Group D");
        assertThat(groups.values()).extracting(List::size).containsExactly(5, 5, 4, 4);
        assertThat(groups.get("Group A")).extracting(Team::teamId).containsExactly("t1", "t2", "t3", "t4", "t5");
    }

    @Test
    void oddSmallFieldSplitsIntoTwo() {
        Map<String, List<Team>> groups = composer.composeGroups(Fixtures.teams(11), GroupConfig.auto(2));

        assertThat(groups.get("Group A")).hasSize(6);
        assertThat(groups.get("Group B")).hasSize(5);
    }

    @Test
    void singleTableHoldsEveryone() {
        Map<String, List<Team>> groups = composer.composeGroups(Fixtures.teams(8), GroupConfig.singleTable(4));

        assertThat(groups).containsOnlyKeys("League Stage");
        assertThat(groups.get("League Stage")).hasSize(8);
    }

    @Test
    void rejectsGroupsThatCannotWork() {
        assertThatThrownBy(() -> composer.composeGroups(Fixtures.teams(3), GroupConfig.auto(1)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> composer.composeGroups(Fixtures.teams(4), GroupConfig.auto(2)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("cannot send");
    }

    @Test
    void groupFixturesAreLabelledByGroupAndRound() {
        List<Match> matches = composer.groupFixtures("c", "Group B", Fixtures.teams(4));

        assertThat(matches).hasSize(6);
        assertThat(matches).allSatisfy(m -> {
            assertThat(m.stage()).isEqualTo(MatchStage.GROUP);
            assertThat(m.groupName()).isEqualTo("Group B");
            assertThat(m.roundLabel()).startsWith("Group B - Round ");
        });
        assertThat(matches).extracting(Match::matchId).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Qualifiers cross over: A1 v B2 and B1 v A2")
    void qualifiersCrossOver() {
        List<Team> teams = Fixtures.teams(6);
        Map<String, List<Team>> groups = composer.composeGroups(teams, GroupConfig.auto(2));
        List<Match> results = List.of(
                groupResult("a1", "Group A", "t3", "t1", 2, 0),
                groupResult("a2", "Group A", "t3", "t2", 1, 0),
                groupResult("a3", "Group A", "t1", "t2", 3, 0),
                groupResult("b1", "Group B", "t5", "t4", 1, 0),
                groupResult("b2", "Group B", "t5", "t6", 2, 1),
                groupResult("b3", "Group B", "t6", "t4", 2, 0));

        List<Team> seeds = composer.qualifiers(groups, results, 2);

        assertThat(seeds).extracting(Team::teamId).containsExactly("t3", "t5", "t1", "t6");

        List<Match> bracket = new KnockoutBracketBuilder().seedBracket("c", seeds);
        assertThat(bracket).extracting(Match::homeTeamId).containsExactly("t3", "t5");
        assertThat(bracket).extracting(Match::awayTeamId).containsExactly("t6", "t1");
    }

    @Test
    void qualifiersWaitForEveryGroupMatch() {
        Map<String, List<Team>> groups = composer.composeGroups(Fixtures.teams(6), GroupConfig.auto(1));
        List<Match> matches = List.of(
                groupResult("a1", "Group A", "t1", "t2", 1, 0),
                Match.scheduled("b1", "c", MatchStage.GROUP, "Group B - Round 1", 1, null, "Group B", "t4", "t5"));

        assertThat(composer.isGroupStageFinished(matches)).isFalse();
        assertThatThrownBy(() -> composer.qualifiers(groups, matches, 1)).isInstanceOf(NotReadyException.class);
    }

    private static Match groupResult(String id, String group, String home, String away, int hs, int as) {
        return Fixtures.finished(Match.scheduled(id, "c", MatchStage.GROUP, group + " - Round 1", 1, null, group, home, away), hs, as);
    }
}
