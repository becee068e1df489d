package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.Fixtures;
import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.MatchStage;
import com.gnovoa.tournament.model.Team;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FixtureValidatorTest {

    private final FixtureValidator validator = new FixtureValidator();

    @Test
    void generatedRoundRobinIsComplete() {
        List<Team> teams = Fixtures.teams(5);
        List<Match> matches = new GroupStageComposer(new RoundRobinScheduler(), null)
                .groupFixtures("v", "Group A", teams);

        FixtureValidator.RoundRobinReport report = validator.validateRoundRobin(teams, matches);

        assertThat(report.complete()).isTrue();
        assertThat(report.expectedMatches()).isEqualTo(10);
        assertThat(report.actualMatches()).isEqualTo(10);
    }

    @Test
    void reportsMissingAndDuplicatePairs() {
        List<Team> teams = Fixtures.teams(3);
        List<Match> matches = new ArrayList<>();
        matches.add(match("1", "t1", "t2"));
        matches.add(match("2", "t2", "t1"));
        matches.add(match("3", "t2", "t3"));

        FixtureValidator.RoundRobinReport report = validator.validateRoundRobin(teams, matches);

        assertThat(report.complete()).isFalse();
        assertThat(report.missingPairs()).containsExactly("t1 v t3");
        assertThat(report.duplicatePairs()).containsExactly("t1 v t2");
    }

    @Test
    void reportsTeamsFromOutsideTheList() {
        List<Match> matches = List.of(match("1", "t1", "t9"));

        FixtureValidator.RoundRobinReport report = validator.validateRoundRobin(Fixtures.teams(2), matches);

        assertThat(report.complete()).isFalse();
        assertThat(report.unknownTeams()).containsExactly("t9");
        assertThat(report.missingPairs()).containsExactly("t1 v t2");
    }

    private static Match match(String id, String home, String away) {
        return Match.scheduled(id, "v", MatchStage.LEAGUE, "Round 1", 1, null, null, home, away);
    }
}
