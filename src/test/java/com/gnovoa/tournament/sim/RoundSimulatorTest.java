package com.gnovoa.tournament.sim;

import com.gnovoa.tournament.config.EngineWiring;
import com.gnovoa.tournament.config.SimProperties;
import com.gnovoa.tournament.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundSimulatorTest {

    private static final List<Player> HOME = List.of(
            new Player("h-gk", "Home Keeper", "home", Position.GOALKEEPER, 1),
            new Player("h-df", "Home Back", "home", Position.DEFENDER, 4),
            new Player("h-mf", "Home Mid", "home", Position.MIDFIELDER, 8),
            new Player("h-fw", "Home Striker", "home", Position.FORWARD, 9));
    private static final List<Player> AWAY = List.of(
            new Player("a-gk", "Away Keeper", "away", Position.GOALKEEPER, 1),
            new Player("a-fw", "Away Striker", "away", Position.FORWARD, 9));

    private static Match match(MatchStage stage) {
        return Match.scheduled("m1", "T", stage, "Round 1", 1, stage == MatchStage.KNOCKOUT ? 1 : null, null, "home", "away");
    }

    @Test
    void sameSeedSameResult() {
        RoundSimulator.SimulatedMatch a = new RoundSimulator(new SplittableRandomSource(42), SimProperties.defaults())
                .simulate(match(MatchStage.LEAGUE), HOME, AWAY);
        RoundSimulator.SimulatedMatch b = new RoundSimulator(new SplittableRandomSource(42), SimProperties.defaults())
                .simulate(match(MatchStage.LEAGUE), HOME, AWAY);

        assertThat(a.match()).isEqualTo(b.match());
        assertThat(sheet(a)).isEqualTo(sheet(b));
    }

    @Test
    void configuredSeedMakesTheWiredSourceRepeatable() {
        SimProperties seeded = new SimProperties(0.7, 0.7, 0.4, 0.3, 0.3, 0.6, 42L);
        RandomSource wired = new EngineWiring().randomSource(seeded);
        RandomSource direct = new SplittableRandomSource(42);

        for (int i = 0; i < 5; i++) {
            assertThat(wired.nextIntInclusive(0, 100)).isEqualTo(direct.nextIntInclusive(0, 100));
        }
        assertThat(new EngineWiring().randomSource(SimProperties.defaults())).isInstanceOf(SplittableRandomSource.class);
    }

    private static List<String> sheet(RoundSimulator.SimulatedMatch sim) {
        return sim.scorers().stream().map(s -> s.playerId() + "@" + s.minute()).toList();
    }

    @Test
    void scoreSheetMatchesTheScore() {
        RoundSimulator sim = new RoundSimulator(new SplittableRandomSource(7), SimProperties.defaults());
        for (int i = 0; i < 200; i++) {
            RoundSimulator.SimulatedMatch result = sim.simulate(match(MatchStage.GROUP), HOME, AWAY);
            Match m = result.match();

            assertThat(m.status()).isEqualTo(MatchStatus.FINISHED);
            assertThat(m.homeScore()).isBetween(0, 6);
            assertThat(m.awayScore()).isBetween(0, 6);
            assertThat(m.homePenalties()).isNull();
            assertThat(result.scorers().stream().filter(s -> s.teamId().equals("home"))).hasSize(m.homeScore());
            assertThat(result.scorers().stream().filter(s -> s.teamId().equals("away"))).hasSize(m.awayScore());
            assertThat(result.scorers()).allSatisfy(s -> {
                assertThat(s.playerId()).isIn("h-mf", "h-fw", "a-fw");
                assertThat(s.minute()).isBetween(1, 90);
            });

            Set<String> goalIds = result.scorers().stream().map(MatchScorer::scorerId).collect(Collectors.toSet());
            assertThat(result.assists()).allSatisfy(a -> {
                assertThat(goalIds).contains(a.scorerId());
                MatchScorer goal = result.scorers().stream().filter(s -> s.scorerId().equals(a.scorerId())).findFirst().orElseThrow();
                assertThat(a.teamId()).isEqualTo(goal.teamId());
                assertThat(a.playerId()).isNotEqualTo(goal.playerId());
            });
        }
    }

    @Test
    void levelKnockoutGamesAreSettledOnPenalties() {
        SimProperties alwaysGoalless = new SimProperties(0.7, 0.7, 0.4, 0.3, 1.0, 0.6, null);
        RoundSimulator sim = new RoundSimulator(new SplittableRandomSource(3), alwaysGoalless);

        for (int i = 0; i < 50; i++) {
            Match m = sim.simulate(match(MatchStage.KNOCKOUT), HOME, AWAY).match();

            assertThat(m.homeScore()).isZero();
            assertThat(m.awayScore()).isZero();
            assertThat(m.homePenalties()).isGreaterThanOrEqualTo(3);
            assertThat(m.awayPenalties()).isGreaterThanOrEqualTo(3);
            assertThat(m.homePenalties()).isNotEqualTo(m.awayPenalties());
        }
    }

    @Test
    void emptyRosterGivesAScoreWithoutScorers() {
        RoundSimulator sim = new RoundSimulator(new SplittableRandomSource(11), SimProperties.defaults());
        for (int i = 0; i < 20; i++) {
            assertThat(sim.simulate(match(MatchStage.LEAGUE), List.of(), List.of()).scorers()).isEmpty();
        }
    }

    @Test
    void byesAndFinishedMatchesAreRejected() {
        RoundSimulator sim = new RoundSimulator(new SplittableRandomSource(1), SimProperties.defaults());

        assertThatThrownBy(() -> sim.simulate(Match.bye("b", "T", "Quarter-Finals", 1, "home"), HOME, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        Match done = match(MatchStage.LEAGUE).withScore(1, 0).withStatus(MatchStatus.FINISHED);
        assertThatThrownBy(() -> sim.simulate(done, HOME, AWAY)).isInstanceOf(IllegalArgumentException.class);
    }
}
