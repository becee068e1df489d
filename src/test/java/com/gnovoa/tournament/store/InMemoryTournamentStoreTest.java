package com.gnovoa.tournament.store;

import com.gnovoa.tournament.Fixtures;
import com.gnovoa.tournament.errors.NotFoundException;
import com.gnovoa.tournament.errors.StaleStructureException;
import com.gnovoa.tournament.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTournamentStoreTest {

    private InMemoryTournamentStore store;
    private Tournament tournament;

    @BeforeEach
    void setUp() {
        store = new InMemoryTournamentStore();
        tournament = store.createTournament(Fixtures.tournament("T", new TournamentFormat.League()));
    }

    @Test
    void commitSwapsStructureAndAddsMatches() {
        TournamentStructure next = tournament.structure().withFixtures(List.of(), Map.of());

        Tournament updated = store.commit("T", 0, next, List.of(), List.of(match("m1"), match("m2")));

        assertThat(updated.structure().version()).isEqualTo(1);
        assertThat(updated.structure().fixturesGenerated()).isTrue();
        assertThat(store.findTournament("T")).contains(updated);
        assertThat(store.matchesOf("T")).extracting(Match::matchId).containsExactly("m1", "m2");
    }

    @Test
    void staleVersionWritesNothing() {
        store.commit("T", 0, tournament.structure().withFixtures(List.of(), Map.of()), List.of(), List.of(match("m1")));

        assertThatThrownBy(() -> store.commit("T", 0, tournament.structure().withFixtures(List.of(), Map.of()),
                List.of("m1"), List.of(match("m9"))))
                .isInstanceOfSatisfying(StaleStructureException.class, e -> {
                    assertThat(e.code()).isEqualTo("stale_structure");
                    assertThat(e.getMessage()).contains("T");
                });

        assertThat(store.matchesOf("T")).extracting(Match::matchId).containsExactly("m1");
        assertThat(store.findTournament("T").orElseThrow().structure().version()).isEqualTo(1);
    }

    @Test
    void removedMatchesTakeTheirGoalRecordsWithThem() {
        store.commit("T", 0, tournament.structure().withFixtures(List.of(), Map.of()), List.of(), List.of(match("m1"), match("m2")));
        store.saveScorer(new MatchScorer("g1", "m1", "p1", "t1", 10));
        store.saveScorer(new MatchScorer("g2", "m2", "p1", "t1", 20));
        store.saveAssist(new MatchAssist("a1", "m1", "g1", "p2", "t1"));

        Tournament current = store.findTournament("T").orElseThrow();
        store.commit("T", 1, current.structure().cleared(), List.of("m1"), List.of());

        assertThat(store.findMatch("m1")).isEmpty();
        assertThat(store.scorersOf("T")).extracting(MatchScorer::scorerId).containsExactly("g2");
        assertThat(store.assistsOf("T")).isEmpty();
    }

    @Test
    void clearingGoalRecordsKeepsTheMatch() {
        store.commit("T", 0, tournament.structure().withFixtures(List.of(), Map.of()), List.of(), List.of(match("m1"), match("m2")));
        store.saveScorer(new MatchScorer("g1", "m1", "p1", "t1", 10));
        store.saveScorer(new MatchScorer("g2", "m2", "p1", "t1", 20));
        store.saveAssist(new MatchAssist("a1", "m1", "g1", "p2", "t1"));

        store.clearGoalRecords("m1");

        assertThat(store.findMatch("m1")).isPresent();
        assertThat(store.scorersOf("T")).extracting(MatchScorer::scorerId).containsExactly("g2");
        assertThat(store.assistsOf("T")).isEmpty();
    }

    @Test
    void updateMatchNeverAddsOne() {
        assertThatThrownBy(() -> store.updateMatch(match("ghost"))).isInstanceOf(NotFoundException.class);
    }

    @Test
    void statusChangeKeepsStructure() {
        store.commit("T", 0, tournament.structure().withFixtures(List.of(), Map.of()), List.of(), List.of());

        Tournament updated = store.updateStatus("T", TournamentStatus.COMPLETED);

        assertThat(updated.status()).isEqualTo(TournamentStatus.COMPLETED);
        assertThat(updated.structure().version()).isEqualTo(1);
        assertThatThrownBy(() -> store.updateStatus("nope", TournamentStatus.OPEN)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void listsComeBackInInsertionOrder() {
        List<Team> teams = Fixtures.teams(3);
        Fixtures.paid(teams, "T").forEach(store::saveRegistration);
        store.savePlayer(new Player("p2", "B", "t2", Position.FORWARD, 9));
        store.savePlayer(new Player("p1", "A", "t1", Position.FORWARD, 9));
        store.savePlayer(new Player("p3", "C", "t3", Position.FORWARD, 9));

        assertThat(store.registrationsOf("T")).extracting(Registration::registrationId).containsExactly("r1", "r2", "r3");
        assertThat(store.registrationsOf("other")).isEmpty();
        assertThat(store.playersOf(List.of("t1", "t2"))).extracting(Player::playerId).containsExactly("p2", "p1");
    }

    private static Match match(String id) {
        return Match.scheduled(id, "T", MatchStage.LEAGUE, "Round 1", 1, null, null, "t1", "t2");
    }
}
