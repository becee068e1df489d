package com.gnovoa.tournament.service;

import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.errors.NotFoundException;
import com.gnovoa.tournament.events.TournamentEvent;
import com.gnovoa.tournament.events.TournamentEventType;
import com.gnovoa.tournament.model.*;
import com.gnovoa.tournament.out.EventPublisher;
import com.gnovoa.tournament.store.InMemoryTournamentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MatchResultServiceTest {

    @Mock
    EventPublisher publisher;

    private InMemoryTournamentStore store;
    private MatchResultService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryTournamentStore();
        service = new MatchResultService(store, publisher);

        Tournament t = store.createTournament(new Tournament("T", "Cup", new TournamentFormat.Knockout(),
                TournamentStatus.CLOSED, 2, 8, LocalDate.of(2026, 6, 1), TournamentStructure.initial()));
        store.commit("T", 0, t.structure().withKnockoutFixtures(List.of("t1", "t2", "t3", "t4", "t5"), 4), List.of(), List.of(
                Match.scheduled("ko", "T", MatchStage.KNOCKOUT, "Semi-Finals", 1, 1, null, "t1", "t2"),
                Match.scheduled("lg", "T", MatchStage.LEAGUE, "Round 1", 1, null, null, "t3", "t4"),
                Match.bye("bye", "T", "Semi-Finals", 2, "t5")));

        store.savePlayer(new Player("p1", "One", "t1", Position.FORWARD, 9));
        store.savePlayer(new Player("p2", "Two", "t1", Position.MIDFIELDER, 8));
        store.savePlayer(new Player("p3", "Three", "t2", Position.FORWARD, 9));
    }

    @Test
    void matchGoesLiveAtNilNil() {
        Match live = service.start("ko");

        assertThat(live.status()).isEqualTo(MatchStatus.LIVE);
        assertThat(live.homeScore()).isZero();
        assertThat(live.awayScore()).isZero();
        assertThatThrownBy(() -> service.start("ko")).isInstanceOf(InvalidInputException.class);
        assertThat(events()).extracting(TournamentEvent::type).containsExactly(TournamentEventType.MATCH_STARTED);
    }

    @Test
    void finishedScoreIsFinal() {
        service.updateScore("lg", 2, 1, null, null);
        Match finished = service.finish("lg");

        assertThat(finished.status()).isEqualTo(MatchStatus.FINISHED);
        assertThatThrownBy(() -> service.updateScore("lg", 3, 1, null, null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.start("lg")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.finish("lg")).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void finishNeedsAScore() {
        assertThatThrownBy(() -> service.finish("ko"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("no score");
    }

    @Test
    void scoresCannotBeNegative() {
        assertThatThrownBy(() -> service.updateScore("ko", -1, 0, null, null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void penaltiesOnlyForLevelKnockoutScores() {
        assertThatThrownBy(() -> service.updateScore("lg", 1, 1, 4, 3))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("knockout");
        assertThatThrownBy(() -> service.updateScore("ko", 2, 1, 4, 3))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("level");
        assertThatThrownBy(() -> service.updateScore("ko", 1, 1, 4, null)).isInstanceOf(InvalidInputException.class);

        Match level = service.updateScore("ko", 1, 1, 4, 3);
        assertThat(level.homePenalties()).isEqualTo(4);
        assertThat(level.awayPenalties()).isEqualTo(3);
    }

    @Test
    void shootOutCanFollowFullTimeOnce() {
        service.updateScore("ko", 2, 2, null, null);
        service.finish("ko");

        assertThatThrownBy(() -> service.recordPenalties("ko", 3, 3))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("winner");

        Match settled = service.recordPenalties("ko", 3, 2);
        assertThat(settled.homePenalties()).isEqualTo(3);
        assertThat(settled.isFinished()).isTrue();

        assertThatThrownBy(() -> service.recordPenalties("ko", 5, 4))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("already decided");
    }

    @Test
    void goalsAreRecordedWithTheirAssist() {
        service.start("ko");

        MatchScorer goal = service.recordGoal("ko", "p1", 23, "p2");

        assertThat(goal.teamId()).isEqualTo("t1");
        assertThat(goal.minute()).isEqualTo(23);
        assertThat(store.scorersOf("T")).containsExactly(goal);
        assertThat(store.assistsOf("T")).singleElement()
                .satisfies(a -> {
                    assertThat(a.scorerId()).isEqualTo(goal.scorerId());
                    assertThat(a.playerId()).isEqualTo("p2");
                });
        assertThat(service.getMatch("ko").homeScore()).isZero();
    }

    @Test
    void goalEventCarriesScorerAndAssist() {
        service.start("ko");
        service.recordGoal("ko", "p3", null, null);

        TournamentEvent goal = events().get(1);
        assertThat(goal.type()).isEqualTo(TournamentEventType.GOAL_RECORDED);
        assertThat(goal.matchId()).isEqualTo("ko");
        assertThat(goal.payload())
                .containsEntry("playerId", "p3")
                .containsEntry("teamId", "t2")
                .containsEntry("assistPlayerId", null);
    }

    @Test
    void invalidGoalsWriteNothing() {
        assertThatThrownBy(() -> service.recordGoal("ko", "p1", 10, null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("not started");

        service.start("ko");
        assertThatThrownBy(() -> service.recordGoal("ko", "p1", 10, "p3")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.recordGoal("ko", "p1", 10, "p1")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.recordGoal("ko", "ghost", 10, null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.recordGoal("ko", "p1", 0, null)).isInstanceOf(InvalidInputException.class);

        assertThat(store.scorersOf("T")).isEmpty();
        assertThat(store.assistsOf("T")).isEmpty();
    }

    @Test
    void byesCannotBeEdited() {
        assertThatThrownBy(() -> service.start("bye")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.updateScore("bye", 1, 0, null, null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.schedule("bye", "Pitch 1", null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void unknownMatch() {
        assertThatThrownBy(() -> service.getMatch("nope"))
                .isInstanceOfSatisfying(NotFoundException.class, e -> assertThat(e.code()).isEqualTo("not_found"));
    }

    @Test
    void scheduleSetsPitchAndKickoff() {
        Instant kickoff = Instant.parse("2026-06-01T15:00:00Z");

        Match scheduled = service.schedule("ko", "Pitch 2", kickoff);

        assertThat(scheduled.pitch()).isEqualTo("Pitch 2");
        assertThat(scheduled.kickoffAt()).isEqualTo(kickoff);
        verifyNoInteractions(publisher);
    }

    private List<TournamentEvent> events() {
        ArgumentCaptor<TournamentEvent> captor = ArgumentCaptor.forClass(TournamentEvent.class);
        verify(publisher, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues();
    }
}
