package com.gnovoa.tournament.service;

import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.errors.NotFoundException;
import com.gnovoa.tournament.events.TournamentEvent;
import com.gnovoa.tournament.events.TournamentEventType;
import com.gnovoa.tournament.model.*;
import com.gnovoa.tournament.out.EventPublisher;
import com.gnovoa.tournament.store.TournamentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Score entry. Status only moves forward (scheduled → live → finished), a finished score is final
 * apart from settling a level knockout match on penalties,
 * and byes cannot be touched. Never advances the competition itself.
 */
@Service
public class MatchResultService {

    private static final Logger log = LoggerFactory.getLogger(MatchResultService.class);

    private final TournamentStore store;
    private final EventPublisher publisher;

    public MatchResultService(TournamentStore store, EventPublisher publisher) {
        this.store = store;
        this.publisher = publisher;
    }

    public Match getMatch(String matchId) {
        return store.findMatch(matchId).orElseThrow(() -> new NotFoundException("match", matchId));
    }

    /** Kicks off: live at 0-0. */
    public Match start(String matchId) {
        Match m = editable(matchId);
        requireTransition(m, MatchStatus.LIVE);
        Match live = store.updateMatch(m.withScore(0, 0).withStatus(MatchStatus.LIVE));
        log.info("Match {} started: {} v {}", matchId, m.homeTeamId(), m.awayTeamId());
        publish(TournamentEventType.MATCH_STARTED, live);
        return live;
    }

    /** Sets the score, and the shoot-out for knockout matches. Not allowed once finished. */
    public Match updateScore(String matchId, int home, int away, Integer homePenalties, Integer awayPenalties) {
        Match m = editable(matchId);
        if (m.isFinished()) throw new InvalidInputException("Match " + matchId + " is finished");
        if (home < 0 || away < 0) throw new InvalidInputException("Scores cannot be negative");

        boolean penalties = homePenalties != null || awayPenalties != null;
        if (penalties) {
            if (m.stage() != MatchStage.KNOCKOUT) {
                throw new InvalidInputException("Penalties only apply to knockout matches");
            }
            if (homePenalties == null || awayPenalties == null || homePenalties < 0 || awayPenalties < 0) {
                throw new InvalidInputException("Both penalty scores are needed and cannot be negative");
            }
            if (home != away) {
                throw new InvalidInputException("Penalties only apply to a level score");
            }
        }

        Match updated = store.updateMatch(m.withScore(home, away).withPenalties(homePenalties, awayPenalties));
        log.debug("Match {} score {}-{}", matchId, home, away);
        publish(TournamentEventType.MATCH_UPDATED, updated);
        return updated;
    }

    /**
     * Settles a level knockout match on penalties. Also allowed after full time, as long as the
     * shoot-out has not already produced a winner.
     */
    public Match recordPenalties(String matchId, int homePenalties, int awayPenalties) {
        Match m = editable(matchId);
        if (m.stage() != MatchStage.KNOCKOUT) throw new InvalidInputException("Penalties only apply to knockout matches");
        if (m.homeScore() == null || !m.homeScore().equals(m.awayScore())) {
            throw new InvalidInputException("Penalties only apply to a level score");
        }
        if (homePenalties < 0 || awayPenalties < 0 || homePenalties == awayPenalties) {
            throw new InvalidInputException("A shoot-out needs a winner");
        }
        boolean decided = m.homePenalties() != null && m.awayPenalties() != null
                && !m.homePenalties().equals(m.awayPenalties());
        if (m.isFinished() && decided) {
            throw new InvalidInputException("Match " + matchId + " was already decided on penalties");
        }

        Match updated = store.updateMatch(m.withPenalties(homePenalties, awayPenalties));
        log.info("Match {} decided on penalties {}-{}", matchId, homePenalties, awayPenalties);
        publish(TournamentEventType.MATCH_UPDATED, updated);
        return updated;
    }

    /** Records a goal and, optionally, its assist. Goals do not change the score. */
    public MatchScorer recordGoal(String matchId, String playerId, Integer minute, String assistPlayerId) {
        Match m = editable(matchId);
        if (m.status() == MatchStatus.SCHEDULED) {
            throw new InvalidInputException("Match " + matchId + " has not started");
        }
        if (minute != null && (minute < 1 || minute > 130)) {
            throw new InvalidInputException("Minute out of range: " + minute);
        }

        Map<String, Player> squad = new HashMap<>();
        store.playersOf(List.of(m.homeTeamId(), m.awayTeamId())).forEach(p -> squad.put(p.playerId(), p));

        Player scorer = squad.get(playerId);
        if (scorer == null) throw new InvalidInputException("Player " + playerId + " does not play in match " + matchId);

        if (assistPlayerId != null) {
            Player assister = squad.get(assistPlayerId);
            if (assister == null || !assister.teamId().equals(scorer.teamId()) || assistPlayerId.equals(playerId)) {
                throw new InvalidInputException("Player " + assistPlayerId + " cannot assist this goal");
            }
        }

        MatchScorer goal = store.saveScorer(new MatchScorer(UUID.randomUUID().toString(), matchId,
                playerId, scorer.teamId(), minute));
        if (assistPlayerId != null) {
            store.saveAssist(new MatchAssist(UUID.randomUUID().toString(), matchId, goal.scorerId(),
                    assistPlayerId, scorer.teamId()));
        }

        log.debug("Goal in {} by {} (assist {})", matchId, playerId, assistPlayerId);
        publisher.publish(TournamentEvent.ofMatch(TournamentEventType.GOAL_RECORDED, m.tournamentId(), matchId,
                goalPayload(goal, assistPlayerId)));
        return goal;
    }

    /** Full time. The score must be set; a level knockout score without penalties is accepted here and refused on advance. */
    public Match finish(String matchId) {
        Match m = editable(matchId);
        requireTransition(m, MatchStatus.FINISHED);
        if (m.homeScore() == null || m.awayScore() == null) {
            throw new InvalidInputException("Match " + matchId + " has no score");
        }
        Match finished = store.updateMatch(m.withStatus(MatchStatus.FINISHED));
        log.info("Match {} finished {}-{}", matchId, m.homeScore(), m.awayScore());
        publish(TournamentEventType.MATCH_FINISHED, finished);
        return finished;
    }

    /** Pitch and kickoff come from outside; the engine never computes them. */
    public Match schedule(String matchId, String pitch, Instant kickoffAt) {
        Match m = editable(matchId);
        return store.updateMatch(m.withSchedule(pitch, kickoffAt));
    }

    /** Stores a finished simulated result; its goal records replace any entered while the match was live. */
    Match storeResult(Match result, List<MatchScorer> scorers, List<MatchAssist> assists) {
        Match stored = store.updateMatch(result);
        store.clearGoalRecords(result.matchId());
        scorers.forEach(store::saveScorer);
        assists.forEach(store::saveAssist);
        publish(TournamentEventType.MATCH_FINISHED, stored);
        return stored;
    }

    private Match editable(String matchId) {
        Match m = getMatch(matchId);
        if (m.bye()) throw new InvalidInputException("Match " + matchId + " is a bye");
        return m;
    }

    private static void requireTransition(Match m, MatchStatus next) {
        if (!m.status().canMoveTo(next)) {
            throw new InvalidInputException("Match " + m.matchId() + " cannot go from " + m.status() + " to " + next);
        }
    }

    private void publish(TournamentEventType type, Match m) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", m.status());
        payload.put("homeTeamId", m.homeTeamId());
        payload.put("awayTeamId", m.awayTeamId());
        payload.put("homeScore", m.homeScore());
        payload.put("awayScore", m.awayScore());
        if (m.homePenalties() != null) {
            payload.put("homePenalties", m.homePenalties());
            payload.put("awayPenalties", m.awayPenalties());
        }
        publisher.publish(TournamentEvent.ofMatch(type, m.tournamentId(), m.matchId(), payload));
    }

    private static Map<String, Object> goalPayload(MatchScorer goal, String assistPlayerId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playerId", goal.playerId());
        payload.put("teamId", goal.teamId());
        payload.put("minute", goal.minute());
        payload.put("assistPlayerId", assistPlayerId);
        return payload;
    }
}
