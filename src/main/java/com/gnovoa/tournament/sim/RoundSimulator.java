package com.gnovoa.tournament.sim;

import com.gnovoa.tournament.config.SimProperties;
import com.gnovoa.tournament.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fills a scheduled match with a plausible result: the score, a scorer per goal drawn from the
 * team's forwards and midfielders, the odd assist, and a shoot-out when a knockout game is level.
 *
 * <p>Only produces data. Whoever calls it writes the result through the normal score entry path.
 */
public final class RoundSimulator {

    private static final int[] LOW_GOALS = {0, 1, 2, 3};
    private static final int[] LOW_WEIGHTS = {15, 30, 35, 20};
    private static final int[] HIGH_GOALS = {2, 3, 4, 5};
    private static final int[] HIGH_WEIGHTS = {30, 40, 20, 10};
    private static final int MAX_GOALS = 6;

    /** A finished match and the goal records that go with it. */
    public record SimulatedMatch(Match match, List<MatchScorer> scorers, List<MatchAssist> assists) {}

    private final RandomSource rnd;
    private final SimProperties props;

    public RoundSimulator(RandomSource rnd, SimProperties props) {
        this.rnd = rnd;
        this.props = props;
    }

    public SimulatedMatch simulate(Match match, List<Player> homeRoster, List<Player> awayRoster) {
        if (match.bye() || match.isFinished()) {
            throw new IllegalArgumentException("Match " + match.matchId() + " has nothing left to simulate");
        }

        boolean lowScoring = rnd.nextDouble() < props.lowScoringShare();
        int home = lowScoring ? pick(LOW_GOALS, LOW_WEIGHTS) : pick(HIGH_GOALS, HIGH_WEIGHTS);
        int away = lowScoring ? pick(LOW_GOALS, LOW_WEIGHTS) : pick(HIGH_GOALS, HIGH_WEIGHTS);

        boolean homeStronger = rnd.nextDouble() < props.homeAdvantage();
        if (homeStronger && rnd.nextDouble() < props.homeBoost()) {
            home = Math.min(home + 1, MAX_GOALS);
        } else if (!homeStronger && rnd.nextDouble() < props.awayBoost()) {
            away = Math.min(away + 1, MAX_GOALS);
        }

        if (rnd.nextDouble() < props.goallessShare()) {
            home = 0;
            away = 0;
        }

        Match result = match.withScore(home, away).withStatus(MatchStatus.FINISHED);
        if (match.stage() == MatchStage.KNOCKOUT && home == away) {
            int hp = rnd.nextIntInclusive(3, 5);
            int ap = rnd.nextIntInclusive(3, 5);
            while (hp == ap) {
                if (rnd.nextDouble() < 0.5) hp++; else ap++;
            }
            result = result.withPenalties(hp, ap);
        }

        List<MatchScorer> scorers = new ArrayList<>();
        List<MatchAssist> assists = new ArrayList<>();
        goals(match, match.homeTeamId(), home, homeRoster, scorers, assists);
        goals(match, match.awayTeamId(), away, awayRoster, scorers, assists);

        return new SimulatedMatch(result, scorers, assists);
    }

    private void goals(Match match, String teamId, int count, List<Player> roster,
                       List<MatchScorer> scorers, List<MatchAssist> assists) {
        if (roster.isEmpty()) return;

        List<Player> attackers = roster.stream()
                .filter(p -> p.position() == Position.FORWARD || p.position() == Position.MIDFIELDER)
                .toList();
        if (attackers.isEmpty()) attackers = roster;

        for (int i = 0; i < count; i++) {
            Player scorer = attackers.get(rnd.nextIntInclusive(0, attackers.size() - 1));
            MatchScorer goal = new MatchScorer(UUID.randomUUID().toString(), match.matchId(),
                    scorer.playerId(), teamId, rnd.nextIntInclusive(1, 90));
            scorers.add(goal);

            if (roster.size() > 1 && rnd.nextDouble() < props.assistProbability()) {
                List<Player> others = roster.stream().filter(p -> !p.playerId().equals(scorer.playerId())).toList();
                Player assister = others.get(rnd.nextIntInclusive(0, others.size() - 1));
                assists.add(new MatchAssist(UUID.randomUUID().toString(), match.matchId(),
                        goal.scorerId(), assister.playerId(), teamId));
            }
        }
    }

    private int pick(int[] values, int[] weights) {
        int total = 0;
        for (int w : weights) total += w;
        int roll = rnd.nextIntInclusive(1, total);
        for (int i = 0; i < values.length; i++) {
            roll -= weights[i];
            if (roll <= 0) return values[i];
        }
        return values[values.length - 1];
    }
}
