package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.errors.UnresolvedDrawException;
import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.MatchStage;
import com.gnovoa.tournament.model.Team;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Single-elimination bracket: seeding with byes, round-by-round progression and the final outcome.
 *
 * <p>The bracket is normalized to the next power of two. Seeds are placed in standard order, so seed
 * {@code i} meets seed {@code size + 1 - i} in round 1 and the top two seeds can only meet in the Final.
 * When the field is short, the top seeds receive byes. Bye entries live in round 1 and count as
 * finished, which keeps every round's bracket positions contiguous.
 */
public final class KnockoutBracketBuilder {

    /** Result of trying to create the round after {@code currentRound}. */
    public record NextRound(AdvanceOutcome outcome, int round, List<Match> matches, String detail) {

        static NextRound of(AdvanceOutcome outcome, int round, String detail) {
            return new NextRound(outcome, round, List.of(), detail);
        }
    }

    /** Final placings. {@code thirdPlaceTeamId} is null when there was no semifinal. */
    public record BracketOutcome(String winnerTeamId, String runnerUpTeamId, String thirdPlaceTeamId) {}

    /** Smallest power of two that holds {@code teamCount} teams. */
    public static int bracketSize(int teamCount) {
        if (teamCount < 2) throw new InvalidInputException("Knockout needs at least 2 teams, got " + teamCount);
        return Integer.highestOneBit(teamCount - 1) << 1;
    }

    /** Round name from the number of bracket slots contesting it. */
    public static String roundName(int teams) {
        switch (teams) {
            case 2: return "Final";
            case 4: return "Semi-Finals";
            case 8: return "Quarter-Finals";
            default: return "Round of " + teams;
        }
    }

    /**
     * Seed numbers per bracket slot: {@code [1, 8, 4, 5, 2, 7, 3, 6]} for a bracket of 8.
     * Consecutive entries meet in round 1.
     */
    static int[] seedOrder(int size) {
        List<Integer> order = new ArrayList<>(List.of(1, 2));
        while (order.size() < size) {
            int next = order.size() * 2;
            List<Integer> expanded = new ArrayList<>(next);
            for (int seed : order) {
                expanded.add(seed);
                expanded.add(next + 1 - seed);
            }
            order = expanded;
        }
        return order.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Builds round 1 from seeds listed best first.
     *
     * @return {@code size / 2} entries ordered by bracket position, byes included
     * @throws InvalidInputException if fewer than 2 teams are given or a team appears twice
     */
    public List<Match> seedBracket(String tournamentId, List<Team> seeds) {
        int n = seeds == null ? 0 : seeds.size();
        int size = bracketSize(n);
        Set<String> seen = new HashSet<>();
        for (Team t : seeds) {
            if (!seen.add(t.teamId())) throw new InvalidInputException("Team seeded twice: " + t.teamId());
        }

        int[] order = seedOrder(size);
        String label = roundName(size);
        List<Match> round = new ArrayList<>(size / 2);

        for (int slot = 0; slot < size / 2; slot++) {
            int top = order[2 * slot];
            int bottom = order[2 * slot + 1];
            int position = slot + 1;
            String id = MatchIds.knockout(tournamentId, 1, position);

            Team home = seeds.get(top - 1);
            if (bottom > n) {
                round.add(Match.bye(id, tournamentId, label, position, home.teamId()));
            } else {
                Team away = seeds.get(bottom - 1);
                round.add(Match.scheduled(id, tournamentId, MatchStage.KNOCKOUT, label, 1, position, null,
                        home.teamId(), away.teamId()));
            }
        }
        return round;
    }

    /**
     * Creates round {@code currentRound + 1} from the winners of {@code currentRound}.
     *
     * <p>Safe to call repeatedly: an existing next round is reported as {@link AdvanceOutcome#ALREADY_GENERATED}
     * and an unfinished current round as {@link AdvanceOutcome#NOT_READY}. A finished Final yields
     * {@link AdvanceOutcome#COMPLETE}.
     *
     * @param knockoutMatches every knockout match of the tournament, any order
     * @throws UnresolvedDrawException if a finished match in the round is level without a penalty winner
     */
    public NextRound generateNextRound(String tournamentId, List<Match> knockoutMatches, int currentRound) {
        List<Match> current = roundOf(knockoutMatches, currentRound);
        if (current.isEmpty()) {
            throw new InvalidInputException("Knockout round " + currentRound + " does not exist");
        }

        int nextRound = currentRound + 1;
        if (!roundOf(knockoutMatches, nextRound).isEmpty()) {
            return NextRound.of(AdvanceOutcome.ALREADY_GENERATED, nextRound, "Round " + nextRound + " already exists");
        }

        long pending = current.stream().filter(m -> !m.isFinished()).count();
        if (pending > 0) {
            return NextRound.of(AdvanceOutcome.NOT_READY, currentRound, pending + " match(es) still to finish");
        }

        List<String> winners = current.stream().map(KnockoutBracketBuilder::winnerOf).toList();
        if (current.size() == 1) {
            return NextRound.of(AdvanceOutcome.COMPLETE, currentRound, "Final won by " + winners.get(0));
        }

        String label = roundName(current.size());
        List<Match> created = new ArrayList<>(current.size() / 2);
        for (int k = 0; k < current.size() / 2; k++) {
            int position = k + 1;
            created.add(Match.scheduled(MatchIds.knockout(tournamentId, nextRound, position), tournamentId,
                    MatchStage.KNOCKOUT, label, nextRound, position, null,
                    winners.get(2 * k), winners.get(2 * k + 1)));
        }
        return new NextRound(AdvanceOutcome.ADVANCED, nextRound, created, label);
    }

    /**
     * Placings once the Final is finished.
     *
     * <p>Third place goes to the loser of the semifinal in the last bracket position; there is no
     * third-place match.
     *
     * @return empty while the Final is missing or unfinished
     * @throws UnresolvedDrawException if the Final or that semifinal is level without a penalty winner
     */
    public Optional<BracketOutcome> resolveOutcome(List<Match> knockoutMatches) {
        Map<Integer, List<Match>> byRound = knockoutMatches.stream()
                .filter(m -> m.stage() == MatchStage.KNOCKOUT)
                .collect(Collectors.groupingBy(Match::round, TreeMap::new, Collectors.toList()));

        Optional<Map.Entry<Integer, List<Match>>> finalRound = byRound.entrySet().stream()
                .filter(e -> e.getValue().size() == 1)
                .findFirst();
        if (finalRound.isEmpty()) return Optional.empty();

        Match fin = finalRound.get().getValue().get(0);
        if (!fin.isFinished() || fin.bye()) return Optional.empty();

        String third = null;
        List<Match> semis = byRound.getOrDefault(finalRound.get().getKey() - 1, List.of());
        Optional<Match> lastSemi = semis.stream()
                .filter(m -> !m.bye() && m.isFinished())
                .max(Comparator.comparing(Match::bracketPosition));
        if (lastSemi.isPresent()) third = loserOf(lastSemi.get());

        return Optional.of(new BracketOutcome(winnerOf(fin), loserOf(fin), third));
    }

    /** Team that goes through. Level scores fall back to penalties. */
    public static String winnerOf(Match m) {
        if (m.bye()) return m.homeTeamId();
        int decided = decide(m);
        return decided > 0 ? m.homeTeamId() : m.awayTeamId();
    }

    /** Team knocked out, null for a bye. */
    public static String loserOf(Match m) {
        if (m.bye()) return null;
        int decided = decide(m);
        return decided > 0 ? m.awayTeamId() : m.homeTeamId();
    }

    // >0 home goes through, <0 away goes through
    private static int decide(Match m) {
        int home = m.homeScore() == null ? 0 : m.homeScore();
        int away = m.awayScore() == null ? 0 : m.awayScore();
        if (home != away) return Integer.compare(home, away);

        Integer hp = m.homePenalties();
        Integer ap = m.awayPenalties();
        if (hp == null || ap == null || hp.equals(ap)) {
            throw new UnresolvedDrawException(m.matchId());
        }
        return Integer.compare(hp, ap);
    }

    private static List<Match> roundOf(List<Match> matches, int round) {
        return matches.stream()
                .filter(m -> m.stage() == MatchStage.KNOCKOUT && m.round() == round)
                .sorted(Comparator.comparing(Match::bracketPosition))
                .toList();
    }
}
