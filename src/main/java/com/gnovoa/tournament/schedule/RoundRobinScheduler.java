package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.model.Team;

import java.util.*;

/**
 * Generates single round-robin fixtures for any field of two or more teams.
 *
 * <p>Uses the circle method: the first team stays fixed while the others rotate one slot per round.
 * An odd field gets a placeholder slot; whoever is paired with it sits that round out, so no bye
 * match is ever produced.
 *
 * <p>Output is fully deterministic for a given team order. Home/away swaps on every odd round, which
 * keeps the fixed team alternating and spreads home games across the field.
 */
public final class RoundRobinScheduler {

    /** A match pairing within a fixture (round). */
    public record Pairing(Team home, Team away) {}

    /** A fixture (round); each team appears at most once. */
    public record Fixture(int roundIndex, List<Pairing> matches) {}

    /**
     * Every pairing of the single round-robin, round by round, flattened.
     *
     * @param teams ordered list of at least 2 distinct teams
     * @return exactly {@code n*(n-1)/2} pairings
     */
    public List<Pairing> generate(List<Team> teams) {
        return singleRoundRobin(teams).stream()
                .flatMap(f -> f.matches().stream())
                .toList();
    }

    /**
     * Generates a single round-robin schedule using the circle method.
     *
     * @param teams ordered list of at least 2 distinct teams
     * @return {@code n-1} fixtures for an even field, {@code n} for an odd one
     *
     * @throws InvalidInputException if fewer than 2 teams are given or a team appears twice
     */
    public List<Fixture> singleRoundRobin(List<Team> teams) {
        if (teams == null || teams.size() < 2) {
            throw new InvalidInputException("Round-robin needs at least 2 teams, got " + (teams == null ? 0 : teams.size()));
        }
        requireDistinct(teams);

        List<Team> list = new ArrayList<>(teams);
        if (list.size() % 2 == 1) list.add(null); // rest slot

        int slots = list.size();
        int rounds = slots - 1;
        int perRound = slots / 2;

        Team fixed = list.remove(0);
        int n = list.size();

        List<Fixture> fixtures = new ArrayList<>(rounds);

        for (int round = 0; round < rounds; round++) {
            List<Team> left = new ArrayList<>();
            List<Team> right = new ArrayList<>();

            left.add(fixed);
            left.addAll(list.subList(0, n / 2));

            right.addAll(list.subList(n / 2, n));
            Collections.reverse(right);

            List<Pairing> pairings = new ArrayList<>(perRound);
            for (int i = 0; i < perRound; i++) {
                Team a = left.get(i);
                Team b = right.get(i);
                if (a == null || b == null) continue;
                boolean flip = (round % 2 == 1);
                pairings.add(flip ? new Pairing(b, a) : new Pairing(a, b));
            }

            fixtures.add(new Fixture(round + 1, pairings));

            Team last = list.remove(list.size() - 1);
            list.add(0, last);
        }

        return fixtures;
    }

    private void requireDistinct(List<Team> teams) {
        Set<String> seen = new HashSet<>();
        for (Team t : teams) {
            if (t == null || t.teamId() == null) throw new InvalidInputException("Team without id in fixture input");
            if (!seen.add(t.teamId())) throw new InvalidInputException("Team listed twice: " + t.teamId());
        }
    }
}
