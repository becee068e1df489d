package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.Team;

import java.util.*;

/** Checks that a set of matches is exactly one complete round-robin over a team list. */
public final class FixtureValidator {

    /**
     * @param expectedMatches {@code n*(n-1)/2}
     * @param missingPairs "a v b" for every pair that never meets
     * @param duplicatePairs "a v b" for every pair that meets more than once
     */
    public record RoundRobinReport(
            boolean complete,
            int expectedMatches,
            int actualMatches,
            List<String> missingPairs,
            List<String> duplicatePairs,
            List<String> unknownTeams
    ) {}

    public RoundRobinReport validateRoundRobin(List<Team> teams, List<Match> matches) {
        List<String> ids = teams.stream().map(Team::teamId).toList();
        Set<String> known = new HashSet<>(ids);

        Map<String, Integer> meetings = new HashMap<>();
        Set<String> unknown = new TreeSet<>();
        for (Match m : matches) {
            if (m.bye()) continue;
            if (!known.contains(m.homeTeamId())) unknown.add(String.valueOf(m.homeTeamId()));
            if (!known.contains(m.awayTeamId())) unknown.add(String.valueOf(m.awayTeamId()));
            meetings.merge(pairKey(m.homeTeamId(), m.awayTeamId()), 1, Integer::sum);
        }

        List<String> missing = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                int count = meetings.getOrDefault(pairKey(ids.get(i), ids.get(j)), 0);
                if (count == 0) missing.add(ids.get(i) + " v " + ids.get(j));
                else if (count > 1) duplicates.add(ids.get(i) + " v " + ids.get(j));
            }
        }

        int expected = ids.size() * (ids.size() - 1) / 2;
        int actual = (int) matches.stream().filter(m -> !m.bye()).count();
        boolean complete = missing.isEmpty() && duplicates.isEmpty() && unknown.isEmpty() && expected == actual;
        return new RoundRobinReport(complete, expected, actual, missing, duplicates, List.copyOf(unknown));
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
