package com.gnovoa.tournament.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Per-player and per-team counters over finished matches.
 *
 * @param players every player with at least one goal or assist, best contributors first
 * @param cleanSheetsByTeam finished matches in which the team conceded nothing, teams without any omitted
 * @param cleanSheetsByGoalkeeper clean sheets credited to each team's first-choice goalkeeper
 */
public record Leaderboards(
        List<PlayerTally> players,
        Map<String, Integer> cleanSheetsByTeam,
        Map<String, Integer> cleanSheetsByGoalkeeper
) {

    public static Leaderboards empty() {
        return new Leaderboards(List.of(), Map.of(), Map.of());
    }

    @JsonProperty
    public List<PlayerTally> topScorers() {
        return players.stream()
                .filter(p -> p.goals() > 0)
                .sorted(Comparator.comparingInt(PlayerTally::goals).reversed()
                        .thenComparingInt(PlayerTally::appearances)
                        .thenComparing(PlayerTally::playerId))
                .toList();
    }

    @JsonProperty
    public List<PlayerTally> topAssisters() {
        return players.stream()
                .filter(p -> p.assists() > 0)
                .sorted(Comparator.comparingInt(PlayerTally::assists).reversed()
                        .thenComparingInt(PlayerTally::appearances)
                        .thenComparing(PlayerTally::playerId))
                .toList();
    }

    public int goalsOf(String playerId) {
        return players.stream().filter(p -> p.playerId().equals(playerId)).mapToInt(PlayerTally::goals).sum();
    }
}
