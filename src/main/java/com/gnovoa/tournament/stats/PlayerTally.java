package com.gnovoa.tournament.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One player's tournament numbers. Rates are per appearance and 0 without appearances.
 *
 * @param appearances matches in which the player scored or assisted at least once
 */
public record PlayerTally(
        String playerId,
        String teamId,
        int goals,
        int assists,
        int appearances
) {
    @JsonProperty
    public int contributions() { return goals + assists; }

    @JsonProperty
    public double goalsPerGame() { return rate(goals); }

    @JsonProperty
    public double assistsPerGame() { return rate(assists); }

    @JsonProperty
    public double contributionsPerGame() { return rate(contributions()); }

    private double rate(int value) {
        return appearances == 0 ? 0.0 : (double) value / appearances;
    }
}
