package com.gnovoa.tournament.standings;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One line of a league or group table. {@code position} is 1-based. */
public record StandingsRow(
        int position,
        String teamId,
        String teamName,
        int played,
        int won,
        int drawn,
        int lost,
        int goalsFor,
        int goalsAgainst,
        int points
) {
    @JsonProperty
    public int goalDifference() { return goalsFor - goalsAgainst; }
}
