package com.gnovoa.tournament.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Competition format. Closed set: adding a format means adding a permitted record and handling it
 * wherever formats are dispatched.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TournamentFormat.League.class, name = "league"),
        @JsonSubTypes.Type(value = TournamentFormat.Knockout.class, name = "knockout"),
        @JsonSubTypes.Type(value = TournamentFormat.Combination.class, name = "combination")
})
public sealed interface TournamentFormat
        permits TournamentFormat.League, TournamentFormat.Knockout, TournamentFormat.Combination {

    /** Everyone plays everyone once; the table decides. */
    record League() implements TournamentFormat {}

    /** Single elimination from round 1. */
    record Knockout() implements TournamentFormat {}

    /** Round-robin group stage, then a knockout seeded from the group tables. */
    record Combination(GroupConfig groups) implements TournamentFormat {
        public Combination {
            if (groups == null) throw new IllegalArgumentException("groups config is required");
        }
    }

    default String label() {
        if (this instanceof League) return "league";
        if (this instanceof Knockout) return "knockout";
        return "combination";
    }
}
