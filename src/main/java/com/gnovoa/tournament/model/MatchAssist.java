package com.gnovoa.tournament.model;

/** Assist linked to exactly one {@link MatchScorer}. */
public record MatchAssist(
        String assistId,
        String matchId,
        String scorerId,
        String playerId,
        String teamId
) {}
