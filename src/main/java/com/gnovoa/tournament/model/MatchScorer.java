package com.gnovoa.tournament.model;

/** One goal. {@code minute} is optional. */
public record MatchScorer(
        String scorerId,
        String matchId,
        String playerId,
        String teamId,
        Integer minute
) {}
