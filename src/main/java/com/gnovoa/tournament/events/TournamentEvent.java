package com.gnovoa.tournament.events;

import java.time.Instant;
import java.util.Map;

/**
 * Live ticker message. {@code matchId} is set for match-level events only.
 */
public record TournamentEvent(
        TournamentEventType type,
        String tournamentId,
        String matchId,
        Instant at,
        Map<String, Object> payload
) {

    public static TournamentEvent ofTournament(TournamentEventType type, String tournamentId, Map<String, Object> payload) {
        return new TournamentEvent(type, tournamentId, null, Instant.now(), payload);
    }

    public static TournamentEvent ofMatch(TournamentEventType type, String tournamentId, String matchId, Map<String, Object> payload) {
        return new TournamentEvent(type, tournamentId, matchId, Instant.now(), payload);
    }
}
