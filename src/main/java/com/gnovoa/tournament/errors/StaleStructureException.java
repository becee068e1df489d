package com.gnovoa.tournament.errors;

/** Someone else committed a newer tournament structure between our read and our write. */
public class StaleStructureException extends TournamentEngineException {

    public StaleStructureException(String tournamentId, long expectedVersion, long actualVersion) {
        super("stale_structure", "Tournament " + tournamentId + " moved from version "
                + expectedVersion + " to " + actualVersion);
    }
}
