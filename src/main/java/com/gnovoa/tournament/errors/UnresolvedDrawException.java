package com.gnovoa.tournament.errors;

/**
 * A finished knockout match is level and has no deciding penalty shoot-out. The organizer has to
 * record penalties before the bracket can move on.
 */
public class UnresolvedDrawException extends TournamentEngineException {

    private final String matchId;

    public UnresolvedDrawException(String matchId) {
        super("unresolved_draw", "Knockout match " + matchId + " is drawn and has no penalty winner");
        this.matchId = matchId;
    }

    public String matchId() { return matchId; }
}
