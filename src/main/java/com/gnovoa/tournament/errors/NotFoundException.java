package com.gnovoa.tournament.errors;

/** Thrown when a tournament, match, registration or player id does not resolve. */
public class NotFoundException extends TournamentEngineException {

    public NotFoundException(String kind, String id) {
        super("not_found", kind + " not found: " + id);
    }
}
