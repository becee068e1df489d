package com.gnovoa.tournament.errors;

/** Bad team count, unknown group, misconfigured format and similar caller mistakes. */
public class InvalidInputException extends TournamentEngineException {

    public InvalidInputException(String message) {
        super("invalid_input", message);
    }
}
