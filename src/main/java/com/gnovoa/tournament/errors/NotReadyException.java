package com.gnovoa.tournament.errors;

/** The competition has not reached the state the operation needs yet. Retry later. */
public class NotReadyException extends TournamentEngineException {

    public NotReadyException(String message) {
        super("not_ready", message);
    }
}
