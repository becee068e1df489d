package com.gnovoa.tournament.errors;

/**
 * Base class for every failure the tournament engine reports to its caller.
 *
 * <p>Nothing here is fatal: the caller renders {@link #code()} and the message, and no partial
 * fixture set or round is ever written when one of these is thrown.
 */
public abstract class TournamentEngineException extends RuntimeException {

    private final String code;

    protected TournamentEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    /** Stable machine-readable error code. */
    public String code() { return code; }
}
