package com.gnovoa.tournament.model;

public enum TournamentStatus {
    DRAFT,
    OPEN,
    CLOSED,
    COMPLETED;

    /** Lifecycle only moves forward: draft → open → closed → completed. */
    public boolean canMoveTo(TournamentStatus next) {
        return next.ordinal() == ordinal() + 1;
    }
}
