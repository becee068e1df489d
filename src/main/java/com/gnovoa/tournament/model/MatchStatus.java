package com.gnovoa.tournament.model;

public enum MatchStatus {
    SCHEDULED,
    LIVE,
    FINISHED;

    /** scheduled → live → finished; there is no rollback. Skipping straight to finished is allowed. */
    public boolean canMoveTo(MatchStatus next) {
        return next.ordinal() > ordinal();
    }
}
