package com.gnovoa.tournament.schedule;

/** What a call to advance the competition actually did. */
public enum AdvanceOutcome {
    /** A new round (or the seeded knockout) was created. */
    ADVANCED,
    /** The current stage still has unfinished matches. Nothing was created. */
    NOT_READY,
    /** The next round already exists. Nothing was created. */
    ALREADY_GENERATED,
    /** The competition has no further round: the league or the Final is done. */
    COMPLETE
}
