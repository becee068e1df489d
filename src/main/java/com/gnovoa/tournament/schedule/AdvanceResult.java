package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.TournamentStructure;

import java.util.List;

/**
 * Outcome of an advance attempt.
 *
 * <p>{@code structure} is the structure to commit; it is the input structure unchanged unless
 * {@code outcome} is {@link AdvanceOutcome#ADVANCED}.
 */
public record AdvanceResult(
        AdvanceOutcome outcome,
        List<Match> newMatches,
        TournamentStructure structure,
        String detail
) {

    static AdvanceResult unchanged(AdvanceOutcome outcome, TournamentStructure structure, String detail) {
        return new AdvanceResult(outcome, List.of(), structure, detail);
    }

    public boolean advanced() { return outcome == AdvanceOutcome.ADVANCED; }
}
