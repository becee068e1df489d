package com.gnovoa.tournament.service;

import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.TournamentStatus;
import com.gnovoa.tournament.schedule.AdvanceOutcome;

import java.util.List;

/** What a generate or advance request did, as seen by the organizer. */
public record StageResult(
        AdvanceOutcome outcome,
        String detail,
        List<Match> newMatches,
        long structureVersion,
        TournamentStatus status
) {}
