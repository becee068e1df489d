package com.gnovoa.tournament.model;

import java.time.LocalDate;

public record Tournament(
        String tournamentId,
        String name,
        TournamentFormat format,
        TournamentStatus status,
        int minTeams,
        int maxTeams,
        LocalDate startDate,
        TournamentStructure structure
) {

    public Tournament withStatus(TournamentStatus next) {
        return new Tournament(tournamentId, name, format, next, minTeams, maxTeams, startDate, structure);
    }

    public Tournament withStructure(TournamentStructure next) {
        return new Tournament(tournamentId, name, format, status, minTeams, maxTeams, startDate, next);
    }
}
