package com.gnovoa.tournament.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * @param format "league", "knockout" or "combination"
 * @param groupCount combination only; omitted means chosen from the field size
 * @param qualifiersPerGroup combination only; omitted means the configured default
 * @param singleTable combination only; one league table ahead of the knockout
 */
public record CreateTournamentRequest(
        @NotBlank String name,
        @NotBlank String format,
        Integer groupCount,
        Integer qualifiersPerGroup,
        boolean singleTable,
        @NotNull @Min(2) Integer minTeams,
        @NotNull @Min(2) Integer maxTeams,
        LocalDate startDate
) {}
