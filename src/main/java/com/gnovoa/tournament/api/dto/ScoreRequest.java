package com.gnovoa.tournament.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** Penalties are optional and only valid for a level knockout score. */
public record ScoreRequest(
        @NotNull @Min(0) Integer homeScore,
        @NotNull @Min(0) Integer awayScore,
        @Min(0) Integer homePenalties,
        @Min(0) Integer awayPenalties
) {}
