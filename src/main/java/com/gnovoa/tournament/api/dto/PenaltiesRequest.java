package com.gnovoa.tournament.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record PenaltiesRequest(@NotNull @Min(0) Integer homePenalties, @NotNull @Min(0) Integer awayPenalties) {}
