package com.gnovoa.tournament.api.dto;

import com.gnovoa.tournament.model.TournamentStatus;
import jakarta.validation.constraints.NotNull;

public record StatusRequest(@NotNull TournamentStatus status) {}
