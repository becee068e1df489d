package com.gnovoa.tournament.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SelectMvpRequest(@NotBlank String playerId) {}
