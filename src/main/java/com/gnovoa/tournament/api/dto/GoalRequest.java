package com.gnovoa.tournament.api.dto;

import jakarta.validation.constraints.NotBlank;

public record GoalRequest(@NotBlank String playerId, Integer minute, String assistPlayerId) {}
