package com.gnovoa.tournament.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterTeamRequest(@NotBlank @Size(max = 80) String teamName, @Size(max = 5) String shortName) {}
