package com.gnovoa.tournament.api.dto;

import com.gnovoa.tournament.model.RegistrationStatus;
import jakarta.validation.constraints.NotNull;

public record RegistrationStatusRequest(@NotNull RegistrationStatus status) {}
