package com.gnovoa.tournament.api.dto;

import com.gnovoa.tournament.model.Position;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AddPlayerRequest(
        @NotBlank String name,
        @NotNull Position position,
        @NotNull @Min(1) @Max(99) Integer shirt
) {}
