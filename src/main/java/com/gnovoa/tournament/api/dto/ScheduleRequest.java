package com.gnovoa.tournament.api.dto;

import java.time.Instant;

public record ScheduleRequest(String pitch, Instant kickoffAt) {}
