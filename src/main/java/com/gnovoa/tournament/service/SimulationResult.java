package com.gnovoa.tournament.service;

import java.util.List;

/** Matches filled in by one simulation pass and what the follow-up advance did. */
public record SimulationResult(List<String> simulatedMatchIds, StageResult advance) {}
