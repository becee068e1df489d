package com.gnovoa.tournament.model;

public enum MatchStage {
    LEAGUE,
    GROUP,
    KNOCKOUT
}
