package com.gnovoa.tournament.events;

public enum TournamentEventType {
    FIXTURES_GENERATED,
    FIXTURES_CLEARED,
    GROUP_REGENERATED,
    ROUND_GENERATED,
    MATCH_STARTED,
    MATCH_UPDATED,
    GOAL_RECORDED,
    MATCH_FINISHED,
    MVP_SELECTED,
    TOURNAMENT_COMPLETED
}
