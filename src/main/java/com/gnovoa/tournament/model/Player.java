package com.gnovoa.tournament.model;

public record Player(
    String playerId,
    String name,
    String teamId,
    Position position,
    int shirt) {

    public boolean isGoalkeeper() { return position == Position.GOALKEEPER; }
}
