package com.gnovoa.tournament.model;

public record Team(String teamId, String name, String shortName) {}
