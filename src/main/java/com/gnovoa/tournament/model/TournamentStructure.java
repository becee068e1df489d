package com.gnovoa.tournament.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Format-specific progress of a tournament.
 *
 * <p>Immutable and versioned: every change produces a copy with {@code version + 1}. The engine only
 * returns the next structure; whoever persists it swaps it in against the version it read, so two
 * concurrent advances cannot both win.
 *
 * @param version monotonically increasing revision, 0 for a fresh tournament
 * @param fixturesGenerated whether the opening fixture set exists
 * @param teamIds the competing teams in registration order, frozen when the opening fixtures are generated
 * @param groups group name → team ids in seed order (combination format only)
 * @param knockoutRound current knockout round pointer, null while no knockout round exists
 * @param bracketSize knockout bracket size (power of two), null while no knockout round exists
 * @param selectedMvpPlayerId organizer's manual MVP choice, authoritative once set
 */
public record TournamentStructure(
        long version,
        boolean fixturesGenerated,
        List<String> teamIds,
        Map<String, List<String>> groups,
        Integer knockoutRound,
        Integer bracketSize,
        String selectedMvpPlayerId
) {

    public TournamentStructure {
        teamIds = teamIds == null ? List.of() : List.copyOf(teamIds);
        groups = groups == null ? Map.of() : copyGroups(groups);
    }

    public static TournamentStructure initial() {
        return new TournamentStructure(0, false, List.of(), Map.of(), null, null, null);
    }

    public boolean hasKnockoutStage() { return knockoutRound != null; }

    /** Opening fixture set of a league or group stage; freezes the team set. */
    public TournamentStructure withFixtures(List<String> frozenTeamIds, Map<String, List<String>> nextGroups) {
        return new TournamentStructure(version + 1, true, frozenTeamIds, nextGroups, knockoutRound, bracketSize, selectedMvpPlayerId);
    }

    /** Opening fixture set that already contains knockout round 1. */
    public TournamentStructure withKnockoutFixtures(List<String> frozenTeamIds, int size) {
        return new TournamentStructure(version + 1, true, frozenTeamIds, Map.of(), 1, size, selectedMvpPlayerId);
    }

    public TournamentStructure withKnockoutRound(int round, int size) {
        return new TournamentStructure(version + 1, true, teamIds, groups, round, size, selectedMvpPlayerId);
    }

    public TournamentStructure withSelectedMvp(String playerId) {
        return new TournamentStructure(version + 1, fixturesGenerated, teamIds, groups, knockoutRound, bracketSize, playerId);
    }

    /** Same fixtures under a new revision, after matches were replaced in place. */
    public TournamentStructure revised() {
        return new TournamentStructure(version + 1, fixturesGenerated, teamIds, groups, knockoutRound, bracketSize, selectedMvpPlayerId);
    }

    /** Drops all fixture progress, unfreezing the team set, but keeps the organizer's MVP choice. */
    public TournamentStructure cleared() {
        return new TournamentStructure(version + 1, false, List.of(), Map.of(), null, null, selectedMvpPlayerId);
    }

    private static Map<String, List<String>> copyGroups(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((name, ids) -> copy.put(name, List.copyOf(ids)));
        return Collections.unmodifiableMap(copy);
    }
}
