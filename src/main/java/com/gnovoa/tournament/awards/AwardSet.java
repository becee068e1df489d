package com.gnovoa.tournament.awards;

/**
 * End-of-tournament honours. Every field is null until there is data to decide it.
 */
public record AwardSet(
        TeamAward winner,
        TeamAward runnerUp,
        TeamAward thirdPlace,
        PlayerAward topScorer,
        PlayerAward topAssister,
        CleanSheetAward cleanSheetLeader,
        MvpAward mvp
) {

    public record TeamAward(String teamId, String teamName) {}

    /** {@code value} is the goals or assists the award was won with. */
    public record PlayerAward(String playerId, String playerName, String teamId, int value, int appearances) {}

    /** {@code goalkeeperPlayerId} is null when the team's roster has no goalkeeper. */
    public record CleanSheetAward(String teamId, String teamName, String goalkeeperPlayerId, String goalkeeperName, int cleanSheets) {}

    /** {@code manual} marks an organizer's choice, which overrides the computed MVP. */
    public record MvpAward(String playerId, String playerName, String teamId, int goals, int assists, boolean manual) {}

    public static AwardSet empty() {
        return new AwardSet(null, null, null, null, null, null, null);
    }

    public boolean isEmpty() { return equals(empty()); }

    AwardSet withMvp(MvpAward next) {
        return new AwardSet(winner, runnerUp, thirdPlace, topScorer, topAssister, cleanSheetLeader, next);
    }
}
