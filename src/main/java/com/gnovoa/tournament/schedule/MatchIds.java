package com.gnovoa.tournament.schedule;

/**
 * Deterministic match ids, derived from where a match sits in the competition. Generating the same
 * stage twice therefore yields the same ids, which is what makes regeneration safe to compare.
 */
final class MatchIds {

    private MatchIds() {}

    static String league(String tournamentId, int round, int index) {
        return tournamentId + "-lg-r" + round + "-" + index;
    }

    static String group(String tournamentId, String groupName, int round, int index) {
        String key = groupName.toLowerCase().replaceAll("[^a-z0-9]+", "");
        return tournamentId + "-" + key + "-r" + round + "-" + index;
    }

    static String knockout(String tournamentId, int round, int position) {
        return tournamentId + "-ko-r" + round + "-" + position;
    }
}
