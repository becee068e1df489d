package com.gnovoa.tournament.model;

/**
 * Group-stage settings for the combination format.
 *
 * @param groupCount fixed number of groups, or null to let the field size decide
 * @param qualifiersPerGroup how many teams per group go through to the knockout stage
 */
public record GroupConfig(Integer groupCount, int qualifiersPerGroup) {

    public GroupConfig {
        if (groupCount != null && groupCount < 1) {
            throw new IllegalArgumentException("groupCount must be positive");
        }
        if (qualifiersPerGroup < 1) {
            throw new IllegalArgumentException("qualifiersPerGroup must be positive");
        }
    }

    /** Group count chosen from the field size, {@code qualifiersPerGroup} advance from each group. */
    public static GroupConfig auto(int qualifiersPerGroup) {
        return new GroupConfig(null, qualifiersPerGroup);
    }

    /** League stage followed by a knockout: one table holding every team, top {@code qualifiers} advance. */
    public static GroupConfig singleTable(int qualifiers) {
        return new GroupConfig(1, qualifiers);
    }

    public boolean isSingleTable() { return groupCount != null && groupCount == 1; }
}
