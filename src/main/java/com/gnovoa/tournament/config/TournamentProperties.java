package com.gnovoa.tournament.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Format defaults applied when an organizer leaves them out. */
@ConfigurationProperties(prefix = "tournament")
public record TournamentProperties(Groups groups, LeagueStage leagueStage) {

    public TournamentProperties {
        if (groups == null) groups = new Groups(2, 4, 16, 2);
        if (leagueStage == null) leagueStage = new LeagueStage(4);
    }

    /** Group count is {@code smallFieldGroups} below {@code largeFieldThreshold} teams, else {@code largeFieldGroups}. */
    public record Groups(int smallFieldGroups, int largeFieldGroups, int largeFieldThreshold, int qualifiersPerGroup) {}

    /** Single-table league stage ahead of a knockout. */
    public record LeagueStage(int qualifiers) {}
}
