package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.errors.NotReadyException;
import com.gnovoa.tournament.model.GroupConfig;
import com.gnovoa.tournament.model.Match;
import com.gnovoa.tournament.model.MatchStage;
import com.gnovoa.tournament.model.Team;
import com.gnovoa.tournament.standings.StandingsCalculator;
import com.gnovoa.tournament.standings.StandingsRow;

import java.util.*;

/**
 * Group stage of the combination format: splitting the field into groups, their round-robin fixtures
 * and the qualifiers that seed the knockout.
 *
 * <p>Without an explicit group count the field size decides: fewer than {@code largeFieldThreshold}
 * teams play in {@code smallFieldGroups} groups, larger fields in {@code largeFieldGroups}. Teams are
 * dealt in registration order and the first groups take the remainder, so group sizes differ by at
 * most one.
 */
public final class GroupStageComposer {

    static final String SINGLE_TABLE = "League Stage";

    private final RoundRobinScheduler scheduler;
    private final StandingsCalculator standings;
    private final int smallFieldGroups;
    private final int largeFieldGroups;
    private final int largeFieldThreshold;

    public GroupStageComposer(RoundRobinScheduler scheduler, StandingsCalculator standings,
                              int smallFieldGroups, int largeFieldGroups, int largeFieldThreshold) {
        this.scheduler = scheduler;
        this.standings = standings;
        this.smallFieldGroups = smallFieldGroups;
        this.largeFieldGroups = largeFieldGroups;
        this.largeFieldThreshold = largeFieldThreshold;
    }

    /** 2 groups below 16 teams, 4 from 16 up. */
    public GroupStageComposer(RoundRobinScheduler scheduler, StandingsCalculator standings) {
        this(scheduler, standings, 2, 4, 16);
    }

    public int groupCountFor(int teamCount, GroupConfig config) {
        if (config.groupCount() != null) return config.groupCount();
        return teamCount < largeFieldThreshold ? smallFieldGroups : largeFieldGroups;
    }

    /**
     * Splits {@code teams} into groups.
     *
     * @return group name → members in seed order, in group order
     * @throws InvalidInputException if a group would have fewer than 2 teams, fewer than
     *         {@code qualifiersPerGroup + 1} teams, or fewer than 2 qualifiers would come out
     */
    public Map<String, List<Team>> composeGroups(List<Team> teams, GroupConfig config) {
        int n = teams.size();
        int groupCount = groupCountFor(n, config);
        int smallest = n / groupCount;

        if (smallest < 2) {
            throw new InvalidInputException(n + " teams cannot fill " + groupCount + " groups of at least 2");
        }
        if (config.qualifiersPerGroup() >= smallest) {
            throw new InvalidInputException("Groups of " + smallest + " cannot send "
                    + config.qualifiersPerGroup() + " teams through");
        }
        if (groupCount * config.qualifiersPerGroup() < 2) {
            throw new InvalidInputException("Knockout stage needs at least 2 qualifiers");
        }

        int remainder = n % groupCount;
        Map<String, List<Team>> groups = new LinkedHashMap<>();
        int cursor = 0;
        for (int g = 0; g < groupCount; g++) {
            int size = smallest + (g < remainder ? 1 : 0);
            String name = groupCount == 1 ? SINGLE_TABLE : groupName(g);
            groups.put(name, List.copyOf(teams.subList(cursor, cursor + size)));
            cursor += size;
        }
        return groups;
    }

    /** Round-robin for one group, labelled "Group A - Round 1" and so on. */
    public List<Match> groupFixtures(String tournamentId, String groupName, List<Team> members) {
        List<Match> matches = new ArrayList<>();
        for (RoundRobinScheduler.Fixture fixture : scheduler.singleRoundRobin(members)) {
            int index = 1;
            for (RoundRobinScheduler.Pairing p : fixture.matches()) {
                matches.add(Match.scheduled(
                        MatchIds.group(tournamentId, groupName, fixture.roundIndex(), index++),
                        tournamentId, MatchStage.GROUP,
                        groupName + " - Round " + fixture.roundIndex(),
                        fixture.roundIndex(), null, groupName,
                        p.home().teamId(), p.away().teamId()));
            }
        }
        return matches;
    }

    /** True once the group stage exists and every group match is finished. */
    public boolean isGroupStageFinished(List<Match> matches) {
        List<Match> group = matches.stream().filter(m -> m.stage() == MatchStage.GROUP).toList();
        return !group.isEmpty() && group.stream().allMatch(Match::isFinished);
    }

    /** Final table of one group. */
    public List<StandingsRow> groupTable(String groupName, List<Team> members, List<Match> matches) {
        List<Match> ofGroup = matches.stream()
                .filter(m -> m.stage() == MatchStage.GROUP && groupName.equals(m.groupName()))
                .toList();
        return standings.computeStandings(members, ofGroup);
    }

    /**
     * Knockout seeds: every group winner in group order, then every runner-up, and so on.
     * Fed to the bracket this pairs A1 with B2 and B1 with A2.
     *
     * @throws NotReadyException while any group match is unfinished
     */
    public List<Team> qualifiers(Map<String, List<Team>> groups, List<Match> matches, int perGroup) {
        if (!isGroupStageFinished(matches)) {
            throw new NotReadyException("Group stage is not finished");
        }

        List<List<StandingsRow>> tables = new ArrayList<>();
        Map<String, Team> byId = new HashMap<>();
        groups.forEach((name, members) -> {
            tables.add(groupTable(name, members, matches));
            members.forEach(t -> byId.put(t.teamId(), t));
        });

        List<Team> seeds = new ArrayList<>();
        for (int place = 0; place < perGroup; place++) {
            for (List<StandingsRow> table : tables) {
                if (place < table.size()) seeds.add(byId.get(table.get(place).teamId()));
            }
        }
        return seeds;
    }

    static String groupName(int index) {
        return "Group " + (char) ('A' + index);
    }
}
