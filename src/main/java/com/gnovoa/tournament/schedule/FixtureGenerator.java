package com.gnovoa.tournament.schedule;

import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Entry point of the format engine: builds the opening fixture set for a tournament's format and
 * decides when the next stage may be created.
 *
 * <p>Pure: takes the tournament, its teams and its matches as read by the caller and returns what
 * should be written next, together with the next {@link TournamentStructure}. The caller commits both
 * atomically against the structure version it read.
 */
public final class FixtureGenerator {

    private static final Logger log = LoggerFactory.getLogger(FixtureGenerator.class);

    private final RoundRobinScheduler scheduler;
    private final KnockoutBracketBuilder bracket;
    private final GroupStageComposer groups;
    private final FixtureValidator validator;

    public FixtureGenerator(RoundRobinScheduler scheduler, KnockoutBracketBuilder bracket,
                            GroupStageComposer groups, FixtureValidator validator) {
        this.scheduler = scheduler;
        this.bracket = bracket;
        this.groups = groups;
        this.validator = validator;
    }

    /** Paid registrations in registration order: the team set that {@link #generate} freezes. */
    public static List<Team> eligibleTeams(List<Registration> registrations) {
        return registrations.stream()
                .filter(Registration::isPaid)
                .map(Registration::team)
                .toList();
    }

    /**
     * Generates the opening fixture set.
     *
     * <ul>
     *   <li>League: a single round-robin over every paid team.</li>
     *   <li>Knockout: a seeded bracket in registration order, byes included.</li>
     *   <li>Combination: groups and their round-robins; the knockout follows via {@link #advance}.</li>
     * </ul>
     *
     * @return {@link AdvanceOutcome#ALREADY_GENERATED} with no matches when fixtures already exist
     * @throws InvalidInputException if the paid team count does not fit the tournament or its format
     */
    public AdvanceResult generate(Tournament tournament, List<Registration> registrations) {
        TournamentStructure structure = tournament.structure();
        if (structure.fixturesGenerated()) {
            return AdvanceResult.unchanged(AdvanceOutcome.ALREADY_GENERATED, structure, "Fixtures already exist");
        }

        List<Team> teams = eligibleTeams(registrations);
        checkTeamCount(tournament, teams.size());
        List<String> frozen = teams.stream().map(Team::teamId).toList();

        String id = tournament.tournamentId();
        TournamentFormat format = tournament.format();

        if (format instanceof TournamentFormat.League) {
            List<Match> matches = leagueFixtures(id, teams);
            requireComplete(teams, matches, "league");
            log.debug("League fixtures for {}: {} teams, {} matches", id, teams.size(), matches.size());
            return new AdvanceResult(AdvanceOutcome.ADVANCED, matches, structure.withFixtures(frozen, Map.of()),
                    "League with " + teams.size() + " teams");
        }

        if (format instanceof TournamentFormat.Knockout) {
            List<Match> round = bracket.seedBracket(id, teams);
            int size = KnockoutBracketBuilder.bracketSize(teams.size());
            log.debug("Knockout bracket for {}: {} teams, bracket of {}", id, teams.size(), size);
            return new AdvanceResult(AdvanceOutcome.ADVANCED, round, structure.withKnockoutFixtures(frozen, size),
                    KnockoutBracketBuilder.roundName(size));
        }

        if (format instanceof TournamentFormat.Combination) {
            GroupConfig config = ((TournamentFormat.Combination) format).groups();
            Map<String, List<Team>> composed = groups.composeGroups(teams, config);

            List<Match> matches = new ArrayList<>();
            Map<String, List<String>> assignment = new LinkedHashMap<>();
            composed.forEach((name, members) -> {
                List<Match> groupMatches = groups.groupFixtures(id, name, members);
                requireComplete(members, groupMatches, name);
                matches.addAll(groupMatches);
                assignment.put(name, members.stream().map(Team::teamId).toList());
            });

            log.debug("Group stage for {}: {} groups, {} matches", id, composed.size(), matches.size());
            return new AdvanceResult(AdvanceOutcome.ADVANCED, matches, structure.withFixtures(frozen, assignment),
                    composed.size() + " group(s)");
        }

        throw new IllegalStateException("Unhandled format: " + format);
    }

    /**
     * Moves the competition on as far as the results allow.
     *
     * <p>League: {@link AdvanceOutcome#COMPLETE} once every match is finished. Knockout: the next
     * round from the current one. Combination: seeds the knockout once every group match is finished,
     * then behaves like a knockout.
     *
     * @param teams the team set frozen at generation, used to rebuild group tables
     * @throws com.gnovoa.tournament.errors.UnresolvedDrawException if a finished knockout match has no winner
     */
    public AdvanceResult advance(Tournament tournament, List<Team> teams, List<Match> matches) {
        TournamentStructure structure = tournament.structure();
        if (!structure.fixturesGenerated()) {
            return AdvanceResult.unchanged(AdvanceOutcome.NOT_READY, structure, "Fixtures have not been generated");
        }

        TournamentFormat format = tournament.format();

        if (format instanceof TournamentFormat.League) {
            long pending = matches.stream().filter(m -> m.stage() == MatchStage.LEAGUE && !m.isFinished()).count();
            return pending == 0
                    ? AdvanceResult.unchanged(AdvanceOutcome.COMPLETE, structure, "All league matches finished")
                    : AdvanceResult.unchanged(AdvanceOutcome.NOT_READY, structure, pending + " league match(es) still to finish");
        }

        if (format instanceof TournamentFormat.Combination && !structure.hasKnockoutStage()) {
            return seedKnockout(tournament, (TournamentFormat.Combination) format, teams, matches);
        }

        if (!structure.hasKnockoutStage()) {
            throw new IllegalStateException("Tournament " + tournament.tournamentId() + " has fixtures but no knockout round");
        }

        List<Match> knockout = matches.stream().filter(m -> m.stage() == MatchStage.KNOCKOUT).toList();
        KnockoutBracketBuilder.NextRound step =
                bracket.generateNextRound(tournament.tournamentId(), knockout, structure.knockoutRound());

        if (step.outcome() != AdvanceOutcome.ADVANCED) {
            return AdvanceResult.unchanged(step.outcome(), structure, step.detail());
        }

        log.debug("Knockout round {} for {}: {} match(es)", step.round(), tournament.tournamentId(), step.matches().size());
        return new AdvanceResult(AdvanceOutcome.ADVANCED, step.matches(),
                structure.withKnockoutRound(step.round(), structure.bracketSize()), step.detail());
    }

    private AdvanceResult seedKnockout(Tournament tournament, TournamentFormat.Combination format,
                                       List<Team> teams, List<Match> matches) {
        TournamentStructure structure = tournament.structure();
        if (matches.stream().anyMatch(m -> m.stage() == MatchStage.KNOCKOUT)) {
            return AdvanceResult.unchanged(AdvanceOutcome.ALREADY_GENERATED, structure, "Knockout stage already exists");
        }
        if (!groups.isGroupStageFinished(matches)) {
            long pending = matches.stream().filter(m -> m.stage() == MatchStage.GROUP && !m.isFinished()).count();
            return AdvanceResult.unchanged(AdvanceOutcome.NOT_READY, structure, pending + " group match(es) still to finish");
        }

        List<Team> seeds = groups.qualifiers(groupsOf(tournament, teams), matches, format.groups().qualifiersPerGroup());
        List<Match> round = bracket.seedBracket(tournament.tournamentId(), seeds);
        int size = KnockoutBracketBuilder.bracketSize(seeds.size());

        log.debug("Knockout seeded for {} from {} qualifiers", tournament.tournamentId(), seeds.size());
        return new AdvanceResult(AdvanceOutcome.ADVANCED, round, structure.withKnockoutRound(1, size),
                KnockoutBracketBuilder.roundName(size));
    }

    /**
     * Fresh fixtures for one group, built from the recorded group assignment. The caller replaces
     * that group's matches with them; other groups are not touched.
     *
     * @throws InvalidInputException if the tournament has no such group, the knockout stage already
     *         exists, or one of the group's matches has started
     */
    public List<Match> regenerateGroup(Tournament tournament, List<Team> teams, List<Match> matches, String groupName) {
        TournamentStructure structure = tournament.structure();
        if (!structure.groups().containsKey(groupName)) {
            throw new InvalidInputException("Tournament " + tournament.tournamentId() + " has no group '" + groupName + "'");
        }
        if (structure.hasKnockoutStage()) {
            throw new InvalidInputException("Knockout stage already exists; groups can no longer be regenerated");
        }
        boolean started = matches.stream()
                .filter(m -> groupName.equals(m.groupName()))
                .anyMatch(m -> m.status() != MatchStatus.SCHEDULED);
        if (started) {
            throw new InvalidInputException(groupName + " has matches under way or finished");
        }

        List<Team> members = groupsOf(tournament, teams).get(groupName);
        List<Match> regenerated = groups.groupFixtures(tournament.tournamentId(), groupName, members);
        requireComplete(members, regenerated, groupName);
        return regenerated;
    }

    /** The recorded group assignment resolved to teams, in group order. */
    public Map<String, List<Team>> groupsOf(Tournament tournament, List<Team> teams) {
        Map<String, Team> byId = new HashMap<>();
        teams.forEach(t -> byId.put(t.teamId(), t));

        Map<String, List<Team>> resolved = new LinkedHashMap<>();
        tournament.structure().groups().forEach((name, ids) -> {
            List<Team> members = new ArrayList<>(ids.size());
            for (String teamId : ids) {
                Team team = byId.get(teamId);
                if (team == null) throw new IllegalStateException("Group " + name + " references unknown team " + teamId);
                members.add(team);
            }
            resolved.put(name, members);
        });
        return resolved;
    }

    private List<Match> leagueFixtures(String tournamentId, List<Team> teams) {
        List<Match> matches = new ArrayList<>();
        for (RoundRobinScheduler.Fixture fixture : scheduler.singleRoundRobin(teams)) {
            int index = 1;
            for (RoundRobinScheduler.Pairing p : fixture.matches()) {
                matches.add(Match.scheduled(MatchIds.league(tournamentId, fixture.roundIndex(), index++),
                        tournamentId, MatchStage.LEAGUE, "Round " + fixture.roundIndex(),
                        fixture.roundIndex(), null, null, p.home().teamId(), p.away().teamId()));
            }
        }
        return matches;
    }

    private void checkTeamCount(Tournament tournament, int paid) {
        if (paid < 2) {
            throw new InvalidInputException("At least 2 paid teams are needed, got " + paid);
        }
        if (paid < tournament.minTeams()) {
            throw new InvalidInputException("Tournament needs at least " + tournament.minTeams() + " paid teams, got " + paid);
        }
        if (paid > tournament.maxTeams()) {
            throw new InvalidInputException("Tournament allows at most " + tournament.maxTeams() + " teams, got " + paid);
        }
    }

    private void requireComplete(List<Team> teams, List<Match> matches, String scope) {
        FixtureValidator.RoundRobinReport report = validator.validateRoundRobin(teams, matches);
        if (!report.complete()) {
            throw new IllegalStateException("Generated " + scope + " fixtures are not a complete round-robin: " + report);
        }
    }
}
