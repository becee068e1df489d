package com.gnovoa.tournament.service;

import com.gnovoa.tournament.awards.AwardSet;
import com.gnovoa.tournament.awards.AwardsResolver;
import com.gnovoa.tournament.config.TournamentProperties;
import com.gnovoa.tournament.errors.InvalidInputException;
import com.gnovoa.tournament.errors.NotFoundException;
import com.gnovoa.tournament.errors.NotReadyException;
import com.gnovoa.tournament.errors.StaleStructureException;
import com.gnovoa.tournament.events.TournamentEvent;
import com.gnovoa.tournament.events.TournamentEventType;
import com.gnovoa.tournament.model.*;
import com.gnovoa.tournament.out.EventPublisher;
import com.gnovoa.tournament.schedule.AdvanceOutcome;
import com.gnovoa.tournament.schedule.AdvanceResult;
import com.gnovoa.tournament.schedule.FixtureGenerator;
import com.gnovoa.tournament.schedule.FixtureValidator;
import com.gnovoa.tournament.standings.StandingsCalculator;
import com.gnovoa.tournament.standings.StandingsRow;
import com.gnovoa.tournament.stats.Leaderboards;
import com.gnovoa.tournament.stats.StatsAggregator;
import com.gnovoa.tournament.store.TournamentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Organizer-facing operations on a tournament.
 *
 * <p>Every structural change follows the same path: read the tournament, let the engine compute
 * the next structure and matches, then commit both against the version that was read. A lost race
 * surfaces as {@link AdvanceOutcome#ALREADY_GENERATED}, since the winner already did the work.
 */
@Service
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);

    private final TournamentStore store;
    private final FixtureGenerator generator;
    private final FixtureValidator validator;
    private final StandingsCalculator standings;
    private final StatsAggregator stats;
    private final AwardsResolver awards;
    private final EventPublisher publisher;
    private final TournamentProperties props;

    public TournamentService(TournamentStore store,
                             FixtureGenerator generator,
                             FixtureValidator validator,
                             StandingsCalculator standings,
                             StatsAggregator stats,
                             AwardsResolver awards,
                             EventPublisher publisher,
                             TournamentProperties props) {
        this.store = store;
        this.generator = generator;
        this.validator = validator;
        this.standings = standings;
        this.stats = stats;
        this.awards = awards;
        this.publisher = publisher;
        this.props = props;
    }

    // ---- lifecycle ----

    /**
     * Builds a format from its request form, filling group settings from configuration.
     *
     * @param type "league", "knockout" or "combination"
     * @param singleTable combination only: one league table ahead of the knockout instead of groups
     */
    public TournamentFormat resolveFormat(String type, Integer groupCount, Integer qualifiers, boolean singleTable) {
        if (type == null) throw new InvalidInputException("Format is required");
        switch (type.toLowerCase(Locale.ROOT)) {
            case "league":
                return new TournamentFormat.League();
            case "knockout":
                return new TournamentFormat.Knockout();
            case "combination":
                try {
                    if (singleTable) {
                        int q = qualifiers != null ? qualifiers : props.leagueStage().qualifiers();
                        return new TournamentFormat.Combination(GroupConfig.singleTable(q));
                    }
                    int q = qualifiers != null ? qualifiers : props.groups().qualifiersPerGroup();
                    return new TournamentFormat.Combination(new GroupConfig(groupCount, q));
                } catch (IllegalArgumentException e) {
                    throw new InvalidInputException(e.getMessage());
                }
            default:
                throw new InvalidInputException("Unknown format: " + type);
        }
    }

    public Tournament createTournament(String name, TournamentFormat format, int minTeams, int maxTeams, LocalDate startDate) {
        if (minTeams < 2) throw new InvalidInputException("minTeams must be at least 2");
        if (maxTeams < minTeams) throw new InvalidInputException("maxTeams must not be below minTeams");

        Tournament t = new Tournament(UUID.randomUUID().toString(), name, format, TournamentStatus.DRAFT,
                minTeams, maxTeams, startDate, TournamentStructure.initial());
        store.createTournament(t);
        log.info("Tournament {} created: '{}' ({}, {}-{} teams)", t.tournamentId(), name, format.label(), minTeams, maxTeams);
        return t;
    }

    public Tournament getTournament(String tournamentId) {
        return store.findTournament(tournamentId).orElseThrow(() -> new NotFoundException("tournament", tournamentId));
    }

    public List<Tournament> listTournaments() {
        return store.findTournaments();
    }

    /** draft → open → closed → completed, one step at a time. */
    public Tournament changeStatus(String tournamentId, TournamentStatus next) {
        Tournament t = getTournament(tournamentId);
        if (!t.status().canMoveTo(next)) {
            throw new InvalidInputException("Cannot move tournament from " + t.status() + " to " + next);
        }
        if (next == TournamentStatus.COMPLETED) return completeTournament(tournamentId);

        Tournament updated = store.updateStatus(tournamentId, next);
        log.info("Tournament {} is now {}", tournamentId, next);
        return updated;
    }

    // ---- registrations & rosters ----

    public Registration registerTeam(String tournamentId, String teamName, String shortName) {
        Tournament t = getTournament(tournamentId);
        if (t.status() != TournamentStatus.OPEN) {
            throw new InvalidInputException("Registration is not open for tournament " + tournamentId);
        }
        List<Registration> existing = store.registrationsOf(tournamentId);
        long active = existing.stream().filter(r -> r.status() != RegistrationStatus.CANCELLED).count();
        if (active >= t.maxTeams()) {
            throw new InvalidInputException("Tournament is full (" + t.maxTeams() + " teams)");
        }
        boolean duplicate = existing.stream()
                .anyMatch(r -> r.status() != RegistrationStatus.CANCELLED && r.team().name().equalsIgnoreCase(teamName));
        if (duplicate) throw new InvalidInputException("Team '" + teamName + "' is already registered");

        Team team = new Team(UUID.randomUUID().toString(), teamName, shortName);
        Registration reg = new Registration(UUID.randomUUID().toString(), tournamentId, team,
                RegistrationStatus.PENDING, Instant.now());
        store.saveRegistration(reg);
        log.info("Team '{}' registered for tournament {}", teamName, tournamentId);
        return reg;
    }

    public List<Registration> registrations(String tournamentId) {
        getTournament(tournamentId);
        return store.registrationsOf(tournamentId);
    }

    public Registration setRegistrationStatus(String tournamentId, String registrationId, RegistrationStatus status) {
        Registration reg = store.findRegistration(registrationId)
                .filter(r -> r.tournamentId().equals(tournamentId))
                .orElseThrow(() -> new NotFoundException("registration", registrationId));
        Registration updated = store.saveRegistration(reg.withStatus(status));
        log.info("Registration {} ({}) is now {}", registrationId, reg.team().name(), status);
        return updated;
    }

    public Player addPlayer(String tournamentId, String teamId, String name, Position position, int shirt) {
        boolean registered = store.registrationsOf(tournamentId).stream()
                .anyMatch(r -> r.team().teamId().equals(teamId) && r.status() != RegistrationStatus.CANCELLED);
        if (!registered) throw new NotFoundException("team", teamId);

        boolean shirtTaken = store.playersOf(List.of(teamId)).stream().anyMatch(p -> p.shirt() == shirt);
        if (shirtTaken) throw new InvalidInputException("Shirt " + shirt + " is already taken in team " + teamId);

        return store.savePlayer(new Player(UUID.randomUUID().toString(), name, teamId, position, shirt));
    }

    public List<Player> players(String tournamentId) {
        List<String> teamIds = store.registrationsOf(tournamentId).stream().map(r -> r.team().teamId()).toList();
        return store.playersOf(teamIds);
    }

    /** Paid teams in registration order. */
    public List<Team> paidTeams(String tournamentId) {
        return FixtureGenerator.eligibleTeams(store.registrationsOf(tournamentId));
    }

    /**
     * The teams competing in the tournament. Once fixtures exist this is the set frozen at generation,
     * whatever has happened to the registrations since; before that it is the current paid teams.
     */
    public List<Team> teamsOf(Tournament t) {
        TournamentStructure structure = t.structure();
        if (!structure.fixturesGenerated()) return paidTeams(t.tournamentId());

        Map<String, Team> byId = new HashMap<>();
        store.registrationsOf(t.tournamentId()).forEach(r -> byId.put(r.team().teamId(), r.team()));
        List<Team> teams = new ArrayList<>(structure.teamIds().size());
        for (String teamId : structure.teamIds()) {
            Team team = byId.get(teamId);
            if (team == null) throw new IllegalStateException("Tournament " + t.tournamentId() + " lost team " + teamId);
            teams.add(team);
        }
        return teams;
    }

    public List<Match> matches(String tournamentId) {
        getTournament(tournamentId);
        return store.matchesOf(tournamentId);
    }

    // ---- fixtures ----

    /** Opening fixture set. A second call changes nothing and reports {@link AdvanceOutcome#ALREADY_GENERATED}. */
    public StageResult generateFixtures(String tournamentId) {
        Tournament t = getTournament(tournamentId);
        if (t.status() == TournamentStatus.COMPLETED) {
            throw new InvalidInputException("Tournament " + tournamentId + " is completed");
        }

        AdvanceResult result = generator.generate(t, store.registrationsOf(tournamentId));
        if (!result.advanced()) return toStageResult(t, result);

        Tournament committed = commit(t, result, List.of());
        if (committed == null) return lostRace(t);

        log.info("Fixtures generated for {}: {} match(es), {}", tournamentId, result.newMatches().size(), result.detail());
        publisher.publish(TournamentEvent.ofTournament(TournamentEventType.FIXTURES_GENERATED, tournamentId,
                Map.of("matches", result.newMatches().size(), "detail", result.detail())));
        return toStageResult(committed, result);
    }

    /**
     * Creates the next stage or round if the results allow it, and completes the tournament once the
     * competition is decided and registration is closed. Safe to call repeatedly.
     */
    public StageResult advance(String tournamentId) {
        Tournament t = getTournament(tournamentId);
        AdvanceResult result = generator.advance(t, teamsOf(t), store.matchesOf(tournamentId));

        switch (result.outcome()) {
            case ADVANCED: {
                Tournament committed = commit(t, result, List.of());
                if (committed == null) return lostRace(t);
                log.info("Tournament {} advanced: {} ({} match(es))", tournamentId, result.detail(), result.newMatches().size());
                publisher.publish(TournamentEvent.ofTournament(TournamentEventType.ROUND_GENERATED, tournamentId,
                        Map.of("round", result.detail(), "matches", result.newMatches().size())));
                return toStageResult(committed, result);
            }
            case COMPLETE: {
                if (t.status() != TournamentStatus.CLOSED) {
                    log.info("Tournament {} is decided but still {}; close it to complete", tournamentId, t.status());
                    return toStageResult(t, result);
                }
                Tournament completed = markCompleted(t);
                return toStageResult(completed, result);
            }
            default:
                log.warn("Advance refused for {}: {} ({})", tournamentId, result.outcome(), result.detail());
                return toStageResult(t, result);
        }
    }

    /** Replaces one group's matches with freshly generated ones. Other groups are left alone. */
    public List<Match> regenerateGroup(String tournamentId, String groupName) {
        Tournament t = getTournament(tournamentId);
        List<Match> matches = store.matchesOf(tournamentId);
        List<Match> fresh = generator.regenerateGroup(t, teamsOf(t), matches, groupName);
        List<String> removed = matches.stream()
                .filter(m -> groupName.equals(m.groupName()))
                .map(Match::matchId)
                .toList();

        TournamentStructure next = t.structure().revised();
        store.commit(tournamentId, t.structure().version(), next, removed, fresh);

        log.info("{} of tournament {} regenerated: {} match(es)", groupName, tournamentId, fresh.size());
        publisher.publish(TournamentEvent.ofTournament(TournamentEventType.GROUP_REGENERATED, tournamentId,
                Map.of("group", groupName, "matches", fresh.size())));
        return fresh;
    }

    /** Deletes every match with its goals and assists and resets the structure. The MVP pick survives. */
    public Tournament clearFixtures(String tournamentId) {
        Tournament t = getTournament(tournamentId);
        List<String> all = store.matchesOf(tournamentId).stream().map(Match::matchId).toList();
        Tournament cleared = store.commit(tournamentId, t.structure().version(), t.structure().cleared(), all, List.of());

        log.info("Fixtures cleared for {}: {} match(es) removed", tournamentId, all.size());
        publisher.publish(TournamentEvent.ofTournament(TournamentEventType.FIXTURES_CLEARED, tournamentId,
                Map.of("removed", all.size())));
        return cleared;
    }

    /** Round-robin completeness of the league or of every group. */
    public Map<String, FixtureValidator.RoundRobinReport> validateFixtures(String tournamentId) {
        Tournament t = getTournament(tournamentId);
        List<Match> matches = store.matchesOf(tournamentId);
        Map<String, FixtureValidator.RoundRobinReport> reports = new LinkedHashMap<>();

        if (t.format() instanceof TournamentFormat.League) {
            List<Match> league = matches.stream().filter(m -> m.stage() == MatchStage.LEAGUE).toList();
            reports.put("League", validator.validateRoundRobin(teamsOf(t), league));
        } else if (t.format() instanceof TournamentFormat.Combination) {
            generator.groupsOf(t, teamsOf(t)).forEach((name, members) -> reports.put(name,
                    validator.validateRoundRobin(members, matches.stream()
                            .filter(m -> m.stage() == MatchStage.GROUP && name.equals(m.groupName()))
                            .toList())));
        } else {
            throw new InvalidInputException("Knockout tournaments have no round-robin to validate");
        }
        return reports;
    }

    // ---- tables, stats, awards ----

    /** League table, or one table per group for a combination tournament. */
    public Map<String, List<StandingsRow>> standings(String tournamentId) {
        Tournament t = getTournament(tournamentId);
        List<Match> matches = store.matchesOf(tournamentId);
        List<Team> teams = teamsOf(t);

        Map<String, List<StandingsRow>> tables = new LinkedHashMap<>();
        if (t.format() instanceof TournamentFormat.League) {
            tables.put("League", standings.computeStandings(teams,
                    matches.stream().filter(m -> m.stage() == MatchStage.LEAGUE).toList()));
        } else if (t.format() instanceof TournamentFormat.Combination) {
            generator.groupsOf(t, teams).forEach((name, members) -> tables.put(name, standings.computeStandings(members,
                    matches.stream().filter(m -> m.stage() == MatchStage.GROUP && name.equals(m.groupName())).toList())));
        } else {
            throw new InvalidInputException("Knockout tournaments have no table");
        }
        return tables;
    }

    public Leaderboards leaderboards(String tournamentId) {
        getTournament(tournamentId);
        return stats.computeLeaderboards(store.matchesOf(tournamentId), store.scorersOf(tournamentId),
                store.assistsOf(tournamentId), players(tournamentId));
    }

    public AwardSet awards(String tournamentId) {
        Tournament t = getTournament(tournamentId);
        return awards.computeAwards(t, teamsOf(t), store.matchesOf(tournamentId),
                store.scorersOf(tournamentId), store.assistsOf(tournamentId), players(tournamentId));
    }

    /** Organizer's MVP. Once chosen it stays; choosing the same player again is a no-op. */
    public Tournament selectMvp(String tournamentId, String playerId) {
        Tournament t = getTournament(tournamentId);
        String current = t.structure().selectedMvpPlayerId();
        if (playerId.equals(current)) return t;
        if (current != null) {
            throw new InvalidInputException("MVP already selected for tournament " + tournamentId);
        }
        boolean known = players(tournamentId).stream().anyMatch(p -> p.playerId().equals(playerId));
        if (!known) throw new NotFoundException("player", playerId);

        Tournament updated = store.commit(tournamentId, t.structure().version(),
                t.structure().withSelectedMvp(playerId), List.of(), List.of());
        log.info("MVP for tournament {} set to player {}", tournamentId, playerId);
        publisher.publish(TournamentEvent.ofTournament(TournamentEventType.MVP_SELECTED, tournamentId,
                Map.of("playerId", playerId)));
        return updated;
    }

    /**
     * Marks the tournament completed.
     *
     * @throws InvalidInputException unless registration has been closed
     * @throws NotReadyException while the league or the Final is still undecided
     */
    public Tournament completeTournament(String tournamentId) {
        Tournament t = getTournament(tournamentId);
        if (t.status() == TournamentStatus.COMPLETED) return t;
        if (t.status() != TournamentStatus.CLOSED) {
            throw new InvalidInputException("Cannot move tournament from " + t.status() + " to " + TournamentStatus.COMPLETED);
        }

        AdvanceResult result = generator.advance(t, teamsOf(t), store.matchesOf(tournamentId));
        if (result.outcome() != AdvanceOutcome.COMPLETE) {
            throw new NotReadyException("Tournament " + tournamentId + " is not decided yet: " + result.detail());
        }
        return markCompleted(t);
    }

    // ---- internals ----

    private Tournament markCompleted(Tournament t) {
        if (t.status() == TournamentStatus.COMPLETED) return t;
        Tournament completed = store.updateStatus(t.tournamentId(), TournamentStatus.COMPLETED);
        log.info("Tournament {} completed", t.tournamentId());
        publisher.publish(TournamentEvent.ofTournament(TournamentEventType.TOURNAMENT_COMPLETED, t.tournamentId(), Map.of()));
        return completed;
    }

    // null when another request committed first
    private Tournament commit(Tournament read, AdvanceResult result, List<String> removed) {
        try {
            return store.commit(read.tournamentId(), read.structure().version(), result.structure(), removed, result.newMatches());
        } catch (StaleStructureException e) {
            log.warn("Lost structure race on {}: {}", read.tournamentId(), e.getMessage());
            return null;
        }
    }

    private StageResult lostRace(Tournament read) {
        Tournament current = getTournament(read.tournamentId());
        return new StageResult(AdvanceOutcome.ALREADY_GENERATED, "Another request generated this stage first",
                List.of(), current.structure().version(), current.status());
    }

    private static StageResult toStageResult(Tournament t, AdvanceResult result) {
        return new StageResult(result.outcome(), result.detail(), result.newMatches(),
                result.structure().version(), t.status());
    }
}
