package com.gnovoa.tournament.api;

import com.gnovoa.tournament.api.dto.*;
import com.gnovoa.tournament.awards.AwardSet;
import com.gnovoa.tournament.model.*;
import com.gnovoa.tournament.schedule.FixtureValidator;
import com.gnovoa.tournament.service.SimulationResult;
import com.gnovoa.tournament.service.SimulationService;
import com.gnovoa.tournament.service.StageResult;
import com.gnovoa.tournament.service.TournamentService;
import com.gnovoa.tournament.standings.StandingsRow;
import com.gnovoa.tournament.stats.Leaderboards;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentService tournaments;
    private final SimulationService simulation;

    public TournamentController(TournamentService tournaments, SimulationService simulation) {
        this.tournaments = tournaments;
        this.simulation = simulation;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Tournament create(@Valid @RequestBody CreateTournamentRequest req) {
        TournamentFormat format = tournaments.resolveFormat(req.format(), req.groupCount(), req.qualifiersPerGroup(), req.singleTable());
        return tournaments.createTournament(req.name(), format, req.minTeams(), req.maxTeams(), req.startDate());
    }

    @GetMapping
    public List<Tournament> list() {
        return tournaments.listTournaments();
    }

    @GetMapping("/{id}")
    public Tournament get(@PathVariable String id) {
        return tournaments.getTournament(id);
    }

    @PostMapping("/{id}/status")
    public Tournament changeStatus(@PathVariable String id, @Valid @RequestBody StatusRequest req) {
        return tournaments.changeStatus(id, req.status());
    }

    @PostMapping("/{id}/registrations")
    @ResponseStatus(HttpStatus.CREATED)
    public Registration register(@PathVariable String id, @Valid @RequestBody RegisterTeamRequest req) {
        return tournaments.registerTeam(id, req.teamName(), req.shortName());
    }

    @GetMapping("/{id}/registrations")
    public List<Registration> registrations(@PathVariable String id) {
        return tournaments.registrations(id);
    }

    @PostMapping("/{id}/registrations/{registrationId}/status")
    public Registration registrationStatus(@PathVariable String id, @PathVariable String registrationId,
                                           @Valid @RequestBody RegistrationStatusRequest req) {
        return tournaments.setRegistrationStatus(id, registrationId, req.status());
    }

    @PostMapping("/{id}/teams/{teamId}/players")
    @ResponseStatus(HttpStatus.CREATED)
    public Player addPlayer(@PathVariable String id, @PathVariable String teamId, @Valid @RequestBody AddPlayerRequest req) {
        return tournaments.addPlayer(id, teamId, req.name(), req.position(), req.shirt());
    }

    @GetMapping("/{id}/players")
    public List<Player> players(@PathVariable String id) {
        return tournaments.players(id);
    }

    @PostMapping("/{id}/fixtures")
    public StageResult generateFixtures(@PathVariable String id) {
        return tournaments.generateFixtures(id);
    }

    @DeleteMapping("/{id}/fixtures")
    public Tournament clearFixtures(@PathVariable String id) {
        return tournaments.clearFixtures(id);
    }

    @GetMapping("/{id}/fixtures/validation")
    public Map<String, FixtureValidator.RoundRobinReport> validateFixtures(@PathVariable String id) {
        return tournaments.validateFixtures(id);
    }

    @PostMapping("/{id}/groups/{group}/regenerate")
    public List<Match> regenerateGroup(@PathVariable String id, @PathVariable String group) {
        return tournaments.regenerateGroup(id, group);
    }

    @PostMapping("/{id}/advance")
    public StageResult advance(@PathVariable String id) {
        return tournaments.advance(id);
    }

    @PostMapping("/{id}/simulate")
    public SimulationResult simulate(@PathVariable String id) {
        return simulation.simulateRound(id);
    }

    @GetMapping("/{id}/matches")
    public List<Match> matches(@PathVariable String id) {
        return tournaments.matches(id);
    }

    @GetMapping("/{id}/standings")
    public Map<String, List<StandingsRow>> standings(@PathVariable String id) {
        return tournaments.standings(id);
    }

    @GetMapping("/{id}/leaderboards")
    public Leaderboards leaderboards(@PathVariable String id) {
        return tournaments.leaderboards(id);
    }

    @GetMapping("/{id}/awards")
    public AwardSet awards(@PathVariable String id) {
        return tournaments.awards(id);
    }

    @PostMapping("/{id}/mvp")
    public Tournament selectMvp(@PathVariable String id, @Valid @RequestBody SelectMvpRequest req) {
        return tournaments.selectMvp(id, req.playerId());
    }

    @PostMapping("/{id}/complete")
    public Tournament complete(@PathVariable String id) {
        return tournaments.completeTournament(id);
    }
}
