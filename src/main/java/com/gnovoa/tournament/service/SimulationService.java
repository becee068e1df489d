package com.gnovoa.tournament.service;

import com.gnovoa.tournament.model.*;
import com.gnovoa.tournament.sim.RoundSimulator;
import com.gnovoa.tournament.store.TournamentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * "Simulate round": plays out the next round of the current stage with made-up results, then asks
 * for the competition to advance like any organizer would.
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final TournamentStore store;
    private final TournamentService tournaments;
    private final MatchResultService results;
    private final RoundSimulator simulator;

    public SimulationService(TournamentStore store, TournamentService tournaments,
                             MatchResultService results, RoundSimulator simulator) {
        this.store = store;
        this.tournaments = tournaments;
        this.results = results;
        this.simulator = simulator;
    }

    public SimulationResult simulateRound(String tournamentId) {
        Tournament t = tournaments.getTournament(tournamentId);
        List<Match> pending = nextRound(t, store.matchesOf(tournamentId));

        List<String> simulated = new ArrayList<>(pending.size());
        for (Match m : pending) {
            List<Player> home = store.playersOf(List.of(m.homeTeamId()));
            List<Player> away = store.playersOf(List.of(m.awayTeamId()));
            RoundSimulator.SimulatedMatch sim = simulator.simulate(m, home, away);
            results.storeResult(sim.match(), sim.scorers(), sim.assists());
            simulated.add(m.matchId());
        }

        log.info("Simulated {} match(es) for tournament {}", simulated.size(), tournamentId);
        return new SimulationResult(simulated, tournaments.advance(tournamentId));
    }

    // unfinished, non-bye matches of the lowest open round in the current stage
    private static List<Match> nextRound(Tournament t, List<Match> matches) {
        MatchStage stage;
        if (t.structure().hasKnockoutStage()) stage = MatchStage.KNOCKOUT;
        else if (t.format() instanceof TournamentFormat.League) stage = MatchStage.LEAGUE;
        else stage = MatchStage.GROUP;

        List<Match> open = matches.stream()
                .filter(m -> m.stage() == stage && !m.bye() && !m.isFinished())
                .toList();
        int round = open.stream().mapToInt(Match::round).min().orElse(-1);
        return open.stream()
                .filter(m -> m.round() == round)
                .sorted(Comparator.comparing(Match::matchId))
                .toList();
    }
}
