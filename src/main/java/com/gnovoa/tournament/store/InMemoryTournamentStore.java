package com.gnovoa.tournament.store;

import com.gnovoa.tournament.errors.NotFoundException;
import com.gnovoa.tournament.errors.StaleStructureException;
import com.gnovoa.tournament.model.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Keeps everything in memory. Writes are serialized on the store, so {@link #commit} is a true
 * compare-and-swap and readers never see half a round.
 */
@Component
public final class InMemoryTournamentStore implements TournamentStore {

    private final Map<String, Tournament> tournaments = new LinkedHashMap<>();
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final Map<String, Match> matches = new LinkedHashMap<>();
    private final Map<String, MatchScorer> scorers = new LinkedHashMap<>();
    private final Map<String, MatchAssist> assists = new LinkedHashMap<>();
    private final Map<String, String> tournamentOfMatch = new ConcurrentHashMap<>();

    @Override
    public synchronized Tournament createTournament(Tournament tournament) {
        if (tournaments.containsKey(tournament.tournamentId())) {
            throw new IllegalArgumentException("Tournament already exists: " + tournament.tournamentId());
        }
        tournaments.put(tournament.tournamentId(), tournament);
        return tournament;
    }

    @Override
    public synchronized Optional<Tournament> findTournament(String tournamentId) {
        return Optional.ofNullable(tournaments.get(tournamentId));
    }

    @Override
    public synchronized List<Tournament> findTournaments() {
        return List.copyOf(tournaments.values());
    }

    @Override
    public synchronized Tournament updateStatus(String tournamentId, TournamentStatus status) {
        Tournament updated = require(tournamentId).withStatus(status);
        tournaments.put(tournamentId, updated);
        return updated;
    }

    @Override
    public synchronized Registration saveRegistration(Registration registration) {
        registrations.put(registration.registrationId(), registration);
        return registration;
    }

    @Override
    public synchronized Optional<Registration> findRegistration(String registrationId) {
        return Optional.ofNullable(registrations.get(registrationId));
    }

    @Override
    public synchronized List<Registration> registrationsOf(String tournamentId) {
        return select(registrations.values(), r -> r.tournamentId().equals(tournamentId));
    }

    @Override
    public synchronized Player savePlayer(Player player) {
        players.put(player.playerId(), player);
        return player;
    }

    @Override
    public synchronized List<Player> playersOf(Collection<String> teamIds) {
        Set<String> wanted = new HashSet<>(teamIds);
        return select(players.values(), p -> wanted.contains(p.teamId()));
    }

    @Override
    public synchronized Optional<Match> findMatch(String matchId) {
        return Optional.ofNullable(matches.get(matchId));
    }

    @Override
    public synchronized List<Match> matchesOf(String tournamentId) {
        return select(matches.values(), m -> m.tournamentId().equals(tournamentId));
    }

    @Override
    public synchronized Match updateMatch(Match match) {
        if (!matches.containsKey(match.matchId())) throw new NotFoundException("match", match.matchId());
        matches.put(match.matchId(), match);
        return match;
    }

    @Override
    public synchronized MatchScorer saveScorer(MatchScorer scorer) {
        scorers.put(scorer.scorerId(), scorer);
        return scorer;
    }

    @Override
    public synchronized MatchAssist saveAssist(MatchAssist assist) {
        assists.put(assist.assistId(), assist);
        return assist;
    }

    @Override
    public synchronized void clearGoalRecords(String matchId) {
        scorers.values().removeIf(s -> s.matchId().equals(matchId));
        assists.values().removeIf(a -> a.matchId().equals(matchId));
    }

    @Override
    public synchronized List<MatchScorer> scorersOf(String tournamentId) {
        return select(scorers.values(), s -> tournamentId.equals(tournamentOfMatch.get(s.matchId())));
    }

    @Override
    public synchronized List<MatchAssist> assistsOf(String tournamentId) {
        return select(assists.values(), a -> tournamentId.equals(tournamentOfMatch.get(a.matchId())));
    }

    @Override
    public synchronized Tournament commit(String tournamentId,
                                          long expectedVersion,
                                          TournamentStructure next,
                                          Collection<String> removedMatchIds,
                                          List<Match> newMatches) {
        Tournament current = require(tournamentId);
        long actual = current.structure().version();
        if (actual != expectedVersion) {
            throw new StaleStructureException(tournamentId, expectedVersion, actual);
        }

        Set<String> removed = new HashSet<>(removedMatchIds);
        removed.forEach(id -> {
            matches.remove(id);
            tournamentOfMatch.remove(id);
        });
        scorers.values().removeIf(s -> removed.contains(s.matchId()));
        assists.values().removeIf(a -> removed.contains(a.matchId()));

        for (Match m : newMatches) {
            matches.put(m.matchId(), m);
            tournamentOfMatch.put(m.matchId(), tournamentId);
        }

        Tournament updated = current.withStructure(next);
        tournaments.put(tournamentId, updated);
        return updated;
    }

    private Tournament require(String tournamentId) {
        Tournament t = tournaments.get(tournamentId);
        if (t == null) throw new NotFoundException("tournament", tournamentId);
        return t;
    }

    private static <T> List<T> select(Collection<T> values, Predicate<T> filter) {
        return values.stream().filter(filter).toList();
    }
}
