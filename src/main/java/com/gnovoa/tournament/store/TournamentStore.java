package com.gnovoa.tournament.store;

import com.gnovoa.tournament.errors.StaleStructureException;
import com.gnovoa.tournament.model.*;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port. Lists come back in insertion order.
 *
 * <p>The tournament structure is only ever changed through {@link #commit}, which swaps it in
 * against the version the caller read and applies the match changes in the same step.
 */
public interface TournamentStore {

    Tournament createTournament(Tournament tournament);

    Optional<Tournament> findTournament(String tournamentId);

    List<Tournament> findTournaments();

    /** Changes the lifecycle status only; the structure is left as it is. */
    Tournament updateStatus(String tournamentId, TournamentStatus status);

    Registration saveRegistration(Registration registration);

    Optional<Registration> findRegistration(String registrationId);

    List<Registration> registrationsOf(String tournamentId);

    Player savePlayer(Player player);

    List<Player> playersOf(Collection<String> teamIds);

    Optional<Match> findMatch(String matchId);

    List<Match> matchesOf(String tournamentId);

    /** Score entry path: replaces an existing match, never adds one. */
    Match updateMatch(Match match);

    MatchScorer saveScorer(MatchScorer scorer);

    MatchAssist saveAssist(MatchAssist assist);

    /** Drops every goal and assist recorded for the match. */
    void clearGoalRecords(String matchId);

    List<MatchScorer> scorersOf(String tournamentId);

    List<MatchAssist> assistsOf(String tournamentId);

    /**
     * Atomically replaces the structure, drops {@code removedMatchIds} (with their goal and assist
     * records) and adds {@code newMatches}.
     *
     * @throws StaleStructureException if the stored structure version is not {@code expectedVersion};
     *         nothing is written in that case
     */
    Tournament commit(String tournamentId,
                      long expectedVersion,
                      TournamentStructure next,
                      Collection<String> removedMatchIds,
                      List<Match> newMatches);
}
