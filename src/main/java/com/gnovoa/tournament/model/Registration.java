package com.gnovoa.tournament.model;

import java.time.Instant;

/** Links a team to a tournament. Only {@link RegistrationStatus#PAID} entries take part in fixtures. */
public record Registration(
        String registrationId,
        String tournamentId,
        Team team,
        RegistrationStatus status,
        Instant createdAt
) {
    public boolean isPaid() { return status == RegistrationStatus.PAID; }

    public Registration withStatus(RegistrationStatus next) {
        return new Registration(registrationId, tournamentId, team, next, createdAt);
    }
}
