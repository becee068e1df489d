package com.gnovoa.tournament.out;

import com.gnovoa.tournament.events.TournamentEvent;

public interface EventPublisher {
    void publish(TournamentEvent event);
}
