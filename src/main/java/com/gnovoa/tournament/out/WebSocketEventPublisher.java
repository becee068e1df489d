package com.gnovoa.tournament.out;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.tournament.events.TournamentEvent;
import com.gnovoa.tournament.ws.WsRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fans tournament events out to WebSocket subscribers of the tournament and, for match events, of
 * the match. A subscriber that cannot be written to is skipped; the others still get the message.
 */
@Component
public final class WebSocketEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventPublisher.class);

    private final WsRouter router;
    private final ObjectMapper mapper;

    public WebSocketEventPublisher(WsRouter router, ObjectMapper mapper) {
        this.router = router;
        this.mapper = mapper;
    }

    @Override
    public void publish(TournamentEvent event) {
        String json;
        try {
            json = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.type() + " event", e);
        }
        TextMessage msg = new TextMessage(json);
        log.debug("Publishing {} for tournament {}", event.type(), event.tournamentId());

        List<WebSocketSession> targets = new ArrayList<>(router.forKey(WsRouter.tournamentKey(event.tournamentId())));
        if (event.matchId() != null) targets.addAll(router.forKey(WsRouter.matchKey(event.matchId())));

        for (WebSocketSession s : targets) {
            if (!s.isOpen()) continue;
            try {
                synchronized (s) {
                    s.sendMessage(msg);
                }
            } catch (IOException e) {
                log.warn("Dropping {} event for session {}: {}", event.type(), s.getId(), e.getMessage());
            }
        }
    }
}
