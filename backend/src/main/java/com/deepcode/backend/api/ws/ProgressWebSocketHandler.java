package com.deepcode.backend.api.ws;

import com.deepcode.backend.service.progress.ObserverHandle;
import com.deepcode.backend.service.progress.ProgressBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Progress channel. Clients only listen; anything they send is ignored.
 */
@Component
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ProgressWebSocketHandler.class);
    private static final String HANDLE_ATTR = "progress.observer";

    private final ProgressBroadcaster broadcaster;

    public ProgressWebSocketHandler(ProgressBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ObserverHandle handle = broadcaster.register(session);
        session.getAttributes().put(HANDLE_ATTR, handle);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // keep-alive pings and the like
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on progress session {}: {}", session.getId(), exception.toString());
        broadcaster.unregister(handleOf(session));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.unregister(handleOf(session));
    }

    private static ObserverHandle handleOf(WebSocketSession session) {
        Object h = session.getAttributes().get(HANDLE_ATTR);
        return h instanceof ObserverHandle oh ? oh : new ObserverHandle(session.getId());
    }
}
