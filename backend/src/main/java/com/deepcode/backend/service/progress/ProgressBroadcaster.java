package com.deepcode.backend.service.progress;

import com.deepcode.backend.config.DeepCodeProperties;
import com.deepcode.backend.domain.ProgressEvent;
import com.deepcode.backend.engine.ProgressHook;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry of connected progress observers and fan-out of progress events to them.
 *
 * <p>Sends run on the sender pool and {@link #broadcast(ProgressEvent)} waits at most the send-time
 * limit for all of them. An observer whose send has not finished by then, or whose send fails, is
 * removed; the remaining observers still receive the event and the caller never sees the failure.
 * Sessions are wrapped in a {@link ConcurrentWebSocketSessionDecorator} so concurrent requests never
 * write to one session at the same time.
 */
@Component
public class ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private final ObjectMapper om;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final ExecutorService senders;
    private final Map<ObserverHandle, WebSocketSession> observers = new ConcurrentHashMap<>();

    @Autowired
    public ProgressBroadcaster(ObjectMapper om, DeepCodeProperties props,
                               @Qualifier("progressExecutor") ThreadPoolTaskExecutor senders) {
        this(om, (int) props.progress().sendTimeLimit().toMillis(), props.progress().bufferSizeLimit(),
                senders.getThreadPoolExecutor());
    }

    public ProgressBroadcaster(ObjectMapper om, int sendTimeLimitMs, int bufferSizeLimit, ExecutorService senders) {
        this.om = om;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
        this.senders = senders;
    }

    public ObserverHandle register(WebSocketSession session) {
        ObserverHandle handle = new ObserverHandle(session.getId());
        observers.put(handle, new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
        log.info("Progress observer {} connected ({} active)", handle.id(), observers.size());
        return handle;
    }

    public void unregister(ObserverHandle handle) {
        if (handle != null && observers.remove(handle) != null) {
            log.info("Progress observer {} disconnected ({} active)", handle.id(), observers.size());
        }
    }

    public int observerCount() {
        return observers.size();
    }

    public boolean isRegistered(ObserverHandle handle) {
        return observers.containsKey(handle);
    }

    /** A hook that forwards every engine report straight into {@link #broadcast(ProgressEvent)}. */
    public ProgressHook hook() {
        return (percent, message) -> broadcast(new ProgressEvent(percent, message));
    }

    public void broadcast(ProgressEvent event) {
        if (observers.isEmpty()) return;

        TextMessage frame;
        try {
            frame = new TextMessage(om.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize progress event: {}", e.getMessage());
            return;
        }

        List<Delivery> pending = new ArrayList<>();
        for (Map.Entry<ObserverHandle, WebSocketSession> e : observers.entrySet()) {
            ObserverHandle handle = e.getKey();
            WebSocketSession session = e.getValue();
            if (!session.isOpen()) {
                evict(handle, session, null);
                continue;
            }
            try {
                pending.add(new Delivery(handle, session, senders.submit(() -> {
                    session.sendMessage(frame);
                    return null;
                })));
            } catch (RejectedExecutionException ex) {
                evict(handle, session, ex);
            }
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(sendTimeLimitMs);
        for (Delivery d : pending) {
            await(d, deadline);
        }
    }

    private void await(Delivery d, long deadline) {
        try {
            d.future().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            d.future().cancel(true);
            evict(d.handle(), d.session(), e);
        } catch (ExecutionException e) {
            evict(d.handle(), d.session(), e.getCause() instanceof Exception ex ? ex : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            d.future().cancel(true);
        }
    }

    private void evict(ObserverHandle handle, WebSocketSession session, Exception cause) {
        if (!observers.remove(handle, session)) return;

        if (cause instanceof TimeoutException) {
            log.debug("Dropping progress observer {}: send exceeded {}ms", handle.id(), sendTimeLimitMs);
        } else if (cause != null) {
            log.debug("Dropping progress observer {} after failed send: {}", handle.id(), cause.toString());
        } else {
            log.debug("Dropping closed progress observer {}", handle.id());
        }
        // a stalled socket can block the close frame too, so never close on the broadcasting thread
        try {
            senders.execute(() -> close(handle, session));
        } catch (RejectedExecutionException e) {
            log.debug("Could not schedule close of progress observer {}: {}", handle.id(), e.toString());
        }
    }

    private static void close(ObserverHandle handle, WebSocketSession session) {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Closing progress observer {} failed: {}", handle.id(), e.toString());
        }
    }

    private record Delivery(ObserverHandle handle, WebSocketSession session, Future<Void> future) {}
}
