package com.sketchsync.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sketchsync.config.SketchProperties;
import com.sketchsync.dto.ControlMessageDTO;
import com.sketchsync.service.ChangeOrigin;
import com.sketchsync.service.DocumentChangedEvent;
import com.sketchsync.service.ReplicaStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps this replica connected to the sync relay and moves full document snapshots in both directions.
 * <p>
 * State machine: {@code DISCONNECTED -> CONNECTING -> CONNECTED}; a clean close (1000) returns to
 * {@code DISCONNECTED}, any other close, transport error or failed handshake moves to
 * {@code RECONNECTING} and schedules one new attempt according to the {@link ReconnectPolicy}.
 * <p>
 * On open the whole document is sent once; after that local changes are sent again in full from the
 * task scheduler, never on the thread that made the change. Changes arriving while a broadcast is
 * still queued are folded into it. Inbound binary frames are merged through
 * {@link ReplicaStore#mergeIncoming}. The transport never calls into the store while holding its own lock.
 */
@Slf4j
@Component
public class SyncTransport {
    private static final Set<ChangeOrigin> BROADCAST_ORIGINS =
            EnumSet.of(ChangeOrigin.LOCAL, ChangeOrigin.RESET, ChangeOrigin.LOADED);

    private final WebSocketClient webSocketClient;
    private final TaskScheduler taskScheduler;
    private final ReplicaStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SketchProperties.Sync properties;
    private final ReconnectPolicy reconnectPolicy;
    private final AtomicBoolean broadcastQueued = new AtomicBoolean();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private ConnectionHandler activeHandler;
    private WebSocketSession session;
    private ScheduledFuture<?> reconnectTask;
    private int reconnectAttempts;

    @Autowired
    public SyncTransport(WebSocketClient webSocketClient,
                         TaskScheduler taskScheduler,
                         ReplicaStore store,
                         ObjectMapper objectMapper,
                         Clock clock,
                         SketchProperties properties) {
        this.webSocketClient = webSocketClient;
        this.taskScheduler = taskScheduler;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties.getSync();
        this.reconnectPolicy = ReconnectPolicy.from(this.properties.getReconnect());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoConnect()) {
            connect();
        }
    }

    // A pending reconnect timer is replaced by an immediate attempt
    public synchronized void connect() {
        if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED) {
            log.debug("Already {}, ignoring connect", state);
            return;
        }
        cancelReconnect();
        openConnection();
    }

    @PreDestroy
    public void close() {
        WebSocketSession closing;
        synchronized (this) {
            cancelReconnect();
            state = ConnectionState.DISCONNECTED;
            activeHandler = null;
            closing = session;
            session = null;
        }

        if (closing != null) {
            log.info("Closing connection to sync server");
            closeQuietly(closing, CloseStatus.NORMAL);
        }
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    @EventListener
    public void onDocumentChanged(DocumentChangedEvent event) {
        if (!BROADCAST_ORIGINS.contains(event.getOrigin()) || !isConnected()) {
            return;
        }
        if (!broadcastQueued.compareAndSet(false, true)) {
            return;
        }
        try {
            taskScheduler.schedule(this::broadcast, clock.instant());
        } catch (TaskRejectedException e) {
            broadcastQueued.set(false);
            log.warn("Could not queue document broadcast: {}", e.getMessage());
        }
    }

    private void broadcast() {
        broadcastQueued.set(false);
        if (!isConnected()) {
            log.debug("Connection gone before queued broadcast ran");
            return;
        }
        send(store.save(), "document change");
    }

    // #### Connection lifecycle

    private void openConnection() {
        state = ConnectionState.CONNECTING;
        ConnectionHandler handler = new ConnectionHandler();
        activeHandler = handler;
        log.info("Connecting to sync server {}", properties.getUrl());

        try {
            webSocketClient.execute(handler, new WebSocketHttpHeaders(), properties.getUrl())
                    .whenComplete((openedSession, failure) -> {
                        if (failure != null) {
                            onConnectFailed(handler, failure);
                        }
                    });
        } catch (RuntimeException e) {
            onConnectFailed(handler, e);
        }
    }

    private void onOpen(ConnectionHandler handler, WebSocketSession rawSession) {
        synchronized (this) {
            if (handler != activeHandler) {
                log.debug("Closing stale session {}", rawSession.getId());
                closeQuietly(rawSession, CloseStatus.NORMAL);
                return;
            }
            rawSession.setBinaryMessageSizeLimit(properties.getMaxMessageSize());
            rawSession.setTextMessageSizeLimit(properties.getMaxMessageSize());
            session = new ConcurrentWebSocketSessionDecorator(rawSession,
                    (int) properties.getSendTimeLimit().toMillis(), properties.getSendBufferSizeLimit());
            state = ConnectionState.CONNECTED;
            reconnectAttempts = 0;
        }

        log.info("Connected to sync server {}", properties.getUrl());
        send(store.save(), "initial document");
    }

    private synchronized void onClosed(ConnectionHandler handler, CloseStatus status) {
        if (handler != activeHandler) {
            return;
        }
        activeHandler = null;
        session = null;

        if (status.getCode() == CloseStatus.NORMAL.getCode()) {
            log.info("Disconnected from sync server: {}", status);
            state = ConnectionState.DISCONNECTED;
            return;
        }
        scheduleReconnect("closed with " + status);
    }

    private synchronized void onConnectFailed(ConnectionHandler handler, Throwable failure) {
        if (handler != activeHandler) {
            return;
        }
        activeHandler = null;
        scheduleReconnect("connect failed: " + failure.getMessage());
    }

    private void scheduleReconnect(String reason) {
        reconnectAttempts++;
        Optional<Duration> delay = reconnectPolicy.delayForAttempt(reconnectAttempts);
        if (delay.isEmpty()) {
            state = ConnectionState.DISCONNECTED;
            log.error("Connection lost ({}), giving up after {} reconnect attempts", reason, reconnectAttempts - 1);
            return;
        }

        state = ConnectionState.RECONNECTING;
        log.warn("Connection lost ({}), attempting to reconnect in {} ms", reason, delay.get().toMillis());
        reconnectTask = taskScheduler.schedule(this::reconnect, clock.instant().plus(delay.get()));
    }

    private synchronized void reconnect() {
        reconnectTask = null;
        if (state != ConnectionState.RECONNECTING) {
            return;
        }
        log.info("Attempting to reconnect (attempt {})", reconnectAttempts);
        openConnection();
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    // #### Messages

    private void send(byte[] snapshot, String what) {
        WebSocketSession target;
        synchronized (this) {
            target = session;
        }
        if (target == null || !target.isOpen()) {
            log.debug("Not connected, skipping send of {}", what);
            return;
        }

        try {
            target.sendMessage(new BinaryMessage(snapshot));
            log.debug("Sent {} ({} bytes)", what, snapshot.length);
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Error sending {} to server: {}", what, e.getMessage());
        }
    }

    private void onSnapshot(byte[] snapshot) {
        log.debug("Received snapshot from server ({} bytes)", snapshot.length);
        store.mergeIncoming(snapshot);
    }

    private void onControlMessage(String text) {
        ControlMessageDTO message;
        try {
            message = objectMapper.readValue(text, ControlMessageDTO.class);
        } catch (JsonProcessingException e) {
            log.debug("Text message is not a control message, ignoring: {}", text);
            return;
        }
        if (message == null || message.getType() == null) {
            log.debug("Control message without type, ignoring: {}", text);
            return;
        }

        switch (message.getType()) {
            case ControlMessageDTO.TYPE_ERROR -> log.error("Server error: {}", message.getMessage());
            case ControlMessageDTO.TYPE_INFO -> log.info("Server info: {}", message.getMessage());
            default -> log.debug("Ignoring control message of type {}", message.getType());
        }
    }

    private static void closeQuietly(WebSocketSession target, CloseStatus status) {
        try {
            target.close(status);
        } catch (IOException e) {
            log.debug("Error closing session {}: {}", target.getId(), e.getMessage());
        }
    }

    // Callbacks of one connection attempt, fragmented frames are buffered until their last part
    private class ConnectionHandler extends AbstractWebSocketHandler {
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();
        private final StringBuilder textBuffer = new StringBuilder();
        private boolean discardingBinary;

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            onOpen(this, session);
        }

        @Override
        protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
            ByteBuffer payload = message.getPayload();
            byte[] chunk = new byte[payload.remaining()];
            payload.get(chunk);

            if (!discardingBinary && binaryBuffer.size() + chunk.length > properties.getMaxMessageSize()) {
                log.warn("Inbound snapshot exceeds {} bytes, discarding it", properties.getMaxMessageSize());
                binaryBuffer.reset();
                discardingBinary = true;
            }
            if (!discardingBinary) {
                binaryBuffer.write(chunk, 0, chunk.length);
            }
            if (!message.isLast()) {
                return;
            }

            byte[] snapshot = binaryBuffer.toByteArray();
            binaryBuffer.reset();
            if (discardingBinary) {
                discardingBinary = false;
                return;
            }
            onSnapshot(snapshot);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            textBuffer.append(message.getPayload());
            if (!message.isLast()) {
                return;
            }
            String text = textBuffer.toString();
            textBuffer.setLength(0);
            onControlMessage(text);
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.warn("WebSocket error: {}", exception.getMessage());
            if (session.isOpen()) {
                closeQuietly(session, CloseStatus.SERVER_ERROR);
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            onClosed(this, status);
        }

        @Override
        public boolean supportsPartialMessages() {
            return true;
        }
    }
}
