package com.sketchsync.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

public class CursorHeartbeatTest {
    private ReplicaStore store;
    private CursorHeartbeat heartbeat;

    @BeforeEach
    public void setUp() {
        store = mock(ReplicaStore.class);
        IdentityService identity = mock(IdentityService.class);
        when(identity.getActorId()).thenReturn("alice");
        heartbeat = new CursorHeartbeat(store, identity);
    }

    @Test
    public void testHeartbeatBeforeAnyMoveDoesNothing() {
        heartbeat.heartbeat();

        verifyNoInteractions(store);
    }

    @Test
    public void testPointerMoveUpdatesCursor() {
        heartbeat.pointerMoved(12.5, 40);

        verify(store).updateCursor("alice", 12.5, 40);
    }

    @Test
    public void testHeartbeatResendsLastPosition() {
        heartbeat.pointerMoved(1, 2);
        heartbeat.pointerMoved(3, 4);

        heartbeat.heartbeat();
        heartbeat.heartbeat();

        verify(store).updateCursor("alice", 1, 2);
        verify(store, times(3)).updateCursor("alice", 3, 4);
    }
}
