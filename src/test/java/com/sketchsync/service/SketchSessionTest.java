package com.sketchsync.service;

import com.sketchsync.model.SketchDocument;
import com.sketchsync.transport.ConnectionState;
import com.sketchsync.transport.SyncTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class SketchSessionTest {
    private ReplicaStore store;
    private SyncTransport transport;
    private CursorHeartbeat heartbeat;
    private ObjectProvider<SnapshotExporter> exporterProvider;
    private SketchSession session;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        store = mock(ReplicaStore.class);
        transport = mock(SyncTransport.class);
        heartbeat = mock(CursorHeartbeat.class);
        exporterProvider = mock(ObjectProvider.class);
        when(store.getActorId()).thenReturn("alice");
        when(store.getDocument()).thenReturn(SketchDocument.empty());
        session = new SketchSession(store, transport, mock(PresenceTracker.class), heartbeat, exporterProvider);
    }

    @Test
    public void testCursorUpdateUsesOwnActor() {
        session.updateCursor(4, 5);

        verify(store).updateCursor("alice", 4, 5);
    }

    @Test
    public void testPointerMovesGoThroughHeartbeat() {
        session.pointerMoved(1, 2);

        verify(heartbeat).pointerMoved(1, 2);
    }

    @Test
    public void testConnectionStatusComesFromTransport() {
        when(transport.isConnected()).thenReturn(true);
        when(transport.getState()).thenReturn(ConnectionState.CONNECTED);

        assertTrue(session.isConnected());
        assertEquals(ConnectionState.CONNECTED, session.getConnectionState());
    }

    @Test
    public void testExportWithoutExporterIsEmpty() {
        when(exporterProvider.getIfAvailable()).thenReturn(null);

        assertTrue(session.exportSnapshot().isEmpty());
    }

    @Test
    public void testExportDelegatesToExporter() {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(exporterProvider.getIfAvailable()).thenReturn(document -> Optional.of(png));

        assertArrayEquals(png, session.exportSnapshot().orElseThrow());
    }

    @Test
    public void testInitializationErrorIsExposed() {
        when(store.getInitializationError()).thenReturn(Optional.of("Failed to initialize document: boom"));

        assertEquals("Failed to initialize document: boom", session.getInitializationError().orElseThrow());
    }
}
