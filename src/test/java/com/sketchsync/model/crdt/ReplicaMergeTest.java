package com.sketchsync.model.crdt;

import com.sketchsync.model.Canvas;
import com.sketchsync.model.CanvasElement;
import com.sketchsync.model.Cursor;
import com.sketchsync.model.Note;
import com.sketchsync.model.Point;
import com.sketchsync.model.SketchDocument;
import com.sketchsync.model.Stroke;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ReplicaMergeTest {
    private Replica alice;
    private Replica bob;

    @BeforeEach
    public void setUp() {
        alice = new Replica("alice", "site-a");
        bob = new Replica("bob", "site-b");
    }

    private static Stroke stroke(String id, String creator, double offset) {
        return new Stroke(id, creator, 10L,
                List.of(new Point(offset, offset), new Point(offset + 1, offset + 2), new Point(offset + 3, offset + 4)),
                "#222222", 3);
    }

    private static void exchange(Replica first, Replica second) {
        List<Operation> fromFirst = first.getOperations();
        Map<String, CursorEntry> cursorsFromFirst = first.getCursors();
        first.merge(second.getOperations());
        first.mergeCursors(second.getCursors());
        second.merge(fromFirst);
        second.mergeCursors(cursorsFromFirst);
    }

    private static Canvas canvas(Replica replica) {
        return replica.getDocument().getCanvas().orElseThrow();
    }

    // CONVERGENCE TESTS

    @Test
    public void testOfflineStrokesConvergeAfterExchange() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        bob.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        alice.addElement(stroke("stroke-a", "alice", 0), 2L);
        bob.addElement(stroke("stroke-b", "bob", 50), 2L);

        exchange(alice, bob);

        assertEquals(alice.getDocument(), bob.getDocument());
        List<CanvasElement> elements = canvas(alice).getElements();
        assertEquals(2, elements.size());
        assertEquals(List.of("stroke-a", "stroke-b"), elements.stream().map(CanvasElement::getId).collect(Collectors.toList()));
        for (CanvasElement element : elements) {
            assertEquals(3, ((Stroke) element).getPoints().size());
        }
    }

    @Test
    public void testMergeIsIdempotent() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        alice.addElement(stroke("s1", "alice", 0), 2L);

        assertEquals(2, bob.merge(alice.getOperations()));
        SketchDocument once = bob.getDocument();

        assertEquals(0, bob.merge(alice.getOperations()));
        assertEquals(once, bob.getDocument());
        assertEquals(2, bob.getOperations().size());
    }

    @Test
    public void testMergeIsCommutative() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        alice.setTitle("From alice", 2L);
        bob.initCanvas("Bob's board", 1L);
        bob.addElement(stroke("s-b", "bob", 0), 2L);

        Replica first = new Replica("carol", "site-c");
        first.merge(alice.getOperations());
        first.merge(bob.getOperations());

        Replica second = new Replica("dave", "site-d");
        second.merge(bob.getOperations());
        second.merge(alice.getOperations());

        assertEquals(first.getDocument(), second.getDocument());
    }

    @Test
    public void testShuffledDuplicatedDeliveryConverges() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        alice.addElement(stroke("s1", "alice", 0), 2L);
        alice.addElement(new Note("n1", "alice", 3L, "draft", new Point(1, 1), "#ffff99"), 3L);
        alice.updateNoteText("n1", "done", 4L);
        alice.setTitle("Roadmap", 5L);

        List<Operation> delivery = new ArrayList<>(alice.getOperations());
        delivery.addAll(alice.getOperations().subList(1, 3));
        Collections.shuffle(delivery, new Random(42));

        Replica receiver = new Replica("bob", "site-b");
        for (Operation operation : delivery) {
            receiver.merge(List.of(operation));
        }

        assertEquals(alice.getDocument(), receiver.getDocument());
        assertEquals(0, receiver.getPendingCount());
    }

    @Test
    public void testConcurrentInitKeepsElementsFromBothSides() {
        alice.initCanvas("Alice title", 1L);
        alice.addElement(stroke("s-a", "alice", 0), 2L);
        bob.initCanvas("Bob title", 1L);
        bob.addElement(stroke("s-b", "bob", 10), 2L);

        exchange(alice, bob);

        assertEquals(2, canvas(alice).getElements().size());
        assertEquals(alice.getDocument(), bob.getDocument());
        // the first init in replay order creates the canvas, later inits are no-ops
        assertEquals("Alice title", canvas(bob).getTitle());
    }

    // LAST WRITER WINS TESTS

    @Test
    public void testConcurrentTitleChangesPickTheSameWinner() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        bob.merge(alice.getOperations());

        alice.setTitle("Alice's title", 100L);
        bob.setTitle("Bob's title", 50L);
        exchange(alice, bob);

        assertEquals(canvas(alice).getTitle(), canvas(bob).getTitle());
        // equal lamport values, the higher site id wins
        assertEquals("Bob's title", canvas(alice).getTitle());
    }

    @Test
    public void testCausallyLaterTitleWins() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        alice.setTitle("First", 2L);
        bob.merge(alice.getOperations());
        bob.setTitle("Second", 3L);

        alice.merge(bob.getOperations());

        assertEquals("Second", canvas(alice).getTitle());
        assertEquals("Second", canvas(bob).getTitle());
    }

    @Test
    public void testConcurrentNoteEditsPickTheSameWinner() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        alice.addElement(new Note("n1", "alice", 2L, "start", new Point(0, 0), "#ffff99"), 2L);
        bob.merge(alice.getOperations());

        alice.updateNoteText("n1", "alice edit", 3L);
        bob.updateNoteText("n1", "bob edit", 3L);
        exchange(alice, bob);

        Note fromAlice = (Note) canvas(alice).findElement("n1").orElseThrow();
        Note fromBob = (Note) canvas(bob).findElement("n1").orElseThrow();
        assertEquals(fromAlice, fromBob);
        assertEquals("bob edit", fromAlice.getText());
    }

    @Test
    public void testCursorsFromBothActorsSurviveMerge() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        bob.merge(alice.getOperations());

        alice.setCursor("alice", new Cursor(new Point(1, 1), 10L));
        bob.setCursor("bob", new Cursor(new Point(2, 2), 20L));
        exchange(alice, bob);

        assertEquals(2, canvas(alice).getCursors().size());
        assertEquals(canvas(alice).getCursors(), canvas(bob).getCursors());
    }

    @Test
    public void testConcurrentCursorWritesPickTheSameWinner() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        bob.merge(alice.getOperations());

        alice.setCursor("carol", new Cursor(new Point(1, 1), 10L));
        bob.setCursor("carol", new Cursor(new Point(9, 9), 5L));
        exchange(alice, bob);

        // equal lamport values, the higher site id wins regardless of wall clock
        assertEquals(new Point(9, 9), canvas(alice).getCursors().get("carol").getPosition());
        assertEquals(canvas(alice).getCursors(), canvas(bob).getCursors());
    }

    @Test
    public void testStaleCursorDoesNotOverwriteNewerOne() {
        alice.setCursor("alice", new Cursor(new Point(1, 1), 1L));
        Map<String, CursorEntry> stale = alice.getCursors();
        alice.setCursor("alice", new Cursor(new Point(2, 2), 2L));
        bob.mergeCursors(alice.getCursors());

        assertEquals(0, bob.mergeCursors(stale));
        assertEquals(0, bob.mergeCursors(alice.getCursors()));
        assertEquals(new Point(2, 2), bob.getCursors().get("alice").getCursor().getPosition());
    }

    // CAUSALITY TESTS

    @Test
    public void testOperationWaitsForMissingDependency() {
        Operation init = alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        Operation add = alice.addElement(new Note("n1", "alice", 2L, "draft", new Point(0, 0), "#ffff99"), 2L);
        Operation update = alice.updateNoteText("n1", "final", 3L).orElseThrow();

        Replica carol = new Replica("carol", "site-c");
        carol.merge(List.of(init, update));

        assertEquals(1, carol.getPendingCount());
        assertTrue(canvas(carol).getElements().isEmpty());

        carol.merge(List.of(add));

        assertEquals(0, carol.getPendingCount());
        Note note = (Note) canvas(carol).findElement("n1").orElseThrow();
        assertEquals("final", note.getText());
        assertEquals(alice.getDocument(), carol.getDocument());
    }

    @Test
    public void testLocalOperationsAfterMergeDependOnRemoteHistory() {
        alice.initCanvas(Canvas.DEFAULT_TITLE, 1L);
        alice.setTitle("Seen", 2L);
        bob.merge(alice.getOperations());

        Operation next = bob.setTitle("Reply", 3L);

        assertEquals(2L, next.getDependencies().get("site-a"));
        assertTrue(next.getLamport() > 2);
    }
}
