package com.syncline.core.store;

import com.syncline.core.model.Message;
import com.syncline.core.model.MessageRole;
import com.syncline.core.model.Part;
import com.syncline.core.model.Session;
import com.syncline.core.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Projection} and the stores it wires.
 */
class ProjectionTest {

    private Projection projection;
    private List<ProjectionChange> changes;
    private List<String> rejections;

    @BeforeEach
    void setUp() {
        projection = Projection.create();
        changes = new ArrayList<>();
        rejections = new ArrayList<>();
        projection.addListener(new ProjectionListener() {
            @Override
            public void onChange(ProjectionChange change) {
                changes.add(change);
            }

            @Override
            public void onRejected(String store, String entityId, String reason) {
                rejections.add(store + ":" + entityId);
            }
        });
    }

    private static Message message(String id, String streamId) {
        return new Message(id, MessageRole.ASSISTANT, streamId, null, 1L, null, null, null, null, null);
    }

    private void seed(String streamId, String messageId, String... partIds) {
        projection.batch(() -> {
            projection.sessions().upsert(new Session(streamId, "/work"));
            projection.messages().upsert(message(messageId, streamId));
            for (String partId : partIds) {
                projection.parts().upsert(Part.text(partId, messageId, streamId, "text"));
            }
        });
    }

    @Nested
    @DisplayName("referential integrity")
    class IntegrityTests {

        @Test
        @DisplayName("a message for an unknown session is rejected and reported")
        void messageNeedsSession() {
            boolean stored = projection.batch(() -> projection.messages().upsert(message("msg-1", "ghost")));

            int messages = projection.read(p -> p.messages().size());
            assertFalse(stored);
            assertEquals(0, messages);
            assertEquals(List.of("message:msg-1"), rejections);
        }

        @Test
        @DisplayName("a part for an unknown message is rejected and reported")
        void partNeedsMessage() {
            seed("s1", "msg-1");

            boolean stored = projection.batch(() ->
                    projection.parts().upsert(Part.text("prt-1", "msg-404", "s1", "x")));

            assertFalse(stored);
            assertEquals(List.of("part:prt-1"), rejections);
        }

        @Test
        @DisplayName("status of an unknown session is rejected")
        void statusNeedsSession() {
            boolean stored = projection.batch(() -> projection.sessions().setStatus("ghost", SessionStatus.busy()));

            assertFalse(stored);
            assertEquals(List.of("session:ghost"), rejections);
        }
    }

    @Nested
    @DisplayName("cascades")
    class CascadeTests {

        @Test
        @DisplayName("removing a session empties all three stores for that stream")
        void sessionCascade() {
            seed("s1", "msg-1", "prt-1", "prt-2");
            seed("s2", "msg-2", "prt-3");

            projection.batch(() -> projection.sessions().remove("s1"));

            StreamSnapshot s1 = projection.snapshot("s1");
            assertFalse(s1.exists());
            assertTrue(s1.messages().isEmpty());
            assertTrue(projection.read(p -> p.parts().byMessage("msg-1")).isEmpty());
            assertTrue(projection.read(p -> p.messages().getById("msg-1")).isEmpty());

            assertEquals(1, projection.snapshot("s2").messages().size());
            int remainingParts = projection.read(p -> p.parts().size());
            assertEquals(1, remainingParts);
        }

        @Test
        @DisplayName("removing a message removes its parts")
        void messageCascade() {
            seed("s1", "msg-1", "prt-1");

            projection.batch(() -> projection.messages().remove("msg-1"));

            boolean sessionKept = projection.read(p -> p.sessions().contains("s1"));
            assertTrue(projection.read(p -> p.parts().getById("prt-1")).isEmpty());
            assertTrue(sessionKept);
        }

        @Test
        @DisplayName("reparent moves parts to another message in order")
        void reparent() {
            seed("s1", "opt-1", "prt-1", "prt-2");
            projection.batch(() -> projection.messages().upsert(message("msg-1", "s1")));

            int moved = projection.batch(() -> projection.parts().reparent("opt-1", "msg-1"));

            assertEquals(2, moved);
            assertEquals(List.of("prt-1", "prt-2"), projection.read(p -> p.parts().byMessage("msg-1"))
                    .stream().map(Part::id).toList());
            assertTrue(projection.read(p -> p.parts().byMessage("opt-1")).isEmpty());
        }
    }

    @Nested
    @DisplayName("batches")
    class BatchTests {

        @Test
        @DisplayName("listeners are notified once per batch with every touched stream")
        void notifiesOncePerBatch() {
            projection.batch(() -> {
                projection.sessions().upsert(new Session("s1", null));
                projection.sessions().upsert(new Session("s2", null));
                projection.messages().upsert(message("msg-1", "s1"));
            });

            assertEquals(1, changes.size());
            assertEquals(Set.of("s1", "s2"), changes.get(0).streamIds());
        }

        @Test
        @DisplayName("nested batches notify once, when the outermost completes")
        void nestedBatches() {
            projection.batch(() -> {
                projection.sessions().upsert(new Session("s1", null));
                projection.batch(() -> projection.sessions().upsert(new Session("s2", null)));
                assertTrue(changes.isEmpty());
            });

            assertEquals(1, changes.size());
        }

        @Test
        @DisplayName("a batch that changes nothing notifies nobody")
        void emptyBatch() {
            projection.batch(() -> projection.messages().remove("nothing"));
            assertTrue(changes.isEmpty());
        }

        @Test
        @DisplayName("mutations outside a batch are refused")
        void mutationOutsideBatch() {
            assertThrows(IllegalStateException.class,
                    () -> projection.sessions().upsert(new Session("s1", null)));
        }

        @Test
        @DisplayName("a failing listener does not block the others")
        void failingListenerIsolated() {
            projection.addListener(change -> { throw new IllegalStateException("boom"); });
            List<ProjectionChange> late = new ArrayList<>();
            projection.addListener(late::add);

            projection.batch(() -> projection.sessions().upsert(new Session("s1", null)));

            assertEquals(1, late.size());
        }
    }

    @Nested
    @DisplayName("sessions")
    class SessionTests {

        @Test
        @DisplayName("blank directories default and directory index follows updates")
        void directoryIndex() {
            projection.batch(() -> {
                projection.sessions().upsert(new Session("s1", ""));
                projection.sessions().upsert(new Session("s2", "/a"));
                projection.sessions().upsert(new Session("s2", "/b"));
            });

            assertEquals(List.of("s1"), projection.read(p -> p.sessions().byDirectory(Session.DEFAULT_DIRECTORY))
                    .stream().map(Session::id).toList());
            assertTrue(projection.read(p -> p.sessions().byDirectory("/a")).isEmpty());
            assertEquals(1, projection.read(p -> p.sessions().byDirectory("/b")).size());
        }

        @Test
        @DisplayName("getOrCreate keeps an existing session untouched")
        void getOrCreate() {
            projection.batch(() -> projection.sessions().upsert(new Session("s1", "/a")));

            Session session = projection.batch(() -> projection.sessions().getOrCreate("s1", "/other"));

            assertEquals("/a", session.directory());
        }
    }
}
