package com.collab.service;

import com.collab.exception.GuestNotAllowedException;
import com.collab.exception.InvalidMessageException;
import com.collab.exception.SessionFullException;
import com.collab.exception.SessionNotFoundException;
import com.collab.model.Edit;
import com.collab.model.Session;
import com.collab.model.SessionEvent;
import com.collab.model.SessionEventType;
import com.collab.model.SessionSettings;
import com.collab.model.SyncRequest;
import com.collab.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.collab.service.CollabTestSupport.user;
import static org.junit.jupiter.api.Assertions.*;

public class SessionServiceTest {
    private CollabTestSupport support;
    private SessionService sessions;
    private RecordingTransport transport;

    @BeforeEach
    public void setUp() {
        support = new CollabTestSupport();
        sessions = support.sessionService;
        transport = support.transport;
    }

    // CREATE

    @Test
    public void testCreateSessionWithDefaults() {
        Session session = sessions.createSession("doc-1", user("alice"));

        assertNotNull(session.getId());
        assertEquals("doc-1", session.getDocumentId());
        assertEquals("alice", session.getOwnerId());
        assertNotNull(session.getCreatedAt());
        assertEquals(10, session.getSettings().getMaxMembers());
        assertTrue(session.getSettings().isAllowGuests());
        assertFalse(session.getSettings().isReadOnly());
        assertEquals(1, session.getMemberCount());
        assertEquals(0, session.getVersion());
        assertEquals("#FF6B6B", session.getMember("alice").orElseThrow().getColor());
        assertTrue(transport.deliveries().isEmpty());
    }

    @Test
    public void testCreateSessionWithSettings() {
        SessionSettings settings = SessionSettings.builder().maxMembers(2).readOnly(true).build();
        Session session = sessions.createSession("doc-1", user("alice"), settings);

        assertEquals(2, session.getSettings().getMaxMembers());
        assertTrue(session.getSettings().isReadOnly());
        assertTrue(session.getSettings().isAllowGuests());
    }

    @Test
    public void testCreateSessionGeneratesDistinctIds() {
        Session first = sessions.createSession("doc-1", user("alice"));
        Session second = sessions.createSession("doc-1", user("alice"));

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, sessions.getUserSessions("alice").size());
    }

    @Test
    public void testCreateSessionRequiresOwnerId() {
        assertThrows(InvalidMessageException.class,
                () -> sessions.createSession("doc-1", new User(" ", "x", null, null)));
    }

    @Test
    public void testCreateSessionRejectsSettingsWithoutRoom() {
        SessionSettings settings = SessionSettings.builder().maxMembers(0).build();

        assertThrows(InvalidMessageException.class, () -> sessions.createSession("doc-1", user("alice"), settings));
        assertEquals(0, sessions.getSessionCount());
        assertTrue(sessions.getUserSessions("alice").isEmpty());
    }

    @Test
    public void testCreateSessionDoesNotKeepCallerObject() {
        User owner = user("alice");
        Session session = sessions.createSession("doc-1", owner);

        owner.setDisplayName("changed");
        assertEquals("User alice",
                sessions.getSession(session.getId()).orElseThrow().getMember("alice").orElseThrow().getDisplayName());
    }

    // JOIN

    @Test
    public void testJoinAssignsNextColorAndNotifiesOthers() {
        Session session = sessions.createSession("doc-1", user("alice"));

        Session joined = sessions.joinSession(session.getId(), user("bob"));

        assertEquals(2, joined.getMemberCount());
        assertEquals("#4ECDC4", joined.getMember("bob").orElseThrow().getColor());

        List<SessionEvent> aliceJoins = transport.eventsFor("alice", SessionEventType.JOIN);
        assertEquals(1, aliceJoins.size());
        assertEquals("bob", aliceJoins.get(0).getAuthorId());
        assertEquals(session.getId(), aliceJoins.get(0).getSessionId());
        assertEquals("bob", ((User) aliceJoins.get(0).getPayload()).getId());

        assertTrue(transport.eventsFor("bob", SessionEventType.JOIN).isEmpty());
    }

    @Test
    public void testJoinSendsSyncRequestToJoiner() {
        Session session = sessions.createSession("doc-1", user("alice"));
        support.editService.applyEdit(session.getId(), Edit.insert("alice", 0, "hi", 0));

        sessions.joinSession(session.getId(), user("bob"));

        List<SessionEvent> syncs = transport.eventsFor("bob", SessionEventType.SYNC_REQUEST);
        assertEquals(1, syncs.size());
        SyncRequest request = (SyncRequest) syncs.get(0).getPayload();
        assertEquals(session.getId(), request.getSessionId());
        assertEquals("bob", request.getUserId());
        assertEquals(1, request.getVersion());
        assertTrue(transport.eventsFor("alice", SessionEventType.SYNC_REQUEST).isEmpty());
    }

    @Test
    public void testJoinUnknownSession() {
        assertThrows(SessionNotFoundException.class, () -> sessions.joinSession("missing", user("bob")));
    }

    @Test
    public void testJoinFullSessionLeavesMembersUnchanged() {
        Session session = sessions.createSession("doc-1", user("alice"),
                SessionSettings.builder().maxMembers(2).build());
        sessions.joinSession(session.getId(), user("bob"));
        transport.clear();

        assertThrows(SessionFullException.class, () -> sessions.joinSession(session.getId(), user("carol")));

        Session after = sessions.getSession(session.getId()).orElseThrow();
        assertEquals(2, after.getMemberCount());
        assertFalse(after.hasMember("carol"));
        assertTrue(transport.deliveries().isEmpty());
        assertTrue(sessions.getUserSessions("carol").isEmpty());
    }

    @Test
    public void testGuestsRejectedUnlessAuthorized() {
        SessionSettings settings = SessionSettings.builder()
                .allowGuests(false)
                .authorizedUserId("bob")
                .build();
        Session session = sessions.createSession("doc-1", user("alice"), settings);

        assertThrows(GuestNotAllowedException.class, () -> sessions.joinSession(session.getId(), user("carol")));
        assertTrue(sessions.joinSession(session.getId(), user("bob")).hasMember("bob"));
    }

    @Test
    public void testRejoinIsIdempotent() {
        Session session = sessions.createSession("doc-1", user("alice"));
        sessions.joinSession(session.getId(), user("bob"));
        String color = sessions.getSession(session.getId()).orElseThrow().getMember("bob").orElseThrow().getColor();

        Session again = sessions.joinSession(session.getId(), user("bob"));

        assertEquals(2, again.getMemberCount());
        assertEquals(color, again.getMember("bob").orElseThrow().getColor());
        assertEquals(1, transport.eventsFor("alice", SessionEventType.JOIN).size());
        assertEquals(2, transport.eventsFor("bob", SessionEventType.SYNC_REQUEST).size());
    }

    @Test
    public void testColorsCycleThroughPalette() {
        Session session = sessions.createSession("doc-1", user("owner"),
                SessionSettings.builder().maxMembers(12).build());
        for (int i = 1; i <= 10; i++) {
            sessions.joinSession(session.getId(), user("u" + i));
        }

        Session full = sessions.getSession(session.getId()).orElseThrow();
        assertEquals("#D4A5A5", full.getMember("u9").orElseThrow().getColor());
        assertEquals("#FF6B6B", full.getMember("u10").orElseThrow().getColor());
    }

    // LEAVE

    @Test
    public void testLeaveNotifiesRemainingMembers() {
        Session session = sessions.createSession("doc-1", user("alice"));
        sessions.joinSession(session.getId(), user("bob"));
        transport.clear();

        sessions.leaveSession(session.getId(), "bob");

        assertEquals(1, transport.eventsFor("alice", SessionEventType.LEAVE).size());
        assertTrue(transport.eventsFor("bob").isEmpty());
        assertEquals(List.of("alice"), sessions.getActiveMembers(session.getId()).stream().map(User::getId).toList());
        assertTrue(sessions.getUserSessions("bob").isEmpty());
    }

    @Test
    public void testLeaveIgnoresUnknownSessionAndNonMember() {
        Session session = sessions.createSession("doc-1", user("alice"));

        sessions.leaveSession("missing", "alice");
        sessions.leaveSession(session.getId(), "nobody");

        assertEquals(1, sessions.getSession(session.getId()).orElseThrow().getMemberCount());
        assertTrue(transport.deliveries().isEmpty());
    }

    @Test
    public void testSessionDestroyedWhenLastMemberLeaves() {
        Session session = sessions.createSession("doc-1", user("alice"));
        sessions.joinSession(session.getId(), user("bob"));

        sessions.leaveSession(session.getId(), "alice");
        assertTrue(sessions.getSession(session.getId()).isPresent());

        sessions.leaveSession(session.getId(), "bob");
        assertTrue(sessions.getSession(session.getId()).isEmpty());
        assertEquals(0, sessions.getSessionCount());
        assertTrue(sessions.getActiveMembers(session.getId()).isEmpty());
        assertThrows(SessionNotFoundException.class, () -> sessions.joinSession(session.getId(), user("carol")));
        assertThrows(SessionNotFoundException.class, () -> sessions.requireSession(session.getId()));
    }

    @Test
    public void testLeaveAllSessions() {
        Session first = sessions.createSession("doc-1", user("alice"));
        Session second = sessions.createSession("doc-2", user("bob"));
        sessions.joinSession(first.getId(), user("bob"));

        sessions.leaveAllSessions("bob");

        assertTrue(sessions.getUserSessions("bob").isEmpty());
        assertTrue(sessions.getSession(second.getId()).isEmpty());
        assertFalse(sessions.getSession(first.getId()).orElseThrow().hasMember("bob"));
    }

    @Test
    public void testOutboundQueuesReleasedAfterLastLeave() {
        for (int i = 0; i < 50; i++) {
            Session session = sessions.createSession("doc-" + i, user("alice"));
            sessions.joinSession(session.getId(), user("bob"));
            sessions.leaveSession(session.getId(), "bob");
            sessions.leaveSession(session.getId(), "alice");
        }

        assertEquals(0, sessions.getSessionCount());
        assertEquals(0, support.dispatcher.queueCount());
        assertEquals(0, support.dispatcher.pendingFor("bob"));
    }

    @Test
    public void testOutboundQueueKeptWhileOtherSessionsRemain() {
        Session first = sessions.createSession("doc-1", user("alice"));
        Session second = sessions.createSession("doc-2", user("carol"));
        sessions.joinSession(first.getId(), user("bob"));
        sessions.joinSession(second.getId(), user("bob"));

        sessions.leaveSession(first.getId(), "bob");
        sessions.joinSession(second.getId(), user("dave"));

        // bob still belongs to the second session and hears about dave
        assertEquals(1, transport.eventsFor("bob", SessionEventType.JOIN).stream()
                .filter(e -> e.getSessionId().equals(second.getId())).count());
        assertEquals(4, support.dispatcher.queueCount());
    }

    // SNAPSHOTS

    @Test
    public void testSnapshotsAreDetachedFromLiveState() {
        Session session = sessions.createSession("doc-1", user("alice"));
        Session snapshot = sessions.getSession(session.getId()).orElseThrow();

        assertThrows(UnsupportedOperationException.class, () -> snapshot.getMembers().add(user("mallory")));
        snapshot.getMember("alice").orElseThrow().setColor("#000000");

        assertEquals("#FF6B6B", sessions.getActiveMembers(session.getId()).get(0).getColor());
    }

    @Test
    public void testGetUserSessionsForUnknownUser() {
        assertTrue(sessions.getUserSessions("ghost").isEmpty());
    }
}
