package com.lingolink.gateway.handler;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.model.Identity;
import com.lingolink.core.msg.Events;
import com.lingolink.core.msg.Frame;
import com.lingolink.core.room.RoomKeys;
import com.lingolink.gateway.auth.AuthState;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.support.GatewayFixture;
import com.lingolink.gateway.support.RecordingClientConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests of inbound frame handling: frames go in through the dispatcher and
 * come out of recording transports.
 */
class ClientEventDispatcherTest {
    private static final String CONVERSATION = "conv-1";
    private static final String JOIN = "{\"conversationId\":\"" + CONVERSATION + "\"}";

    private GatewayFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture();
        fixture.backend.addUser("alice", "Alice");
        fixture.backend.addUser("bob", "Bob");
        fixture.backend.addParticipant(CONVERSATION, "alice");
        fixture.backend.addParticipant(CONVERSATION, "bob");
    }

    @Test
    void testAuthenticateFrame_AcceptsObjectAndStringPayloads() {
        RecordingClientConnection first = fixture.newTransport();
        RecordingClientConnection second = fixture.newTransport();
        Connection byObject = fixture.accept(first);
        Connection byString = fixture.accept(second);

        fixture.receive(byObject, Events.Client.AUTHENTICATE,
            "{\"token\":\"" + GatewayFixture.testCredential("alice") + "\"}");
        fixture.receive(byString, Events.Client.AUTHENTICATE,
            "\"" + GatewayFixture.testCredential("bob") + "\"");

        assertEquals(AuthState.AUTHENTICATED, byObject.authState());
        assertEquals(AuthState.AUTHENTICATED, byString.authState());
        assertEquals(Events.Server.AUTHENTICATED, first.lastFrame().getEvent());
        assertEquals("bob", second.lastFrame().getData().get("userId").asText());
    }

    @Test
    void testInvalidFrames() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);
        transport.clear();

        fixture.receive(connection, "not json");
        fixture.receive(connection, "{}");
        fixture.receive(connection, "{\"event\":\"  \",\"data\":{}}");
        fixture.receive(connection, "[1,2]");

        assertEquals(4, transport.framesOf(Events.Server.ERROR).size());
        for (Frame error : transport.frames()) {
            assertEquals(Events.ErrorCodes.INVALID_FRAME, error.getData().get("code").asText());
        }
        assertTrue(transport.isConnected());
    }

    @Test
    void testNullFrame_IsInvalidAndLaterFramesAreStillHandled() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.connectAs("alice", transport);
        transport.clear();
        fixture.scheduler.advanceTimeBy(Duration.ofSeconds(5));

        fixture.receive(connection, "null");
        fixture.receive(connection, "{\"event\":\"heartbeat\"}");
        fixture.receive(connection, Events.Client.JOIN_CONVERSATION, JOIN);

        assertEquals(Events.ErrorCodes.INVALID_FRAME,
            transport.framesOf(Events.Server.ERROR).get(0).getData().get("code").asText());
        assertEquals(5_000L, connection.lastHeartbeatMillis());
        assertEquals(Events.Server.CONVERSATION_JOINED, transport.lastFrame().getEvent());
        assertTrue(transport.isConnected());
    }

    @Test
    void testGuardedEvent_BeforeAuthenticationIsUnauthorized() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);

        fixture.receive(connection, Events.Client.JOIN_CONVERSATION, JOIN);

        assertEquals(Events.ErrorCodes.UNAUTHORIZED, transport.lastFrame().getData().get("code").asText());
        assertEquals(0, fixture.router.roomCount());
        assertTrue(transport.isConnected());
    }

    @Test
    void testGuardedEvent_WaitsForInFlightAuthentication() {
        Sinks.One<Identity> verification = Sinks.one();
        GatewayFixture slow = new GatewayFixture(GatewayFixture.developmentConfig().build(),
            credential -> verification.asMono());
        Identity alice = slow.backend.addUser("alice", "Alice");
        slow.backend.addParticipant(CONVERSATION, "alice");
        RecordingClientConnection transport = slow.newTransport();
        Connection connection = slow.accept(transport);

        slow.receive(connection, Events.Client.AUTHENTICATE, "\"token\"");

        StepVerifier.create(slow.dispatcher.dispatch(connection,
                "{\"event\":\"join_conversation\",\"data\":" + JOIN + "}"))
            .then(() -> verification.tryEmitValue(alice))
            .verifyComplete();

        assertEquals(List.of(Events.Server.CONNECT, Events.Server.AUTHENTICATED, Events.Server.CONVERSATION_JOINED),
            transport.events());
    }

    @Test
    void testHeartbeat_RecordsLiveness() {
        Connection connection = fixture.connectAs("alice", fixture.newTransport());
        fixture.scheduler.advanceTimeBy(Duration.ofSeconds(20));

        fixture.receive(connection, "{\"event\":\"heartbeat\"}");

        assertEquals(20_000L, connection.lastHeartbeatMillis());
    }

    @Test
    void testJoinConversation() {
        RecordingClientConnection aliceTransport = fixture.newTransport();
        Connection alice = fixture.connectAs("alice", aliceTransport);

        fixture.receive(alice, Events.Client.JOIN_CONVERSATION, JOIN);

        assertEquals(Events.Server.CONVERSATION_JOINED, aliceTransport.lastFrame().getEvent());
        assertEquals(CONVERSATION, aliceTransport.lastFrame().getData().get("conversationId").asText());
        assertTrue(fixture.router.members(RoomKeys.conversation(CONVERSATION)).contains(alice.getId()));
    }

    @Test
    void testJoinConversation_NotParticipant() {
        fixture.backend.addUser("carol", "Carol");
        RecordingClientConnection carolTransport = fixture.newTransport();
        Connection carol = fixture.connectAs("carol", carolTransport);

        fixture.receive(carol, Events.Client.JOIN_CONVERSATION, JOIN);

        assertEquals(Events.ErrorCodes.NOT_PARTICIPANT, carolTransport.lastFrame().getData().get("code").asText());
        assertTrue(fixture.router.members(RoomKeys.conversation(CONVERSATION)).isEmpty());
    }

    @Test
    void testJoinConversation_MissingIdIsInvalidRequest() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection alice = fixture.connectAs("alice", transport);

        fixture.receive(alice, Events.Client.JOIN_CONVERSATION, "{}");

        assertEquals(Events.ErrorCodes.INVALID_REQUEST, transport.lastFrame().getData().get("code").asText());
    }

    @Test
    void testSendMessage_PersistsThenBroadcastsToWholeRoom() {
        RecordingClientConnection aliceTransport = fixture.newTransport();
        RecordingClientConnection bobTransport = fixture.newTransport();
        Connection alice = fixture.connectAs("alice", aliceTransport);
        Connection bob = fixture.connectAs("bob", bobTransport);
        fixture.receive(alice, Events.Client.JOIN_CONVERSATION, JOIN);
        fixture.receive(bob, Events.Client.JOIN_CONVERSATION, JOIN);

        fixture.receive(alice, Events.Client.SEND_MESSAGE,
            "{\"conversationId\":\"" + CONVERSATION + "\",\"message\":{\"text\":\"hola\"}}");

        assertEquals(1, fixture.backend.storedMessages().size());
        for (RecordingClientConnection transport : List.of(aliceTransport, bobTransport)) {
            Frame received = transport.lastFrame();
            assertEquals(Events.Server.MESSAGE_RECEIVED, received.getEvent());
            assertEquals("hola", received.getData().get("message").get("content").get("text").asText());
            assertEquals("alice", received.getData().get("message").get("senderId").asText());
        }
    }

    @Test
    void testSendMessage_StoreFailureReportsToSenderOnly() {
        fixture.backend.failMessageWrites();
        RecordingClientConnection aliceTransport = fixture.newTransport();
        RecordingClientConnection bobTransport = fixture.newTransport();
        Connection alice = fixture.connectAs("alice", aliceTransport);
        Connection bob = fixture.connectAs("bob", bobTransport);
        fixture.receive(alice, Events.Client.JOIN_CONVERSATION, JOIN);
        fixture.receive(bob, Events.Client.JOIN_CONVERSATION, JOIN);

        fixture.receive(alice, Events.Client.SEND_MESSAGE,
            "{\"conversationId\":\"" + CONVERSATION + "\",\"message\":\"hola\"}");

        assertEquals(Events.ErrorCodes.MESSAGE_FAILED, aliceTransport.lastFrame().getData().get("code").asText());
        assertEquals(Events.Server.CONVERSATION_JOINED, bobTransport.lastFrame().getEvent());
    }

    @Test
    void testTyping_SkipsEveryConnectionOfTypist() {
        RecordingClientConnection alicePhone = fixture.newTransport();
        RecordingClientConnection aliceLaptop = fixture.newTransport();
        RecordingClientConnection bobTransport = fixture.newTransport();
        Connection phone = fixture.connectAs("alice", alicePhone);
        Connection laptop = fixture.connectAs("alice", aliceLaptop);
        Connection bob = fixture.connectAs("bob", bobTransport);
        for (Connection connection : List.of(phone, laptop, bob)) {
            fixture.receive(connection, Events.Client.JOIN_CONVERSATION, JOIN);
        }

        fixture.receive(phone, Events.Client.TYPING_START, JOIN);
        fixture.receive(phone, Events.Client.TYPING_END, JOIN);

        assertEquals(List.of(Events.Server.USER_TYPING, Events.Server.USER_STOPPED_TYPING),
            bobTransport.events().subList(bobTransport.events().size() - 2, bobTransport.events().size()));
        assertEquals("Alice", bobTransport.framesOf(Events.Server.USER_TYPING).get(0)
            .getData().get("displayName").asText());
        assertTrue(alicePhone.framesOf(Events.Server.USER_TYPING).isEmpty());
        assertTrue(aliceLaptop.framesOf(Events.Server.USER_TYPING).isEmpty());
    }

    @Test
    void testLeaveConversation() {
        Connection alice = fixture.connectAs("alice", fixture.newTransport());
        fixture.receive(alice, Events.Client.JOIN_CONVERSATION, JOIN);

        fixture.receive(alice, Events.Client.LEAVE_CONVERSATION, JOIN);

        assertEquals(0, fixture.router.roomCount());
    }

    @Test
    void testSetStatus() {
        fixture.backend.addFollower("alice", "bob");
        RecordingClientConnection aliceTransport = fixture.newTransport();
        RecordingClientConnection bobTransport = fixture.newTransport();
        fixture.connectAs("bob", bobTransport);
        Connection alice = fixture.connectAs("alice", aliceTransport);

        fixture.receive(alice, Events.Client.SET_STATUS, "{\"status\":\"sleeping\"}");
        assertEquals(Events.ErrorCodes.INVALID_STATUS, aliceTransport.lastFrame().getData().get("code").asText());

        fixture.receive(alice, Events.Client.SET_STATUS, "{\"status\":\"away\"}");
        assertEquals("away", bobTransport.lastFrame().getData().get("status").asText());
    }

    @Test
    void testSubscribeNotifications() {
        Connection alice = fixture.connectAs("alice", fixture.newTransport());

        fixture.receive(alice, "{\"event\":\"subscribe_notifications\"}");

        assertEquals(Set.of(alice.getId()), fixture.router.members(RoomKeys.notifications("alice")));
    }

    @Test
    void testUnknownEventIsIgnored() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection alice = fixture.connectAs("alice", transport);
        int before = transport.frames().size();

        fixture.receive(alice, "{\"event\":\"teleport\",\"data\":{}}");

        assertEquals(before, transport.frames().size());
    }

    @Test
    void testGracefulDisconnect() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection alice = fixture.connectAs("alice", transport);

        fixture.receive(alice, "{\"event\":\"graceful_disconnect\"}");

        assertEquals(DisconnectReason.GRACEFUL_DISCONNECT, transport.disconnectReason());
        assertTrue(fixture.registry.socketsFor("alice").isEmpty());
    }
}
