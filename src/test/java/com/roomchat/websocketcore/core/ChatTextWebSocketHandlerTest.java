package com.roomchat.websocketcore.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.roomchat.room.RoomContext;
import com.roomchat.room.RoomContextFactory;
import com.roomchat.room.RoomDirectory;
import com.roomchat.room.RoomSettings;
import com.roomchat.room.model.ClientId;
import com.roomchat.support.ManualRoomClock;
import com.roomchat.websocketcore.converter.ChatFrameConverter;
import com.roomchat.websocketcore.converter.JsonRoomEventRenderer;

class ChatTextWebSocketHandlerTest {

    private final ManualRoomClock clock = new ManualRoomClock(1_000);
    private RoomDirectory directory;
    private RoomContext room;
    private ChatTextWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        JsonRoomEventRenderer renderer = new JsonRoomEventRenderer();
        directory = new RoomDirectory(new RoomContextFactory(clock, renderer, new RoomSettings(2, 100, 50)));
        room = directory.getDefaultRoom();
        handler = new ChatTextWebSocketHandler(directory, clock, renderer, new ChatFrameConverter(), 1_000, 64 * 1024);
    }

    /** 보낸 텍스트 프레임을 기록하는 가짜 세션 */
    private static final class FakeSession {
        final WebSocketSession session = mock(WebSocketSession.class);
        final Map<String, Object> attributes = new HashMap<>();
        final List<String> sent = new CopyOnWriteArrayList<>();

        FakeSession(String sessionId, String clientId, RoomContext room) throws Exception {
            attributes.put(ChatHandShakeIntercepter.ATTR_CLIENT_ID, ClientId.of(clientId));
            attributes.put(ChatHandShakeIntercepter.ATTR_ROOM_ID, room.getRoomId());
            when(session.getId()).thenReturn(sessionId);
            when(session.isOpen()).thenReturn(true);
            when(session.getAttributes()).thenReturn(attributes);
            doAnswer(invocation -> {
                sent.add(((TextMessage) invocation.getArgument(0)).getPayload());
                return null;
            }).when(session).sendMessage(any());
        }

        JSONObject lastFrame() {
            return new JSONObject(sent.get(sent.size() - 1));
        }
    }

    @Test
    void connectSendsRosterAndNotifiesOthers() throws Exception {
        FakeSession alice = new FakeSession("s-1", "alice", room);
        FakeSession bob = new FakeSession("s-2", "bob", room);

        handler.afterConnectionEstablished(alice.session);
        handler.afterConnectionEstablished(bob.session);

        assertThat(new JSONObject(alice.sent.get(0)).getString("type")).isEqualTo("room-connected");
        assertThat(alice.lastFrame().getString("type")).isEqualTo("participant-joined");
        assertThat(alice.lastFrame().getString("client_id")).isEqualTo("bob");
        assertThat(bob.lastFrame().getJSONArray("participants").length()).isEqualTo(2);
        assertThat(bob.attributes).containsKeys(ChatTextWebSocketHandler.ATTR_PARTICIPANT, ChatTextWebSocketHandler.ATTR_SINK);
    }

    @Test
    void duplicateClientIsClosedWithoutDisturbingOriginal() throws Exception {
        FakeSession original = new FakeSession("s-1", "alice", room);
        FakeSession duplicate = new FakeSession("s-2", "alice", room);
        handler.afterConnectionEstablished(original.session);

        handler.afterConnectionEstablished(duplicate.session);
        handler.afterConnectionClosed(duplicate.session, ChatTextWebSocketHandler.DUPLICATE_CLIENT);

        verify(duplicate.session).close(ChatTextWebSocketHandler.DUPLICATE_CLIENT);
        assertThat(duplicate.attributes).doesNotContainKey(ChatTextWebSocketHandler.ATTR_PARTICIPANT);
        assertThat(room.getRoomStore().listParticipants()).containsExactly(ClientId.of("alice"));
        assertThat(room.getDeliveryRegistry().isRegistered(ClientId.of("alice"))).isTrue();
    }

    @Test
    void fullRoomClosesNewcomer() throws Exception {
        handler.afterConnectionEstablished(new FakeSession("s-1", "alice", room).session);
        handler.afterConnectionEstablished(new FakeSession("s-2", "bob", room).session);
        FakeSession carol = new FakeSession("s-3", "carol", room);

        handler.afterConnectionEstablished(carol.session);

        verify(carol.session).close(ChatTextWebSocketHandler.ROOM_FULL);
        assertThat(room.getRoomStore().participantCount()).isEqualTo(2);
    }

    @Test
    void chatFrameIsRelayedUsingSessionIdentity() throws Exception {
        FakeSession alice = new FakeSession("s-1", "alice", room);
        FakeSession bob = new FakeSession("s-2", "bob", room);
        handler.afterConnectionEstablished(alice.session);
        handler.afterConnectionEstablished(bob.session);
        int aliceFrames = alice.sent.size();

        handler.handleTextMessage(alice.session, new TextMessage("{\"client_id\":\"bob\",\"content\":\"hello\"}"));

        JSONObject chat = bob.lastFrame();
        assertThat(chat.getString("type")).isEqualTo("chat");
        assertThat(chat.getString("client_id")).isEqualTo("alice");
        assertThat(chat.getString("content")).isEqualTo("hello");
        assertThat(chat.getLong("timestamp")).isEqualTo(1_000L);
        assertThat(alice.sent).hasSize(aliceFrames);
    }

    @Test
    void invalidContentIsReportedToSenderOnly() throws Exception {
        FakeSession alice = new FakeSession("s-1", "alice", room);
        FakeSession bob = new FakeSession("s-2", "bob", room);
        handler.afterConnectionEstablished(alice.session);
        handler.afterConnectionEstablished(bob.session);
        int bobFrames = bob.sent.size();

        handler.handleTextMessage(alice.session, new TextMessage("x".repeat(51)));

        assertThat(alice.lastFrame().getString("type")).isEqualTo("error");
        assertThat(alice.lastFrame().getString("reason")).isEqualTo("invalid-content");
        assertThat(bob.sent).hasSize(bobFrames);
        assertThat(room.getRoomStore().getMessages()).isEmpty();
    }

    @Test
    void messageFromUnconnectedSessionIsIgnored() throws Exception {
        FakeSession stranger = new FakeSession("s-9", "mallory", room);

        handler.handleTextMessage(stranger.session, new TextMessage("hi"));

        assertThat(stranger.sent).isEmpty();
        assertThat(room.getRoomStore().getMessages()).isEmpty();
    }

    @Test
    void closeDisconnectsAndNotifiesRemaining() throws Exception {
        FakeSession alice = new FakeSession("s-1", "alice", room);
        FakeSession bob = new FakeSession("s-2", "bob", room);
        handler.afterConnectionEstablished(alice.session);
        handler.afterConnectionEstablished(bob.session);
        clock.set(9_000);

        handler.afterConnectionClosed(alice.session, CloseStatus.NORMAL);
        handler.handleTransportError(alice.session, new IllegalStateException("late"));

        assertThat(room.getRoomStore().listParticipants()).containsExactly(ClientId.of("bob"));
        assertThat(bob.lastFrame().getString("type")).isEqualTo("participant-left");
        assertThat(bob.lastFrame().getLong("disconnected_at")).isEqualTo(9_000L);
        assertThat(bob.sent.stream().filter(frame -> frame.contains("participant-left")).count()).isEqualTo(1L);
    }

    @Test
    void lateCloseOfOldSessionKeepsReconnectedClient() throws Exception {
        FakeSession first = new FakeSession("s-1", "alice", room);
        handler.afterConnectionEstablished(first.session);
        handler.handleTransportError(first.session, new IllegalStateException("reset"));

        FakeSession second = new FakeSession("s-2", "alice", room);
        handler.afterConnectionEstablished(second.session);
        handler.afterConnectionClosed(first.session, CloseStatus.GOING_AWAY);

        assertThat(room.getRoomStore().containsParticipant(ClientId.of("alice"))).isTrue();
        assertThat(room.getDeliveryRegistry().isRegistered(ClientId.of("alice"))).isTrue();
        verify(second.session, never()).close(any());
    }
}
