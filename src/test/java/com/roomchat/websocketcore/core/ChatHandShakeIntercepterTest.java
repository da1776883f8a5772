package com.roomchat.websocketcore.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import com.roomchat.room.RoomContext;
import com.roomchat.room.RoomContextFactory;
import com.roomchat.room.RoomDirectory;
import com.roomchat.room.RoomSettings;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.RoomId;
import com.roomchat.support.ManualRoomClock;
import com.roomchat.support.RecordingSink;
import com.roomchat.support.TextEventRenderer;

class ChatHandShakeIntercepterTest {

    private final ManualRoomClock clock = new ManualRoomClock(1_000);
    private RoomDirectory directory;
    private ChatHandShakeIntercepter intercepter;

    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        directory = new RoomDirectory(new RoomContextFactory(clock, new TextEventRenderer(), RoomSettings.defaults()));
        intercepter = new ChatHandShakeIntercepter(directory);
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    private boolean handshake(String clientId, String roomId) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws");
        if (clientId != null) {
            request.setParameter(ChatHandShakeIntercepter.PARAM_CLIENT_ID, clientId);
        }
        if (roomId != null) {
            request.setParameter(ChatHandShakeIntercepter.PARAM_ROOM_ID, roomId);
        }
        return intercepter.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);
    }

    @Test
    void defaultRoomIsUsedWhenRoomIdOmitted() {
        assertThat(handshake("alice", null)).isTrue();

        assertThat(attributes)
                .containsEntry(ChatHandShakeIntercepter.ATTR_CLIENT_ID, ClientId.of("alice"))
                .containsEntry(ChatHandShakeIntercepter.ATTR_ROOM_ID, directory.getDefaultRoom().getRoomId());
    }

    @Test
    void explicitRoomIsResolved() {
        RoomContext other = directory.createRoom();

        assertThat(handshake("alice", other.getRoomId().getValue())).isTrue();
        assertThat(attributes).containsEntry(ChatHandShakeIntercepter.ATTR_ROOM_ID, other.getRoomId());
    }

    @Test
    void missingClientIdIsBadRequest() {
        assertThat(handshake(null, null)).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(400);
        assertThat(attributes).isEmpty();
    }

    @Test
    void malformedRoomIdIsBadRequest() {
        assertThat(handshake("alice", "lobby")).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(400);
    }

    @Test
    void unknownRoomIsNotFound() {
        assertThat(handshake("alice", RoomId.generate().getValue())).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(404);
    }

    @Test
    void connectedClientIdIsConflict() {
        RoomContext room = directory.getDefaultRoom();
        room.getConnectUseCase().execute(ClientId.of("alice"), new RecordingSink(), clock.now());

        assertThat(handshake("alice", null)).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(409);
    }
}
