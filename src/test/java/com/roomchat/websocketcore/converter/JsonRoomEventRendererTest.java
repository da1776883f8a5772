package com.roomchat.websocketcore.converter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import com.roomchat.event.MessagePostedEvent;
import com.roomchat.event.ParticipantJoinedEvent;
import com.roomchat.event.ParticipantLeftEvent;
import com.roomchat.event.RoomConnectedEvent;
import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.MessageContent;
import com.roomchat.room.model.Participant;
import com.roomchat.room.model.Timestamp;

class JsonRoomEventRendererTest {

    private final JsonRoomEventRenderer renderer = new JsonRoomEventRenderer();

    @Test
    void rendersRoster() {
        JSONObject json = new JSONObject(renderer.render(new RoomConnectedEvent(List.of(
                new Participant(ClientId.of("alice"), Timestamp.ofEpochMillis(100)),
                new Participant(ClientId.of("bob"), Timestamp.ofEpochMillis(200))))));

        assertThat(json.getString("type")).isEqualTo("room-connected");
        JSONArray participants = json.getJSONArray("participants");
        assertThat(participants.length()).isEqualTo(2);
        assertThat(participants.getJSONObject(0).getString("client_id")).isEqualTo("alice");
        assertThat(participants.getJSONObject(1).getLong("connected_at")).isEqualTo(200L);
    }

    @Test
    void rendersJoinAndLeave() {
        JSONObject joined = new JSONObject(renderer.render(
                new ParticipantJoinedEvent(new Participant(ClientId.of("bob"), Timestamp.ofEpochMillis(300)))));
        JSONObject left = new JSONObject(renderer.render(
                new ParticipantLeftEvent(ClientId.of("bob"), Timestamp.ofEpochMillis(400))));

        assertThat(joined.getString("type")).isEqualTo("participant-joined");
        assertThat(joined.getString("client_id")).isEqualTo("bob");
        assertThat(joined.getLong("connected_at")).isEqualTo(300L);
        assertThat(left.getString("type")).isEqualTo("participant-left");
        assertThat(left.getLong("disconnected_at")).isEqualTo(400L);
    }

    @Test
    void rendersChatWithEscapedContent() {
        ChatMessage message = new ChatMessage(0, ClientId.of("alice"),
                MessageContent.of("say \"hi\"\n"), Timestamp.ofEpochMillis(500));

        JSONObject json = new JSONObject(renderer.render(new MessagePostedEvent(message)));

        assertThat(json.getString("type")).isEqualTo("chat");
        assertThat(json.getString("client_id")).isEqualTo("alice");
        assertThat(json.getString("content")).isEqualTo("say \"hi\"\n");
        assertThat(json.getLong("timestamp")).isEqualTo(500L);
    }

    @Test
    void rendersErrorFrame() {
        JSONObject json = new JSONObject(renderer.renderError("invalid-content", "empty"));

        assertThat(json.getString("type")).isEqualTo("error");
        assertThat(json.getString("reason")).isEqualTo("invalid-content");
        assertThat(json.getString("message")).isEqualTo("empty");
    }
}
