package com.roomchat.websocketcore.converter;

import org.json.JSONArray;
import org.json.JSONObject;

import com.roomchat.event.MessagePostedEvent;
import com.roomchat.event.ParticipantJoinedEvent;
import com.roomchat.event.ParticipantLeftEvent;
import com.roomchat.event.RoomConnectedEvent;
import com.roomchat.event.RoomEvent;
import com.roomchat.event.RoomEventRenderer;
import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.Participant;

/**
 * @class JsonRoomEventRenderer
 * @brief 도메인 이벤트 → WebSocket JSON 텍스트 프레임 변환.
 *
 * @details
 * - type 필드는 kebab-case(room-connected, participant-joined, participant-left, chat)
 * - 시각 필드는 epoch 밀리초 숫자
 */
public class JsonRoomEventRenderer implements RoomEventRenderer {

    public static final String TYPE_ERROR = "error";

    @Override
    public String render(RoomEvent event) {
        JSONObject json = new JSONObject();
        json.put("type", event.getType().getWireName());

        switch (event.getType()) {
            case ROOM_CONNECTED:
                JSONArray participants = new JSONArray();
                for (Participant participant : ((RoomConnectedEvent) event).getParticipants()) {
                    participants.put(toParticipantJson(participant));
                }
                json.put("participants", participants);
                break;
            case PARTICIPANT_JOINED:
                Participant joined = ((ParticipantJoinedEvent) event).getParticipant();
                json.put("client_id", joined.getClientId().getValue());
                json.put("connected_at", joined.getJoinedAt().toEpochMillis());
                break;
            case PARTICIPANT_LEFT:
                ParticipantLeftEvent left = (ParticipantLeftEvent) event;
                json.put("client_id", left.getClientId().getValue());
                json.put("disconnected_at", left.getDisconnectedAt().toEpochMillis());
                break;
            case CHAT:
                ChatMessage message = ((MessagePostedEvent) event).getMessage();
                json.put("client_id", message.getSender().getValue());
                json.put("content", message.getContent().getValue());
                json.put("timestamp", message.getSentAt().toEpochMillis());
                break;
            default:
                throw new IllegalArgumentException("지원하지 않는 이벤트 타입: " + event.getType());
        }
        return json.toString();
    }

    /** 거절된 프레임에 대해 발신자 본인에게만 보내는 오류 프레임 */
    public String renderError(String reason, String message) {
        JSONObject json = new JSONObject();
        json.put("type", TYPE_ERROR);
        json.put("reason", reason);
        json.put("message", message);
        return json.toString();
    }

    private JSONObject toParticipantJson(Participant participant) {
        JSONObject json = new JSONObject();
        json.put("client_id", participant.getClientId().getValue());
        json.put("connected_at", participant.getJoinedAt().toEpochMillis());
        return json;
    }
}
