package com.roomchat.event;

import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.Timestamp;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ParticipantLeftEvent extends RoomEvent {

    private final ClientId clientId;
    private final Timestamp disconnectedAt;

    public ParticipantLeftEvent(ClientId clientId, Timestamp disconnectedAt) {
        this.clientId = clientId;
        this.disconnectedAt = disconnectedAt;
    }

    @Override
    public RoomEventType getType() {
        return RoomEventType.PARTICIPANT_LEFT;
    }
}
