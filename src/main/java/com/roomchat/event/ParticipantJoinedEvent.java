package com.roomchat.event;

import com.roomchat.room.model.Participant;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ParticipantJoinedEvent extends RoomEvent {

    private final Participant participant;

    public ParticipantJoinedEvent(Participant participant) {
        this.participant = participant;
    }

    @Override
    public RoomEventType getType() {
        return RoomEventType.PARTICIPANT_JOINED;
    }
}
