package com.roomchat.event;

import java.util.List;

import com.roomchat.room.model.Participant;

import lombok.Getter;
import lombok.ToString;

/* 신규 접속자 본인에게만 보내는 환영 이벤트(현재 참가자 명단 포함). */
@Getter
@ToString
public class RoomConnectedEvent extends RoomEvent {

    private final List<Participant> participants;

    public RoomConnectedEvent(List<Participant> participants) {
        this.participants = List.copyOf(participants);
    }

    @Override
    public RoomEventType getType() {
        return RoomEventType.ROOM_CONNECTED;
    }
}
