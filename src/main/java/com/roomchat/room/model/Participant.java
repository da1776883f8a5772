package com.roomchat.room.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/* 방 참가자. Connect 성공 시 생성, Disconnect 시 소멸. RoomStore 만 소유한다(불변이므로 스냅샷 공유 허용). */
@Getter
@ToString
@EqualsAndHashCode
public final class Participant {

    private final ClientId clientId;
    private final Timestamp joinedAt;

    public Participant(ClientId clientId, Timestamp joinedAt) {
        this.clientId = clientId;
        this.joinedAt = joinedAt;
    }
}
