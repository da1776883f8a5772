package com.roomchat.event;

import lombok.Getter;

@Getter
public enum RoomEventType {

    ROOM_CONNECTED("room-connected"),
    PARTICIPANT_JOINED("participant-joined"),
    PARTICIPANT_LEFT("participant-left"),
    CHAT("chat");

    /** 외부 표현(kebab-case) */
    private final String wireName;

    RoomEventType(String wireName) {
        this.wireName = wireName;
    }
}
