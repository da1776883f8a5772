package com.roomchat.room.exception;

import lombok.Getter;

/* 방 정원(participant capacity) 초과 시 신규 참가 거절. */
@Getter
public class RoomCapacityExceededException extends RoomChatException {

    private final int capacity;
    private final int current;

    public RoomCapacityExceededException(int capacity, int current) {
        super("방 최대 인원 수(" + capacity + ")를 초과했습니다. 현재 인원=" + current);
        this.capacity = capacity;
        this.current = current;
    }
}
