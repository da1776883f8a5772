package com.roomchat.room.exception;

import lombok.Getter;

/* 메시지 로그가 가득 찬 경우. 로그는 append-only 이므로 오래된 메시지를 밀어내지 않고 신규 append 만 거절한다. */
@Getter
public class MessageCapacityExceededException extends RoomChatException {

    private final int capacity;
    private final int current;

    public MessageCapacityExceededException(int capacity, int current) {
        super("방 메시지 보관 한도(" + capacity + ")를 초과했습니다. 현재 메시지 수=" + current);
        this.capacity = capacity;
        this.current = current;
    }
}
