package com.roomchat.room.exception;

import com.roomchat.room.model.ClientId;

import lombok.Getter;

/* 입장 처리 도중 같은 clientId 의 퇴장이 먼저 확정되어 입장이 취소된 경우. 어느 저장소에도 흔적을 남기지 않는다. */
@Getter
public class ConnectCancelledException extends RoomChatException {

    private final ClientId clientId;

    public ConnectCancelledException(ClientId clientId) {
        super("입장 처리 중 퇴장되어 입장이 취소되었습니다: " + clientId);
        this.clientId = clientId;
    }
}
