package com.roomchat.room.exception;

import com.roomchat.room.model.ClientId;

import lombok.Getter;

/* 퇴장 처리 대상이 이미 방에 없음. 호출자는 "이미 나감" 으로 간주해야 하며 치명적 오류가 아니다. */
@Getter
public class ParticipantNotFoundException extends RoomChatException {

    private final ClientId clientId;

    public ParticipantNotFoundException(ClientId clientId) {
        super("방에 존재하지 않는 참가자입니다: " + clientId);
        this.clientId = clientId;
    }
}
