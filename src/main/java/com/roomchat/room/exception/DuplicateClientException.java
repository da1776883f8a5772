package com.roomchat.room.exception;

import com.roomchat.room.model.ClientId;

import lombok.Getter;

/* 이미 방에 참가 중(혹은 전달 채널이 이미 등록된) clientId 로 다시 접속을 시도한 경우. 기존 연결은 그대로 유지하고 신규 요청만 거절한다. */
@Getter
public class DuplicateClientException extends RoomChatException {

    private final ClientId clientId;

    public DuplicateClientException(ClientId clientId) {
        super("이미 접속 중인 clientId 입니다: " + clientId);
        this.clientId = clientId;
    }
}
