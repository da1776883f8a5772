package com.roomchat.room.exception;

import com.roomchat.room.model.ClientId;

import lombok.Getter;

/* 퇴장 이후(혹은 퇴장과 동시에) 메시지를 보낸 경우. race 상황에서 정상적으로 발생 가능한 거절. */
@Getter
public class SenderNotParticipantException extends RoomChatException {

    private final ClientId sender;

    public SenderNotParticipantException(ClientId sender) {
        super("방 참가자가 아닌 사용자의 메시지입니다: " + sender);
        this.sender = sender;
    }
}
