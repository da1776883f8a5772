package com.roomchat.room.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)  // 404
public class RoomNotFoundException extends RoomChatException {

    public RoomNotFoundException(String roomId) {
        super("존재하지 않는 방입니다. roomId=" + roomId);
    }
}
