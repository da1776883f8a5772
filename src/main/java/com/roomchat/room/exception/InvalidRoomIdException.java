package com.roomchat.room.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidRoomIdException extends RoomChatException {

    public InvalidRoomIdException(String message) {
        super(message);
    }
}
