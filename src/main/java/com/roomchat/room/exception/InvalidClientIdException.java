package com.roomchat.room.exception;

public class InvalidClientIdException extends RoomChatException {

    public InvalidClientIdException(String message) {
        super(message);
    }
}
