package com.roomchat.event;

import com.roomchat.room.model.ChatMessage;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class MessagePostedEvent extends RoomEvent {

    private final ChatMessage message;

    public MessagePostedEvent(ChatMessage message) {
        this.message = message;
    }

    @Override
    public RoomEventType getType() {
        return RoomEventType.CHAT;
    }
}
