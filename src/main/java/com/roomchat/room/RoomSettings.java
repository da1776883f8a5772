package com.roomchat.room;

import com.roomchat.room.dao.InMemoryRoomStore;
import com.roomchat.room.model.MessageContent;

import lombok.Getter;
import lombok.ToString;

/* 방 인스턴스 생성 정책(정원, 메시지 보관 한도, 메시지 최대 길이). */
@Getter
@ToString
public class RoomSettings {

    private final int participantCapacity;
    private final int messageCapacity;
    private final int maxContentLength;

    public RoomSettings(int participantCapacity, int messageCapacity, int maxContentLength) {
        this.participantCapacity = participantCapacity;
        this.messageCapacity = messageCapacity;
        this.maxContentLength = maxContentLength;
    }

    public static RoomSettings defaults() {
        return new RoomSettings(
                InMemoryRoomStore.DEFAULT_PARTICIPANT_CAPACITY,
                InMemoryRoomStore.DEFAULT_MESSAGE_CAPACITY,
                MessageContent.DEFAULT_MAX_LENGTH);
    }
}
