package com.roomchat.room.model;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * @class RoomSnapshot
 * @brief 특정 시점 방 상태의 불변 복사본(조회 API, 디버그용). 라이브 참조가 아니다.
 */
@Getter
@ToString
public final class RoomSnapshot {

    private final RoomId roomId;
    private final Timestamp createdAt;
    /** 입장 순서 */
    private final List<Participant> participants;
    /** append 순서 */
    private final List<ChatMessage> messages;

    public RoomSnapshot(RoomId roomId, Timestamp createdAt, List<Participant> participants, List<ChatMessage> messages) {
        this.roomId = roomId;
        this.createdAt = createdAt;
        this.participants = List.copyOf(participants);
        this.messages = List.copyOf(messages);
    }
}
