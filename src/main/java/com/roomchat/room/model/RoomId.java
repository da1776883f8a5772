package com.roomchat.room.model;

import java.util.UUID;

import com.roomchat.room.exception.InvalidRoomIdException;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * @class RoomId
 * @brief UUID 형식 방 식별자. 방 인스턴스 생성 시 RoomDirectory 가 발급.
 */
@Getter
@EqualsAndHashCode
public final class RoomId {

    private final String value;

    private RoomId(String value) {
        this.value = value;
    }

    public static RoomId generate() {
        return new RoomId(UUID.randomUUID().toString());
    }

    public static RoomId of(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidRoomIdException("roomId 는 비어 있을 수 없습니다.");
        }
        try {
            // 대소문자 표기 차이로 같은 방이 둘로 갈리지 않도록 정규화
            return new RoomId(UUID.fromString(value).toString());
        } catch (IllegalArgumentException e) {
            throw new InvalidRoomIdException("roomId 는 UUID 형식이어야 합니다. (입력: " + value + ")");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
