package com.roomchat.room.model;

import com.roomchat.room.exception.InvalidClientIdException;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * @class ClientId
 * @brief 연결 단위 클라이언트 식별자(불변). 값 동등성 비교.
 *
 * @note
 * - 식별자 발급은 연결 수락자(WebSocket 핸드셰이크) 책임이며 코어는 절대 생성하지 않는다.
 * - 빈 문자열, 100자 초과 금지.
 */
@Getter
@EqualsAndHashCode
public final class ClientId implements Comparable<ClientId> {

    public static final int MAX_LENGTH = 100;

    private final String value;

    private ClientId(String value) {
        this.value = value;
    }

    public static ClientId of(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidClientIdException("clientId 는 비어 있을 수 없습니다.");
        }
        if (value.length() > MAX_LENGTH) {
            throw new InvalidClientIdException(
                    "clientId 는 " + MAX_LENGTH + "자를 초과할 수 없습니다. (입력: " + value.length() + "자)");
        }
        return new ClientId(value);
    }

    @Override
    public int compareTo(ClientId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
