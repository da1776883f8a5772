package com.roomchat.room.model;

import com.roomchat.room.exception.InvalidContentException;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * @class MessageContent
 * @brief 검증 완료된 메시지 본문(불변).
 *
 * @note
 * - 길이는 코드 포인트 기준으로 센다(서로게이트 쌍 이모지 1자 = 1).
 * - 공백만으로 이루어진 본문은 허용한다. 빈 문자열만 거절.
 */
@Getter
@EqualsAndHashCode
public final class MessageContent {

    public static final int DEFAULT_MAX_LENGTH = 10_000;

    private final String value;

    private MessageContent(String value) {
        this.value = value;
    }

    public static MessageContent of(String raw) {
        return of(raw, DEFAULT_MAX_LENGTH);
    }

    public static MessageContent of(String raw, int maxLength) {
        if (raw == null || raw.isEmpty()) {
            throw InvalidContentException.empty();
        }
        int length = raw.codePointCount(0, raw.length());
        if (length > maxLength) {
            throw InvalidContentException.tooLong(maxLength, length);
        }
        return new MessageContent(raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
