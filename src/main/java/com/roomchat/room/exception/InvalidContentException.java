package com.roomchat.room.exception;

import lombok.Getter;

/* 메시지 본문 검증 실패(빈 문자열 또는 길이 초과). */
@Getter
public class InvalidContentException extends RoomChatException {

    private final int maxLength;
    private final int actualLength;

    private InvalidContentException(String message, int maxLength, int actualLength) {
        super(message);
        this.maxLength = maxLength;
        this.actualLength = actualLength;
    }

    public static InvalidContentException empty() {
        return new InvalidContentException("메시지 내용이 비어 있습니다.", 0, 0);
    }

    public static InvalidContentException tooLong(int maxLength, int actualLength) {
        return new InvalidContentException(
                "메시지 내용은 " + maxLength + "자를 초과할 수 없습니다. (입력: " + actualLength + "자)",
                maxLength, actualLength);
    }

    public boolean isEmptyContent() {
        return actualLength == 0;
    }
}
