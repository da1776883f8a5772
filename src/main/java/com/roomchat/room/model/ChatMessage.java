package com.roomchat.room.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * @class ChatMessage
 * @brief 방 메시지 로그에 append 된 메시지(불변). 로그에서 절대 삭제되지 않는다.
 *
 * @field sequence 로그 내 0 부터 시작하는 append 순번. 삽입 순서 = 시간 순서.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ChatMessage {

    private final long sequence;
    private final ClientId sender;
    private final MessageContent content;
    private final Timestamp sentAt;

    public ChatMessage(long sequence, ClientId sender, MessageContent content, Timestamp sentAt) {
        this.sequence = sequence;
        this.sender = sender;
        this.content = content;
        this.sentAt = sentAt;
    }
}
