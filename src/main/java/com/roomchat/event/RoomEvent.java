package com.roomchat.event;

/**
 * @class RoomEvent
 * @brief 코어가 "누가 무엇을 언제 받는가" 를 결정하는 도메인 이벤트. 바이트 표현은 RoomEventRenderer 책임.
 */
public abstract class RoomEvent {

    public abstract RoomEventType getType();
}
