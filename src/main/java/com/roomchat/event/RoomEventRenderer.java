package com.roomchat.event;

/**
 * @interface RoomEventRenderer
 * @brief 도메인 이벤트 → sink 로 밀어 넣을 payload 문자열 변환(외부 협력자). 코어는 인코딩을 모른다.
 */
public interface RoomEventRenderer {

    String render(RoomEvent event);
}
