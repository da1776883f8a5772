package com.roomchat.room.exception;

/**
 * @class RoomChatException
 * @brief 채팅방 코어(방 상태, 전달 레지스트리, 유스케이스)에서 발생하는 모든 예외의 공통 상위 타입.
 *        어떤 예외도 프로세스 전체에 치명적이지 않으며, 호출자가 복구 가능한 거절로 취급한다.
 */
public class RoomChatException extends RuntimeException {

    public RoomChatException(String message) {
        super(message);
    }

    public RoomChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
