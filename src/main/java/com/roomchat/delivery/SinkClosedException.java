package com.roomchat.delivery;

/* sink 가 payload 를 거부함. 재시도 없이 암묵적 퇴장 신호로 취급한다. */
public class SinkClosedException extends Exception {

    public SinkClosedException(String message) {
        super(message);
    }

    public SinkClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
