package com.roomchat.delivery;

/**
 * @interface DeliverySink
 * @brief 클라이언트 한 명의 전송 계층으로 텍스트 payload 하나를 밀어 넣는 capability.
 *
 * @note
 * - 구현체는 무기한 블로킹하면 안 된다(버퍼 한도, 전송 시간 한도는 구현체 책임).
 * - equals 는 객체 동일성(identity) 기준이어야 한다. 레지스트리가 "바로 이 sink" 만 조건부로 제거하는 근거.
 */
public interface DeliverySink {

    /**
     * @throws SinkClosedException 연결이 이미 닫혔거나 payload 를 거부함(레지스트리는 해당 sink 를 죽은 것으로 간주)
     */
    void deliver(String payload) throws SinkClosedException;

    /** 전송 계층 연결 생존 여부(주기적 정리 작업용) */
    boolean isOpen();
}
