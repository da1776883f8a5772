package com.roomchat.websocketcore.model;

import java.io.IOException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import com.roomchat.delivery.DeliverySink;
import com.roomchat.delivery.SinkClosedException;

/**
 * @class WebSocketDeliverySink
 * @brief WebSocketSession 하나를 DeliverySink 로 감싼 전송 어댑터.
 *
 * @details
 * - ConcurrentWebSocketSessionDecorator 로 감싸 여러 브로드캐스트 스레드의 동시 send 를 직렬화하고,
 *   전송 시간/버퍼 한도를 넘으면 세션을 종료(TERMINATE) → 느린 클라이언트가 브로드캐스트 스레드를 붙잡지 못함.
 * - 한도 초과, IOException, 닫힌 세션은 모두 SinkClosedException 으로 변환.
 */
public class WebSocketDeliverySink implements DeliverySink {

    private static final Logger logger = LogManager.getLogger(WebSocketDeliverySink.class);

    private final WebSocketSession session;

    public WebSocketDeliverySink(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    }

    @Override
    public void deliver(String payload) throws SinkClosedException {
        if (!session.isOpen()) {
            throw new SinkClosedException("세션이 이미 닫혔습니다. sessionId=" + session.getId());
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (SessionLimitExceededException e) {
            logger.warn("[deliver] 전송 한도 초과로 세션 종료: sessionId={}, 이유={}", session.getId(), e.getMessage());
            close(e.getStatus());
            throw new SinkClosedException("전송 한도 초과: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SinkClosedException("전송 실패: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    /* 중복 접속, 정원 초과 등 입장 거절 시 사용. 이미 닫힌 세션이면 무시. */
    public void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            logger.warn("[close] 세션 종료 실패: sessionId={}, status={}, 이유={}", session.getId(), status, e.getMessage());
        }
    }

    public String getSessionId() {
        return session.getId();
    }

    @Override
    public String toString() {
        return "WebSocketDeliverySink{sessionId=" + session.getId() + "}";
    }
}
