package com.roomchat.websocketcore.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.roomchat.clock.RoomClock;
import com.roomchat.delivery.DeliveryException;
import com.roomchat.delivery.SinkClosedException;
import com.roomchat.room.RoomContext;
import com.roomchat.room.RoomDirectory;
import com.roomchat.room.exception.ConnectCancelledException;
import com.roomchat.room.exception.DuplicateClientException;
import com.roomchat.room.exception.InvalidContentException;
import com.roomchat.room.exception.MessageCapacityExceededException;
import com.roomchat.room.exception.RoomCapacityExceededException;
import com.roomchat.room.exception.SenderNotParticipantException;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.Participant;
import com.roomchat.room.model.RoomId;
import com.roomchat.usecase.ConnectResult;
import com.roomchat.usecase.DisconnectResult;
import com.roomchat.usecase.SendResult;
import com.roomchat.websocketcore.converter.ChatFrameConverter;
import com.roomchat.websocketcore.converter.JsonRoomEventRenderer;
import com.roomchat.websocketcore.model.WebSocketDeliverySink;

/**
 * @class ChatTextWebSocketHandler
 * @brief 연결 수락자(connection acceptor). WebSocket 생명주기를 방 유스케이스 호출로 옮기는 얇은 어댑터.
 *
 * @responsibility
 * - 연결 수립: sink 생성 → Connect. 거절 시 세션 종료(중복 4409, 정원 초과 4503)
 * - 텍스트 수신: 원문 추출 → SendMessage. 거절 사유는 발신자에게만 error 프레임
 * - 연결 종료/전송 오류: Connect 에 성공한 세션만 Disconnect (최소 1회, 중복 호출 무해)
 *
 * @note 상태 일관성 규칙은 전부 유스케이스가 가진다. 이 클래스는 어떤 공유 자료구조도 직접 만지지 않는다.
 */
public class ChatTextWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LogManager.getLogger(ChatTextWebSocketHandler.class);

    public static final CloseStatus DUPLICATE_CLIENT = new CloseStatus(4409, "client_id already connected");
    public static final CloseStatus ROOM_FULL = new CloseStatus(4503, "room capacity exceeded");

    static final String ATTR_PARTICIPANT = "participant";
    static final String ATTR_SINK = "deliverySink";

    private final RoomDirectory roomDirectory;
    private final RoomClock clock;
    private final JsonRoomEventRenderer renderer;
    private final ChatFrameConverter frameConverter;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public ChatTextWebSocketHandler(RoomDirectory roomDirectory,
                                    RoomClock clock,
                                    JsonRoomEventRenderer renderer,
                                    ChatFrameConverter frameConverter,
                                    int sendTimeLimitMs,
                                    int bufferSizeLimit) {
        this.roomDirectory = roomDirectory;
        this.clock = clock;
        this.renderer = renderer;
        this.frameConverter = frameConverter;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    /**
     * @method afterConnectionEstablished
     * @brief [입장] sink 생성 → Connect. 성공 시에만 participant/sink 를 세션 attributes 에 기록(이후 퇴장 처리 근거).
     */
    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientId clientId = (ClientId) session.getAttributes().get(ChatHandShakeIntercepter.ATTR_CLIENT_ID);
        RoomId roomId = (RoomId) session.getAttributes().get(ChatHandShakeIntercepter.ATTR_ROOM_ID);
        if (clientId == null || roomId == null) {
            throw new IllegalStateException("핸드셰이크 attributes 누락: sessionId=" + session.getId());
        }

        RoomContext room = roomDirectory.get(roomId);
        WebSocketDeliverySink sink = new WebSocketDeliverySink(session, sendTimeLimitMs, bufferSizeLimit);
        logger.info("[입장] sessionId={}, clientId={}, roomId={}", session.getId(), clientId, roomId);

        try {
            ConnectResult result = room.getConnectUseCase().execute(clientId, sink, clock.now());
            session.getAttributes().put(ATTR_PARTICIPANT, result.getParticipant());
            session.getAttributes().put(ATTR_SINK, sink);
            logger.info("[입장 완료] clientId={}, 참가자 명단={}", clientId, result.rosterIds());
        } catch (DuplicateClientException e) {
            logger.warn("[입장 거절] 중복 client_id: clientId={}", clientId);
            sink.close(DUPLICATE_CLIENT);
        } catch (RoomCapacityExceededException e) {
            logger.warn("[입장 거절] 정원 초과: clientId={}, capacity={}", clientId, e.getCapacity());
            sink.close(ROOM_FULL);
        } catch (DeliveryException e) {
            logger.warn("[입장 거절] 환영 메시지 전달 실패(연결 끊김): clientId={}", clientId);
            sink.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (ConnectCancelledException e) {
            logger.warn("[입장 취소] 입장 처리 중 퇴장됨: clientId={}", clientId);
            sink.close(CloseStatus.NORMAL);
        }
    }

    /**
     * @method handleTextMessage
     * @brief [메시지] 세션의 clientId 기준으로 SendMessage. 프레임이 주장하는 발신자는 무시.
     */
    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Participant participant = (Participant) session.getAttributes().get(ATTR_PARTICIPANT);
        WebSocketDeliverySink sink = (WebSocketDeliverySink) session.getAttributes().get(ATTR_SINK);
        if (participant == null || sink == null) {
            logger.warn("[메시지 무시] 입장 처리되지 않은 세션: sessionId={}", session.getId());
            return;
        }

        ClientId sender = participant.getClientId();
        RoomContext room = roomDirectory.get((RoomId) session.getAttributes().get(ChatHandShakeIntercepter.ATTR_ROOM_ID));
        String content = frameConverter.toContent(message.getPayload());

        try {
            SendResult result = room.getSendMessageUseCase().execute(sender, content);
            logger.debug("[메시지] sender={}, seq={}, 전달 성공={}, 실패={}",
                    sender, result.getMessage().getSequence(), result.deliveredCount(), result.getDeliveryFailures().size());
        } catch (InvalidContentException e) {
            reject(sink, sender, "invalid-content", e.getMessage());
        } catch (SenderNotParticipantException e) {
            reject(sink, sender, "not-participant", e.getMessage());
        } catch (MessageCapacityExceededException e) {
            reject(sink, sender, "message-capacity-exceeded", e.getMessage());
        }
    }

    /**
     * @method afterConnectionClosed
     * @brief [퇴장] 명시적/비정상 종료 구분 없이 이 연결이 소유한 참가자만 Disconnect.
     */
    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        logger.info("[퇴장] sessionId={}, status={}", session.getId(), status);
        disconnect(session);
    }

    /**
     * @method handleTransportError
     * @brief 네트워크 오류 시에도 상태 일관성을 위해 즉시 Disconnect(이후 close 콜백이 와도 멱등).
     */
    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.error("[오류 종료] sessionId={}, 이유={}", session.getId(), exception.getMessage());
        disconnect(session);
    }

    private void disconnect(WebSocketSession session) {
        Participant participant = (Participant) session.getAttributes().get(ATTR_PARTICIPANT);
        WebSocketDeliverySink sink = (WebSocketDeliverySink) session.getAttributes().get(ATTR_SINK);
        RoomId roomId = (RoomId) session.getAttributes().get(ChatHandShakeIntercepter.ATTR_ROOM_ID);
        if (participant == null || sink == null || roomId == null) {
            // Connect 에 실패한(거절된) 세션: 정리할 상태 없음. 기존 연결을 건드리면 안 된다
            return;
        }
        roomDirectory.find(roomId).ifPresent(room -> {
            DisconnectResult result = room.getDisconnectUseCase().executeForConnection(participant, sink);
            logger.info("[퇴장 처리] clientId={}, 제거 여부={}, 남은 인원={}",
                    participant.getClientId(), result.isRemoved(), result.getRemainingParticipants());
        });
    }

    private void reject(WebSocketDeliverySink sink, ClientId sender, String reason, String message) {
        logger.warn("[메시지 거절] sender={}, reason={}, message={}", sender, reason, message);
        try {
            sink.deliver(renderer.renderError(reason, message));
        } catch (SinkClosedException e) {
            logger.debug("[메시지 거절] 오류 프레임 전달 실패(연결 끊김): sender={}", sender);
        }
    }
}
