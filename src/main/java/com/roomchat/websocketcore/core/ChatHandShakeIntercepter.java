package com.roomchat.websocketcore.core;

import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import com.roomchat.room.RoomContext;
import com.roomchat.room.RoomDirectory;
import com.roomchat.room.exception.InvalidClientIdException;
import com.roomchat.room.exception.InvalidRoomIdException;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.RoomId;

import jakarta.servlet.http.HttpServletRequest;

/**
 * @class ChatHandShakeIntercepter
 * @brief WebSocket 핸드셰이크 시 client_id / room_id 쿼리 파라미터를 검증하여 세션 attributes 에 주입하는 인터셉터.
 *
 * @details
 * - client_id 누락/형식 오류 → 400, room_id 형식 오류 → 400, 존재하지 않는 방 → 404
 * - 이미 접속 중인 client_id → 409 (사전 확인일 뿐이며 최종 판정은 ConnectParticipantUseCase)
 * - room_id 생략 시 기본 방
 */
public class ChatHandShakeIntercepter implements HandshakeInterceptor {

    private static final Logger logger = LogManager.getLogger(ChatHandShakeIntercepter.class);

    public static final String PARAM_CLIENT_ID = "client_id";
    public static final String PARAM_ROOM_ID = "room_id";

    public static final String ATTR_CLIENT_ID = "clientId";
    public static final String ATTR_ROOM_ID = "roomId";

    private final RoomDirectory roomDirectory;

    public ChatHandShakeIntercepter(RoomDirectory roomDirectory) {
        this.roomDirectory = roomDirectory;
    }

    /**
     * @override beforeHandshake
     * @return boolean 핸드셰이크 허용 여부(false 면 response 상태 코드로 거절 사유 전달)
     */
    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {

        // @step1: 서블릿 요청에서 쿼리 파라미터 추출
        HttpServletRequest servletRequest = ((ServletServerHttpRequest) request).getServletRequest();
        String rawClientId = servletRequest.getParameter(PARAM_CLIENT_ID);
        String rawRoomId = servletRequest.getParameter(PARAM_ROOM_ID);
        logger.info("[beforeHandshake] client_id={}, room_id={}", rawClientId, rawRoomId);

        // @step2: client_id 검증
        ClientId clientId;
        try {
            clientId = ClientId.of(rawClientId);
        } catch (InvalidClientIdException e) {
            logger.warn("[beforeHandshake] client_id 형식 오류 - 핸드셰이크 거부: {}", e.getMessage());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        // @step3: 방 결정(생략 시 기본 방)
        RoomContext room;
        try {
            Optional<RoomContext> found = (rawRoomId == null || rawRoomId.isEmpty())
                    ? Optional.of(roomDirectory.getDefaultRoom())
                    : roomDirectory.find(RoomId.of(rawRoomId));
            if (found.isEmpty()) {
                logger.warn("[beforeHandshake] 존재하지 않는 방 - 핸드셰이크 거부: room_id={}", rawRoomId);
                response.setStatusCode(HttpStatus.NOT_FOUND);
                return false;
            }
            room = found.get();
        } catch (InvalidRoomIdException e) {
            logger.warn("[beforeHandshake] room_id 형식 오류 - 핸드셰이크 거부: {}", e.getMessage());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        // @step4: 중복 접속 사전 확인
        if (room.getRoomStore().containsParticipant(clientId)) {
            logger.warn("[beforeHandshake] 이미 접속 중인 client_id - 핸드셰이크 거부: clientId={}", clientId);
            response.setStatusCode(HttpStatus.CONFLICT);
            return false;
        }

        attributes.put(ATTR_CLIENT_ID, clientId);
        attributes.put(ATTR_ROOM_ID, room.getRoomId());
        logger.info("[beforeHandshake] attributes 등록 완료: clientId={}, roomId={}", clientId, room.getRoomId());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            logger.warn("[afterHandshake] 핸드셰이크 중 예외: {}", exception.getMessage());
        }
    }
}
