package com.roomchat.usecase;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.roomchat.clock.RoomClock;
import com.roomchat.delivery.DeliveryError;
import com.roomchat.delivery.IDeliveryRegistry;
import com.roomchat.event.MessagePostedEvent;
import com.roomchat.event.RoomEventRenderer;
import com.roomchat.room.dao.IRoomStore;
import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.MessageContent;

/**
 * SendMessageUseCase
 * ──────────────────────────────────────────────────────────────
 * [메시지 전송] Connected 상태에서만 성공.
 *
 * 1. MessageContent 생성 : 상태를 건드리기 전에 검증(InvalidContentException)
 * 2. 로그 append : 동시 퇴장 race 면 SenderNotParticipantException (정상 거절)
 * 3. 대상 = 현재 참가자 - 발신자, chat 브로드캐스트
 *
 * append 는 최대 1회·영속, 전달은 best effort. 전달이 전부 실패해도 메시지는 로그에 남는다.
 */
public class SendMessageUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SendMessageUseCase.class);

    private final IRoomStore roomStore;
    private final IDeliveryRegistry deliveryRegistry;
    private final RoomEventRenderer renderer;
    private final RoomClock clock;
    private final int maxContentLength;

    public SendMessageUseCase(IRoomStore roomStore, IDeliveryRegistry deliveryRegistry,
                              RoomEventRenderer renderer, RoomClock clock) {
        this(roomStore, deliveryRegistry, renderer, clock, MessageContent.DEFAULT_MAX_LENGTH);
    }

    public SendMessageUseCase(IRoomStore roomStore, IDeliveryRegistry deliveryRegistry,
                              RoomEventRenderer renderer, RoomClock clock, int maxContentLength) {
        this.roomStore = roomStore;
        this.deliveryRegistry = deliveryRegistry;
        this.renderer = renderer;
        this.clock = clock;
        this.maxContentLength = maxContentLength;
    }

    public SendResult execute(ClientId sender, String rawText) {

        // [1] 검증
        MessageContent content = MessageContent.of(rawText, maxContentLength);

        // [2] append
        ChatMessage message = roomStore.appendMessage(sender, content, clock.now());

        // [3] 발신자 제외 브로드캐스트
        Set<ClientId> targets = roomStore.listParticipants().stream()
                .filter(id -> !id.equals(sender))
                .collect(Collectors.toSet());
        Map<ClientId, DeliveryError> failures =
                deliveryRegistry.broadcast(targets, renderer.render(new MessagePostedEvent(message)));

        if (!failures.isEmpty()) {
            logger.warn("[메시지 전달] 일부 실패: sender={}, seq={}, failures={}", sender, message.getSequence(), failures);
        }
        logger.debug("[메시지 전송] roomId={}, sender={}, seq={}, 대상 수={}",
                roomStore.getRoomId(), sender, message.getSequence(), targets.size());

        return new SendResult(message, targets, failures);
    }
}
