package com.roomchat.usecase;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.roomchat.clock.RoomClock;
import com.roomchat.delivery.DeliveryError;
import com.roomchat.delivery.DeliverySink;
import com.roomchat.delivery.IDeliveryRegistry;
import com.roomchat.event.ParticipantLeftEvent;
import com.roomchat.event.RoomEventRenderer;
import com.roomchat.room.dao.IRoomStore;
import com.roomchat.room.exception.ParticipantNotFoundException;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.Participant;

/**
 * DisconnectParticipantUseCase
 * ──────────────────────────────────────────────────────────────
 * [퇴장 처리] Connected/Absent → Absent. 멱등: 두 번째 호출은 no-op 이며 호출자에게 예외를 던지지 않는다.
 *
 * 1. DeliveryRegistry 에서 sink 해제(없어도 무시)
 * 2. RoomStore 에서 참가자 제거(NotFound 무시: 전달 실패 evict, 전송 계층 오류 등 다른 경로로 이미 정리됐을 수 있음)
 * 3. 실제로 제거된 경우에만 남은 참가자에게 participant-left 브로드캐스트
 *
 * 해제 순서(레지스트리 → 저장소)는 입장 순서(저장소 → 레지스트리)의 역순. 어느 시점에 관찰해도 레지스트리 ⊆ 참가자 집합.
 * 1, 2 는 ConnectParticipantUseCase 와 공유하는 membershipLock 안에서 한 번에 수행한다(입장 쪽 sink 등록과 교차 불가).
 */
public class DisconnectParticipantUseCase {

    private static final Logger logger = LoggerFactory.getLogger(DisconnectParticipantUseCase.class);

    private final IRoomStore roomStore;
    private final IDeliveryRegistry deliveryRegistry;
    private final RoomEventRenderer renderer;
    private final RoomClock clock;
    private final ReentrantLock membershipLock;

    public DisconnectParticipantUseCase(IRoomStore roomStore, IDeliveryRegistry deliveryRegistry,
                                        RoomEventRenderer renderer, RoomClock clock) {
        this(roomStore, deliveryRegistry, renderer, clock, new ReentrantLock());
    }

    public DisconnectParticipantUseCase(IRoomStore roomStore, IDeliveryRegistry deliveryRegistry,
                                        RoomEventRenderer renderer, RoomClock clock, ReentrantLock membershipLock) {
        this.roomStore = roomStore;
        this.deliveryRegistry = deliveryRegistry;
        this.renderer = renderer;
        this.clock = clock;
        this.membershipLock = membershipLock;
    }

    public DisconnectResult execute(ClientId clientId) {

        membershipLock.lock();
        try {
            // [1] sink 해제
            Optional<DeliverySink> sink = deliveryRegistry.unregister(clientId);

            // [2] 참가자 제거
            try {
                roomStore.removeParticipant(clientId);
            } catch (ParticipantNotFoundException e) {
                logger.debug("[퇴장] 이미 퇴장한 참가자 → no-op: clientId={}, sink 해제 여부={}", clientId, sink.isPresent());
                return DisconnectResult.alreadyGone(clientId, roomStore.participantCount());
            }
        } finally {
            membershipLock.unlock();
        }

        // [3] 퇴장 알림
        return announceLeft(clientId);
    }

    /**
     * @brief 특정 연결이 소유한 참가자/sink 만 정리하는 퇴장 처리.
     *
     * @note 이미 정리된 옛 연결의 close 콜백이 늦게 도착해도, 같은 clientId 로 새로 들어온 연결을 내보내지 않는다.
     *       sink 는 조건부 evict, 참가자는 인스턴스 동일성 기준 조건부 제거.
     */
    public DisconnectResult executeForConnection(Participant owner, DeliverySink ownSink) {
        ClientId clientId = owner.getClientId();

        membershipLock.lock();
        try {
            deliveryRegistry.evict(clientId, ownSink);

            if (!roomStore.removeParticipantIfSame(owner)) {
                logger.debug("[퇴장] 해당 연결의 참가자가 이미 없음 → no-op: clientId={}", clientId);
                return DisconnectResult.alreadyGone(clientId, roomStore.participantCount());
            }
        } finally {
            membershipLock.unlock();
        }
        return announceLeft(clientId);
    }

    private DisconnectResult announceLeft(ClientId clientId) {
        Set<ClientId> targets = roomStore.listParticipants().stream()
                .filter(id -> !id.equals(clientId))
                .collect(Collectors.toSet());
        Map<ClientId, DeliveryError> failures =
                deliveryRegistry.broadcast(targets, renderer.render(new ParticipantLeftEvent(clientId, clock.now())));

        if (!failures.isEmpty()) {
            logger.warn("[퇴장 알림] 일부 전달 실패: clientId={}, failures={}", clientId, failures);
        }
        logger.info("[퇴장 완료] roomId={}, clientId={}, 남은 인원={}", roomStore.getRoomId(), clientId, targets.size());

        return new DisconnectResult(clientId, true, targets.size(), failures);
    }
}
