package com.roomchat.usecase;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.roomchat.delivery.DeliveryError;
import com.roomchat.delivery.DeliveryException;
import com.roomchat.delivery.DeliverySink;
import com.roomchat.delivery.IDeliveryRegistry;
import com.roomchat.delivery.SinkClosedException;
import com.roomchat.event.ParticipantJoinedEvent;
import com.roomchat.event.RoomConnectedEvent;
import com.roomchat.event.RoomEventRenderer;
import com.roomchat.room.dao.IRoomStore;
import com.roomchat.room.exception.ConnectCancelledException;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.Participant;
import com.roomchat.room.model.Timestamp;

/**
 * ConnectParticipantUseCase
 * ──────────────────────────────────────────────────────────────
 * [입장 처리] 상태 Absent → Connected 전이. 오직 Absent 에서만 가능.
 *
 * 1. RoomStore 참가자 추가 : 중복이면 DuplicateClientException (기존 세션은 건드리지 않음, 신규만 거절)
 * 2. 신규 sink 로 room-connected(명단) 직접 전달 : 레지스트리 등록 전이므로 다른 이벤트보다 항상 먼저 도착.
 *    렌더링/전달이 어떤 이유로든 실패하면 1 을 되돌리고 DeliveryException(CLOSED)
 * 3. membershipLock 안에서 "1 의 참가자가 아직 그대로 있을 때만" sink 등록 : 그 사이 퇴장이 끝났으면
 *    ConnectCancelledException, 등록 실패면 1 을 되돌리고 원래 예외 전파
 * 4. 나머지 등록 참가자에게 participant-joined 브로드캐스트 : 실패는 보고만 하고 입장 자체는 성공
 *
 * membershipLock 은 같은 방의 DisconnectParticipantUseCase 와 공유한다. 잠금 안에서는 맵 연산만 하고 sink I/O 는 하지 않는다.
 */
public class ConnectParticipantUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ConnectParticipantUseCase.class);

    private final IRoomStore roomStore;
    private final IDeliveryRegistry deliveryRegistry;
    private final RoomEventRenderer renderer;
    private final ReentrantLock membershipLock;

    public ConnectParticipantUseCase(IRoomStore roomStore, IDeliveryRegistry deliveryRegistry, RoomEventRenderer renderer) {
        this(roomStore, deliveryRegistry, renderer, new ReentrantLock());
    }

    public ConnectParticipantUseCase(IRoomStore roomStore, IDeliveryRegistry deliveryRegistry,
                                     RoomEventRenderer renderer, ReentrantLock membershipLock) {
        this.roomStore = roomStore;
        this.deliveryRegistry = deliveryRegistry;
        this.renderer = renderer;
        this.membershipLock = membershipLock;
    }

    public ConnectResult execute(ClientId clientId, DeliverySink sink, Timestamp connectedAt) {

        logger.info("[입장 요청] roomId={}, clientId={}, connectedAt={}", roomStore.getRoomId(), clientId, connectedAt);

        // [1] 참가자 등록(중복/정원 초과 시 예외, 아무 상태도 바뀌지 않음)
        Participant participant = roomStore.addParticipant(clientId, connectedAt);

        // [2] 명단 계산 + 본인에게 환영 payload
        List<Participant> roster = sortedRoster();
        try {
            sink.deliver(renderer.render(new RoomConnectedEvent(roster)));
        } catch (SinkClosedException | RuntimeException e) {
            rollback(participant);
            logger.warn("[입장 취소] 환영 메시지 전달 실패 → 참가자 롤백: clientId={}, 이유={}", clientId, e.toString());
            throw new DeliveryException(clientId, DeliveryError.CLOSED, e);
        }

        // [3] 참가자가 그대로 남아 있을 때만 sink 등록
        registerIfStillPresent(participant, sink);

        // [4] 입장 알림(본인 제외, 현재 sink 등록된 참가자 대상)
        Set<ClientId> targets = deliveryRegistry.registeredClientIds().stream()
                .filter(id -> !id.equals(clientId))
                .collect(Collectors.toSet());
        Map<ClientId, DeliveryError> failures =
                deliveryRegistry.broadcast(targets, renderer.render(new ParticipantJoinedEvent(participant)));

        if (!failures.isEmpty()) {
            logger.warn("[입장 알림] 일부 전달 실패: clientId={}, failures={}", clientId, failures);
        }
        logger.info("[입장 완료] roomId={}, clientId={}, 현재 인원={}", roomStore.getRoomId(), clientId, roster.size());

        return new ConnectResult(participant, roster, failures);
    }

    private void registerIfStillPresent(Participant participant, DeliverySink sink) {
        ClientId clientId = participant.getClientId();
        membershipLock.lock();
        try {
            // 환영 전달 중 같은 clientId 의 퇴장이 먼저 끝났다면 등록하지 않는다(레지스트리 ⊆ 참가자 유지)
            if (roomStore.findParticipant(clientId).orElse(null) != participant) {
                logger.warn("[입장 취소] 등록 전에 이미 퇴장 처리됨: clientId={}", clientId);
                throw new ConnectCancelledException(clientId);
            }
            try {
                deliveryRegistry.register(clientId, sink);
            } catch (RuntimeException e) {
                rollback(participant);
                logger.warn("[입장 취소] sink 등록 실패 → 참가자 롤백: clientId={}, 이유={}", clientId, e.getMessage());
                throw e;
            }
        } finally {
            membershipLock.unlock();
        }
    }

    private List<Participant> sortedRoster() {
        return roomStore.getParticipants().stream()
                .sorted(Comparator.comparing(Participant::getClientId))
                .toList();
    }

    private void rollback(Participant participant) {
        // 다른 경로에서 이미 제거됐다면 되돌릴 것이 없으므로 목표 상태(Absent)와 같다
        if (!roomStore.removeParticipantIfSame(participant)) {
            logger.debug("[롤백] 이미 제거된 참가자: clientId={}", participant.getClientId());
        }
    }
}
