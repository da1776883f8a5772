package com.roomchat.scheduler;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.roomchat.delivery.DeliverySink;
import com.roomchat.delivery.IDeliveryRegistry;
import com.roomchat.room.RoomContext;
import com.roomchat.room.RoomDirectory;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.Participant;

/**
 * [끊긴 세션 정리]
 *
 * - 전송 계층이 close 콜백 없이 사라진 연결(sink.isOpen() == false)을 주기적으로 찾아 정상 Disconnect 유스케이스로 정리
 * - 저장소를 직접 고치지 않고 항상 유스케이스를 거친다(퇴장 알림, 순서 규칙 유지)
 * - 전달 실패로 레지스트리에서 evict 된 참가자는 대상이 아님: 그 연결의 close 콜백이 Disconnect 를 책임진다
 */
@Component
public class StaleSessionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(StaleSessionSweeper.class);

    private final RoomDirectory roomDirectory;

    public StaleSessionSweeper(RoomDirectory roomDirectory) {
        this.roomDirectory = roomDirectory;
    }

    @Scheduled(fixedDelayString = "${chat.sweeper.interval-ms:30000}")
    public void sweepClosedSessions() {
        int swept = 0;
        for (RoomContext room : roomDirectory.all()) {
            try {
                swept += sweep(room);
            } catch (RuntimeException e) {
                logger.error("[sweepClosedSessions] 정리 중 예외: roomId={}", room.getRoomId(), e);
            }
        }
        if (swept > 0) {
            logger.info("[sweepClosedSessions] 끊긴 세션 정리 완료: {}건", swept);
        }
    }

    /** @return 이번에 실제로 퇴장 처리된 참가자 수 */
    public int sweep(RoomContext room) {
        IDeliveryRegistry registry = room.getDeliveryRegistry();
        int swept = 0;
        for (ClientId clientId : registry.registeredClientIds()) {
            Optional<DeliverySink> sink = registry.findSink(clientId);
            if (sink.isEmpty() || sink.get().isOpen()) {
                continue;
            }
            Optional<Participant> owner = room.getRoomStore().findParticipant(clientId);
            if (owner.isEmpty()) {
                registry.evict(clientId, sink.get());
                continue;
            }
            if (room.getDisconnectUseCase().executeForConnection(owner.get(), sink.get()).isRemoved()) {
                logger.info("[sweep] 끊긴 세션 퇴장 처리: roomId={}, clientId={}", room.getRoomId(), clientId);
                swept++;
            }
        }
        return swept;
    }
}
