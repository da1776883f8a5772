package com.roomchat.room;

import java.util.concurrent.locks.ReentrantLock;

import com.roomchat.clock.RoomClock;
import com.roomchat.delivery.IDeliveryRegistry;
import com.roomchat.delivery.InMemoryDeliveryRegistry;
import com.roomchat.event.RoomEventRenderer;
import com.roomchat.room.dao.IRoomStore;
import com.roomchat.room.dao.InMemoryRoomStore;
import com.roomchat.room.model.RoomId;
import com.roomchat.usecase.ConnectParticipantUseCase;
import com.roomchat.usecase.DisconnectParticipantUseCase;
import com.roomchat.usecase.SendMessageUseCase;

/**
 * @class RoomContextFactory
 * @brief 조립 시점에 저장소/레지스트리 구현체를 고르는 지점. 유스케이스 로직은 구현체 선택과 무관.
 *
 * @note 현재는 메모리 구현만 존재. 다른 구현(예: 메시지 브로커 기반 레지스트리)은 이 클래스를 확장해 교체한다.
 */
public class RoomContextFactory {

    private final RoomClock clock;
    private final RoomEventRenderer renderer;
    private final RoomSettings settings;

    public RoomContextFactory(RoomClock clock, RoomEventRenderer renderer, RoomSettings settings) {
        this.clock = clock;
        this.renderer = renderer;
        this.settings = settings;
    }

    public RoomContext create(RoomId roomId) {
        IRoomStore roomStore = createRoomStore(roomId);
        IDeliveryRegistry deliveryRegistry = createDeliveryRegistry();
        // 입장 등록과 퇴장 해제를 직렬화하는 방 단위 잠금(Connect/Disconnect 공유)
        ReentrantLock membershipLock = new ReentrantLock();
        return new RoomContext(
                roomStore,
                deliveryRegistry,
                new ConnectParticipantUseCase(roomStore, deliveryRegistry, renderer, membershipLock),
                new SendMessageUseCase(roomStore, deliveryRegistry, renderer, clock, settings.getMaxContentLength()),
                new DisconnectParticipantUseCase(roomStore, deliveryRegistry, renderer, clock, membershipLock));
    }

    protected IRoomStore createRoomStore(RoomId roomId) {
        return new InMemoryRoomStore(roomId, clock.now(),
                settings.getParticipantCapacity(), settings.getMessageCapacity());
    }

    protected IDeliveryRegistry createDeliveryRegistry() {
        return new InMemoryDeliveryRegistry();
    }
}
