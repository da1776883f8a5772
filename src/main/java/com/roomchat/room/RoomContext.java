package com.roomchat.room;

import com.roomchat.delivery.IDeliveryRegistry;
import com.roomchat.room.dao.IRoomStore;
import com.roomchat.room.model.RoomId;
import com.roomchat.usecase.ConnectParticipantUseCase;
import com.roomchat.usecase.DisconnectParticipantUseCase;
import com.roomchat.usecase.SendMessageUseCase;

import lombok.Getter;

/**
 * @class RoomContext
 * @brief 방 하나의 공유 상태(RoomStore + DeliveryRegistry)와 그 상태를 다루는 유스케이스 묶음.
 *
 * @note 전역 싱글턴이 아니라 명시적으로 소유·주입되는 인스턴스. 같은 프로세스 안의 방들은 서로 완전히 독립.
 */
@Getter
public class RoomContext {

    private final IRoomStore roomStore;
    private final IDeliveryRegistry deliveryRegistry;
    private final ConnectParticipantUseCase connectUseCase;
    private final SendMessageUseCase sendMessageUseCase;
    private final DisconnectParticipantUseCase disconnectUseCase;

    public RoomContext(IRoomStore roomStore,
                       IDeliveryRegistry deliveryRegistry,
                       ConnectParticipantUseCase connectUseCase,
                       SendMessageUseCase sendMessageUseCase,
                       DisconnectParticipantUseCase disconnectUseCase) {
        this.roomStore = roomStore;
        this.deliveryRegistry = deliveryRegistry;
        this.connectUseCase = connectUseCase;
        this.sendMessageUseCase = sendMessageUseCase;
        this.disconnectUseCase = disconnectUseCase;
    }

    public RoomId getRoomId() {
        return roomStore.getRoomId();
    }
}
