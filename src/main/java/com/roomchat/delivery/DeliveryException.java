package com.roomchat.delivery;

import com.roomchat.room.exception.RoomChatException;
import com.roomchat.room.model.ClientId;

import lombok.Getter;

@Getter
public class DeliveryException extends RoomChatException {

    private final ClientId clientId;
    private final DeliveryError error;

    public DeliveryException(ClientId clientId, DeliveryError error) {
        super("메시지 전달 실패: clientId=" + clientId + ", error=" + error);
        this.clientId = clientId;
        this.error = error;
    }

    public DeliveryException(ClientId clientId, DeliveryError error, Throwable cause) {
        super("메시지 전달 실패: clientId=" + clientId + ", error=" + error, cause);
        this.clientId = clientId;
        this.error = error;
    }
}
