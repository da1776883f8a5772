package com.roomchat.usecase;

import java.util.Collections;
import java.util.Map;

import com.roomchat.delivery.DeliveryError;
import com.roomchat.room.model.ClientId;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DisconnectResult {

    private final ClientId clientId;
    /** 이번 호출로 실제 참가자 집합이 바뀌었는지. false 면 이미 퇴장한 상태(no-op) */
    private final boolean removed;
    private final int remainingParticipants;
    private final Map<ClientId, DeliveryError> deliveryFailures;

    public DisconnectResult(ClientId clientId, boolean removed, int remainingParticipants,
                            Map<ClientId, DeliveryError> deliveryFailures) {
        this.clientId = clientId;
        this.removed = removed;
        this.remainingParticipants = remainingParticipants;
        this.deliveryFailures = Map.copyOf(deliveryFailures);
    }

    public static DisconnectResult alreadyGone(ClientId clientId, int remainingParticipants) {
        return new DisconnectResult(clientId, false, remainingParticipants, Collections.emptyMap());
    }
}
