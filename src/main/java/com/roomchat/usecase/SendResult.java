package com.roomchat.usecase;

import java.util.Map;
import java.util.Set;

import com.roomchat.delivery.DeliveryError;
import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.ClientId;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class SendResult {

    /** 로그에 append 된 메시지. 전달 결과와 무관하게 보존됨 */
    private final ChatMessage message;
    private final Set<ClientId> targets;
    private final Map<ClientId, DeliveryError> deliveryFailures;

    public SendResult(ChatMessage message, Set<ClientId> targets, Map<ClientId, DeliveryError> deliveryFailures) {
        this.message = message;
        this.targets = Set.copyOf(targets);
        this.deliveryFailures = Map.copyOf(deliveryFailures);
    }

    public int deliveredCount() {
        return targets.size() - deliveryFailures.size();
    }
}
