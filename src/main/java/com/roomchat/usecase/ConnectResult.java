package com.roomchat.usecase;

import java.util.List;
import java.util.Map;

import com.roomchat.delivery.DeliveryError;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.Participant;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ConnectResult {

    private final Participant participant;
    /** clientId 오름차순 참가자 명단(본인 포함) */
    private final List<Participant> roster;
    /** 입장 알림 전송 실패(비치명적) */
    private final Map<ClientId, DeliveryError> deliveryFailures;

    public ConnectResult(Participant participant, List<Participant> roster, Map<ClientId, DeliveryError> deliveryFailures) {
        this.participant = participant;
        this.roster = List.copyOf(roster);
        this.deliveryFailures = Map.copyOf(deliveryFailures);
    }

    public List<ClientId> rosterIds() {
        return roster.stream().map(Participant::getClientId).toList();
    }
}
