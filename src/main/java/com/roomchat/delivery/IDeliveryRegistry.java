package com.roomchat.delivery;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.roomchat.room.model.ClientId;

/**
 * @interface IDeliveryRegistry
 * @brief clientId → DeliverySink 매핑 및 fan-out. IRoomStore 와 독립적으로 일관성을 유지한다.
 */
public interface IDeliveryRegistry {

    /**
     * @throws com.roomchat.room.exception.DuplicateClientException 이미 sink 가 등록된 clientId
     */
    void register(ClientId clientId, DeliverySink sink);

    /** 등록돼 있던 sink 반환. 없으면 empty(퇴장 race 는 정상 상황이므로 오류 아님) */
    Optional<DeliverySink> unregister(ClientId clientId);

    /**
     * @throws DeliveryException UNKNOWN(미등록) 또는 CLOSED(sink 거부 → 제거됨)
     */
    void sendTo(ClientId clientId, String payload);

    /**
     * @brief 대상별로 독립 전송. 한 대상의 실패가 다른 대상 전송을 막지 않는다.
     * @return 실패한 대상만 담은 clientId → 오류 맵. 전부 성공이면 빈 맵
     */
    Map<ClientId, DeliveryError> broadcast(Collection<ClientId> targets, String payload);

    boolean isRegistered(ClientId clientId);

    Set<ClientId> registeredClientIds();

    Optional<DeliverySink> findSink(ClientId clientId);

    /**
     * @brief 주어진 sink 가 여전히 그 clientId 에 등록된 sink 일 때만 제거(신규 등록을 잘못 지우지 않기 위함)
     */
    boolean evict(ClientId clientId, DeliverySink sink);

    int size();
}
