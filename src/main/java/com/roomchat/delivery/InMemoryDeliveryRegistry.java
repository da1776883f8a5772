package com.roomchat.delivery;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.roomchat.room.exception.DuplicateClientException;
import com.roomchat.room.model.ClientId;

/**
 * @class InMemoryDeliveryRegistry
 * @brief ConcurrentHashMap 기반 전달 레지스트리. 방 하나당 인스턴스 하나.
 *
 * @details
 * - 등록/해제/조회는 각각 ConcurrentHashMap 의 원자 연산 하나(putIfAbsent, remove, get)로 끝난다.
 * - 실제 sink 쓰기는 맵 연산이 끝난 뒤(어떤 잠금도 쥐지 않은 상태)에서 수행 → 느린 클라이언트가 방 전체를 막지 않음.
 * - CLOSED 시 remove(key, value) 조건부 제거: 그 사이 같은 clientId 로 새로 등록된 sink 는 건드리지 않는다.
 */
public class InMemoryDeliveryRegistry implements IDeliveryRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDeliveryRegistry.class);

    private final Map<ClientId, DeliverySink> sinks = new ConcurrentHashMap<>();

    @Override
    public void register(ClientId clientId, DeliverySink sink) {
        DeliverySink previous = sinks.putIfAbsent(clientId, sink);
        if (previous != null) {
            logger.warn("[register] 이미 sink 등록된 clientId: {}", clientId);
            throw new DuplicateClientException(clientId);
        }
        logger.debug("[register] clientId={}, 등록 sink 수={}", clientId, sinks.size());
    }

    @Override
    public Optional<DeliverySink> unregister(ClientId clientId) {
        DeliverySink removed = sinks.remove(clientId);
        logger.debug("[unregister] clientId={}, 제거 여부={}", clientId, removed != null);
        return Optional.ofNullable(removed);
    }

    @Override
    public void sendTo(ClientId clientId, String payload) {
        DeliverySink sink = sinks.get(clientId);
        if (sink == null) {
            throw new DeliveryException(clientId, DeliveryError.UNKNOWN);
        }
        try {
            sink.deliver(payload);
        } catch (SinkClosedException e) {
            evict(clientId, sink);
            logger.warn("[sendTo] sink 거부 → 레지스트리에서 제거: clientId={}, 이유={}", clientId, e.getMessage());
            throw new DeliveryException(clientId, DeliveryError.CLOSED, e);
        } catch (RuntimeException e) {
            // 구현체 버그 등 예상 밖 실패도 죽은 sink 로 간주(재시도 없음)
            evict(clientId, sink);
            logger.error("[sendTo] sink 예외 → 레지스트리에서 제거: clientId={}", clientId, e);
            throw new DeliveryException(clientId, DeliveryError.CLOSED, e);
        }
    }

    @Override
    public Map<ClientId, DeliveryError> broadcast(Collection<ClientId> targets, String payload) {
        if (targets.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<ClientId, DeliveryError> failures = new LinkedHashMap<>();
        int sendCount = 0;
        for (ClientId target : targets) {
            try {
                sendTo(target, payload);
                sendCount++;
            } catch (DeliveryException e) {
                failures.put(target, e.getError());
            }
        }
        logger.debug("[broadcast] 대상 수={}, 전송 성공={}, 실패={}", targets.size(), sendCount, failures.size());
        return failures;
    }

    @Override
    public boolean isRegistered(ClientId clientId) {
        return sinks.containsKey(clientId);
    }

    @Override
    public Set<ClientId> registeredClientIds() {
        return Set.copyOf(sinks.keySet());
    }

    @Override
    public Optional<DeliverySink> findSink(ClientId clientId) {
        return Optional.ofNullable(sinks.get(clientId));
    }

    @Override
    public boolean evict(ClientId clientId, DeliverySink sink) {
        return sinks.remove(clientId, sink);
    }

    @Override
    public int size() {
        return sinks.size();
    }
}
