package com.roomchat.room.dao;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.roomchat.room.exception.DuplicateClientException;
import com.roomchat.room.exception.MessageCapacityExceededException;
import com.roomchat.room.exception.ParticipantNotFoundException;
import com.roomchat.room.exception.RoomCapacityExceededException;
import com.roomchat.room.exception.SenderNotParticipantException;
import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.MessageContent;
import com.roomchat.room.model.Participant;
import com.roomchat.room.model.RoomId;
import com.roomchat.room.model.RoomSnapshot;
import com.roomchat.room.model.Timestamp;

/**
 * @class InMemoryRoomStore
 * @brief 메모리 기반 IRoomStore 구현. 방 하나당 인스턴스 하나.
 *
 * @details
 * - 참가자: LinkedHashMap(clientId → Participant), 입장 순서 유지 + clientId 중복 불가.
 * - 메시지: ArrayList append-only, 삭제 없음.
 * - 동시성: 단일 ReentrantLock(fair) 으로 모든 읽기/쓰기 직렬화. 조회 결과는 전부 복사본.
 */
public class InMemoryRoomStore implements IRoomStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRoomStore.class);

    public static final int DEFAULT_PARTICIPANT_CAPACITY = 10;
    public static final int DEFAULT_MESSAGE_CAPACITY = 100;

    private final RoomId roomId;
    private final Timestamp createdAt;
    private final int participantCapacity;
    private final int messageCapacity;

    private final ReentrantLock lock = new ReentrantLock(true);

    private final Map<ClientId, Participant> participants = new LinkedHashMap<>();
    private final List<ChatMessage> messages = new ArrayList<>();

    public InMemoryRoomStore(RoomId roomId, Timestamp createdAt) {
        this(roomId, createdAt, DEFAULT_PARTICIPANT_CAPACITY, DEFAULT_MESSAGE_CAPACITY);
    }

    public InMemoryRoomStore(RoomId roomId, Timestamp createdAt, int participantCapacity, int messageCapacity) {
        if (participantCapacity <= 0 || messageCapacity <= 0) {
            throw new IllegalArgumentException("capacity 는 1 이상이어야 합니다: participantCapacity="
                    + participantCapacity + ", messageCapacity=" + messageCapacity);
        }
        this.roomId = roomId;
        this.createdAt = createdAt;
        this.participantCapacity = participantCapacity;
        this.messageCapacity = messageCapacity;
    }

    @Override
    public RoomId getRoomId() {
        return roomId;
    }

    @Override
    public Timestamp getCreatedAt() {
        return createdAt;
    }

    @Override
    public Participant addParticipant(ClientId clientId, Timestamp joinedAt) {
        lock.lock();
        try {
            if (participants.containsKey(clientId)) {
                logger.warn("[addParticipant] 중복 참가 거절: roomId={}, clientId={}", roomId, clientId);
                throw new DuplicateClientException(clientId);
            }
            if (participants.size() >= participantCapacity) {
                logger.warn("[addParticipant] 정원 초과: roomId={}, capacity={}", roomId, participantCapacity);
                throw new RoomCapacityExceededException(participantCapacity, participants.size());
            }
            Participant participant = new Participant(clientId, joinedAt);
            participants.put(clientId, participant);
            logger.debug("[addParticipant] roomId={}, clientId={}, 현재 인원={}", roomId, clientId, participants.size());
            return participant;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Participant removeParticipant(ClientId clientId) {
        lock.lock();
        try {
            Participant removed = participants.remove(clientId);
            if (removed == null) {
                throw new ParticipantNotFoundException(clientId);
            }
            logger.debug("[removeParticipant] roomId={}, clientId={}, 현재 인원={}", roomId, clientId, participants.size());
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeParticipantIfSame(Participant participant) {
        lock.lock();
        try {
            ClientId clientId = participant.getClientId();
            if (participants.get(clientId) != participant) {
                return false;
            }
            participants.remove(clientId);
            logger.debug("[removeParticipantIfSame] roomId={}, clientId={}, 현재 인원={}", roomId, clientId, participants.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ChatMessage appendMessage(ClientId sender, MessageContent content, Timestamp sentAt) {
        lock.lock();
        try {
            // 발신자 자격 확인과 append 가 같은 배타 구간 안에 있어야 퇴장 race 에서도 "append 시점 참가자" 조건이 성립
            if (!participants.containsKey(sender)) {
                throw new SenderNotParticipantException(sender);
            }
            if (messages.size() >= messageCapacity) {
                logger.warn("[appendMessage] 메시지 한도 초과: roomId={}, capacity={}", roomId, messageCapacity);
                throw new MessageCapacityExceededException(messageCapacity, messages.size());
            }
            ChatMessage message = new ChatMessage(messages.size(), sender, content, sentAt);
            messages.add(message);
            return message;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ClientId> listParticipants() {
        lock.lock();
        try {
            return List.copyOf(participants.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Participant> getParticipants() {
        lock.lock();
        try {
            return List.copyOf(participants.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Participant> findParticipant(ClientId clientId) {
        lock.lock();
        try {
            return Optional.ofNullable(participants.get(clientId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean containsParticipant(ClientId clientId) {
        lock.lock();
        try {
            return participants.containsKey(clientId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int participantCount() {
        lock.lock();
        try {
            return participants.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChatMessage> getMessages() {
        lock.lock();
        try {
            return List.copyOf(messages);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RoomSnapshot snapshot() {
        lock.lock();
        try {
            return new RoomSnapshot(roomId, createdAt, new ArrayList<>(participants.values()), messages);
        } finally {
            lock.unlock();
        }
    }
}
