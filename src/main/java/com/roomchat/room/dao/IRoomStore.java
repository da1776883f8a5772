package com.roomchat.room.dao;

import java.util.List;
import java.util.Optional;

import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.MessageContent;
import com.roomchat.room.model.Participant;
import com.roomchat.room.model.RoomId;
import com.roomchat.room.model.RoomSnapshot;
import com.roomchat.room.model.Timestamp;

/**
 * @interface IRoomStore
 * @brief 단일 방의 참가자 집합과 메시지 로그를 보관하는 권위(authoritative) 저장소.
 *
 * @details
 * - "누가 방에 있는가" 의 유일한 기준. 전달 레지스트리(IDeliveryRegistry)의 등록 집합은 항상 이 참가자 집합의 부분집합이어야 한다.
 * - 모든 연산은 방 단위 배타 구간 안에서 원자적으로 수행된다. 호출자는 연산과 연산 사이의 배타성을 가정하면 안 된다.
 * - 전송(transport) 개념은 전혀 모른다.
 */
public interface IRoomStore {

    RoomId getRoomId();

    Timestamp getCreatedAt();

    /**
     * @throws com.roomchat.room.exception.DuplicateClientException 이미 참가 중
     * @throws com.roomchat.room.exception.RoomCapacityExceededException 정원 초과
     */
    Participant addParticipant(ClientId clientId, Timestamp joinedAt);

    /**
     * @return 제거된 참가자
     * @throws com.roomchat.room.exception.ParticipantNotFoundException 이미 없음(두 번째 호출 포함)
     */
    Participant removeParticipant(ClientId clientId);

    /**
     * @brief 저장된 참가자가 바로 그 인스턴스일 때만 제거(같은 clientId 로 다시 들어온 새 참가자는 보존)
     * @return 실제 제거 여부
     */
    boolean removeParticipantIfSame(Participant participant);

    /**
     * @return 로그에 저장된 메시지
     * @throws com.roomchat.room.exception.SenderNotParticipantException 발신자가 현재 참가자가 아님
     * @throws com.roomchat.room.exception.MessageCapacityExceededException 메시지 로그 한도 초과
     */
    ChatMessage appendMessage(ClientId sender, MessageContent content, Timestamp sentAt);

    /** 입장 순서의 clientId 스냅샷 */
    List<ClientId> listParticipants();

    List<Participant> getParticipants();

    Optional<Participant> findParticipant(ClientId clientId);

    boolean containsParticipant(ClientId clientId);

    int participantCount();

    List<ChatMessage> getMessages();

    RoomSnapshot snapshot();
}
