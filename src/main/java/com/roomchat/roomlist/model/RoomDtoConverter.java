package com.roomchat.roomlist.model;

import java.time.ZoneId;
import java.util.List;

import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.Participant;
import com.roomchat.room.model.RoomSnapshot;

/**
 * @class RoomDtoConverter
 * @brief RoomSnapshot → 조회 API DTO 변환 전용 클래스. 시각은 고정 시간대 RFC 3339 문자열로 변환.
 */
public class RoomDtoConverter {

    private final ZoneId zone;

    public RoomDtoConverter(ZoneId zone) {
        this.zone = zone;
    }

    // RoomSnapshot → RoomSummaryDTO
    public RoomSummaryDTO toSummary(RoomSnapshot snapshot) {
        return new RoomSummaryDTO(
                snapshot.getRoomId().getValue(),
                snapshot.getParticipants().stream()
                        .map(participant -> participant.getClientId().getValue())
                        .toList(),
                snapshot.getCreatedAt().toRfc3339(zone));
    }

    // RoomSnapshot → RoomDetailDTO
    public RoomDetailDTO toDetail(RoomSnapshot snapshot) {
        return new RoomDetailDTO(
                snapshot.getRoomId().getValue(),
                toParticipantDtoList(snapshot.getParticipants()),
                snapshot.getCreatedAt().toRfc3339(zone));
    }

    // RoomSnapshot → RoomDebugDTO
    public RoomDebugDTO toDebug(RoomSnapshot snapshot, int registeredSinks) {
        return new RoomDebugDTO(
                snapshot.getRoomId().getValue(),
                toParticipantDtoList(snapshot.getParticipants()),
                snapshot.getMessages().stream().map(this::toMessageDto).toList(),
                registeredSinks,
                snapshot.getCreatedAt().toRfc3339(zone));
    }

    private List<ParticipantDetailDTO> toParticipantDtoList(List<Participant> participants) {
        return participants.stream()
                .map(participant -> new ParticipantDetailDTO(
                        participant.getClientId().getValue(),
                        participant.getJoinedAt().toRfc3339(zone)))
                .toList();
    }

    private MessageDTO toMessageDto(ChatMessage message) {
        return new MessageDTO(
                message.getSequence(),
                message.getSender().getValue(),
                message.getContent().getValue(),
                message.getSentAt().toEpochMillis());
    }
}
