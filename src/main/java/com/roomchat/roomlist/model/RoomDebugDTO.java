package com.roomchat.roomlist.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/* /debug/room 응답. 방 전체 상태(참가자 + 메시지 로그) 스냅샷. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomDebugDTO {

	private String id;
	private List<ParticipantDetailDTO> participants;
	private List<MessageDTO> messages;

	@JsonProperty("registered_sinks")
	private int registeredSinks;

	@JsonProperty("created_at")
	private String createdAt;
}
