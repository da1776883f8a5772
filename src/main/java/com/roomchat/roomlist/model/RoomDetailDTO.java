package com.roomchat.roomlist.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomDetailDTO {

	private String id;
	private List<ParticipantDetailDTO> participants;

	@JsonProperty("created_at")
	private String createdAt;
}
