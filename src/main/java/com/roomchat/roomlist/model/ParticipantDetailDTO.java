package com.roomchat.roomlist.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantDetailDTO {

	@JsonProperty("client_id")
	private String clientId;

	@JsonProperty("connected_at")
	private String connectedAt;
}
