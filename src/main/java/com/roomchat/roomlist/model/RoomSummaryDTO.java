package com.roomchat.roomlist.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomSummaryDTO {

	private String id;
	private List<String> participants;		// clientId 목록(입장 순)

	@JsonProperty("created_at")
	private String createdAt;				// RFC 3339
}
