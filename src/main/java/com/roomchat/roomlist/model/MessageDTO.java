package com.roomchat.roomlist.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageDTO {

	private long sequence;

	@JsonProperty("client_id")
	private String clientId;

	private String content;

	private long timestamp;		// epoch ms
}
