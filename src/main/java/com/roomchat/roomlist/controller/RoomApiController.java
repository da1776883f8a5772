package com.roomchat.roomlist.controller;

import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import com.roomchat.roomlist.model.RoomDebugDTO;
import com.roomchat.roomlist.model.RoomDetailDTO;
import com.roomchat.roomlist.model.RoomSummaryDTO;
import com.roomchat.roomlist.service.IRoomQueryService;

/* 방 상태 조회용 HTTP API (헬스 체크, 방 목록, 방 상세, 디버그 스냅샷) */
@RestController
public class RoomApiController {

	private final IRoomQueryService roomQueryService;

	public RoomApiController(IRoomQueryService roomQueryService) {
		this.roomQueryService = roomQueryService;
	}

	@GetMapping("/api/health")
	public Map<String, String> health() {
		return Map.of("status", "ok");
	}

	@GetMapping("/api/rooms")
	public List<RoomSummaryDTO> rooms() {
		return roomQueryService.getRoomList();
	}

	@GetMapping("/api/rooms/{roomId}")
	public RoomDetailDTO roomDetail(@PathVariable("roomId") String roomId) {
		return roomQueryService.getRoomDetail(roomId);
	}

	@GetMapping("/debug/room")
	public RoomDebugDTO debugRoom() {
		return roomQueryService.getDefaultRoomDebug();
	}
}
