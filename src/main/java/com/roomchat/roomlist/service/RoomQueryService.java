package com.roomchat.roomlist.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.roomchat.clock.RoomClock;
import com.roomchat.room.RoomContext;
import com.roomchat.room.RoomDirectory;
import com.roomchat.room.model.RoomId;
import com.roomchat.roomlist.model.RoomDebugDTO;
import com.roomchat.roomlist.model.RoomDetailDTO;
import com.roomchat.roomlist.model.RoomDtoConverter;
import com.roomchat.roomlist.model.RoomSummaryDTO;

/* 읽기 전용 조회. 방 상태는 항상 스냅샷으로만 읽는다. */
@Service
public class RoomQueryService implements IRoomQueryService {

	private final RoomDirectory roomDirectory;
	private final RoomDtoConverter converter;

	public RoomQueryService(RoomDirectory roomDirectory, RoomClock roomClock) {
		this.roomDirectory = roomDirectory;
		this.converter = new RoomDtoConverter(roomClock.zone());
	}

	@Override
	public List<RoomSummaryDTO> getRoomList() {
		return roomDirectory.all().stream()
				.map(room -> converter.toSummary(room.getRoomStore().snapshot()))
				.toList();
	}

	@Override
	public RoomDetailDTO getRoomDetail(String roomId) {
		// 형식 오류(InvalidRoomIdException → 400), 미존재(RoomNotFoundException → 404)
		RoomContext room = roomDirectory.get(RoomId.of(roomId));
		return converter.toDetail(room.getRoomStore().snapshot());
	}

	@Override
	public RoomDebugDTO getDefaultRoomDebug() {
		RoomContext room = roomDirectory.getDefaultRoom();
		return converter.toDebug(room.getRoomStore().snapshot(), room.getDeliveryRegistry().size());
	}
}
