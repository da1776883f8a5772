package com.roomchat.roomlist.service;

import java.util.List;

import com.roomchat.roomlist.model.RoomDebugDTO;
import com.roomchat.roomlist.model.RoomDetailDTO;
import com.roomchat.roomlist.model.RoomSummaryDTO;

public interface IRoomQueryService {

	List<RoomSummaryDTO> getRoomList();

	RoomDetailDTO getRoomDetail(String roomId);

	RoomDebugDTO getDefaultRoomDebug();
}
