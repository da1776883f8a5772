package com.roomchat.room;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.roomchat.room.exception.RoomNotFoundException;
import com.roomchat.room.model.RoomId;

/**
 * @class RoomDirectory
 * @brief 프로세스 안의 방 인스턴스 목록(roomId → RoomContext). 시작 시 기본 방 하나를 만든다.
 *
 * @details 방 간에는 어떤 상태도 공유하지 않으며, 방 간 순서 보장도 없다.
 */
public class RoomDirectory {

    private static final Logger logger = LoggerFactory.getLogger(RoomDirectory.class);

    private final RoomContextFactory factory;
    private final Map<RoomId, RoomContext> rooms = new ConcurrentHashMap<>();
    private final RoomContext defaultRoom;

    public RoomDirectory(RoomContextFactory factory) {
        this.factory = factory;
        this.defaultRoom = createRoom();
        logger.info("[RoomDirectory] 기본 방 생성: roomId={}", defaultRoom.getRoomId());
    }

    public RoomContext createRoom() {
        RoomContext context = factory.create(RoomId.generate());
        rooms.put(context.getRoomId(), context);
        return context;
    }

    public RoomContext getDefaultRoom() {
        return defaultRoom;
    }

    public Optional<RoomContext> find(RoomId roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public RoomContext get(RoomId roomId) {
        return find(roomId).orElseThrow(() -> new RoomNotFoundException(roomId.getValue()));
    }

    /** 생성 시각 순 */
    public List<RoomContext> all() {
        List<RoomContext> list = new ArrayList<>(rooms.values());
        list.sort(Comparator.comparing(context -> context.getRoomStore().getCreatedAt()));
        return list;
    }

    public int size() {
        return rooms.size();
    }
}
