package com.roomchat.clock;

import java.time.Clock;
import java.time.ZoneId;

import com.roomchat.room.model.Timestamp;

/* java.time.Clock 위임 구현. 운영 기본값은 Asia/Tokyo(JST) 고정 시간대. */
public class SystemRoomClock implements RoomClock {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Tokyo");

    private final Clock clock;

    public SystemRoomClock() {
        this(Clock.system(DEFAULT_ZONE));
    }

    public SystemRoomClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Timestamp now() {
        return Timestamp.ofEpochMillis(clock.millis());
    }

    @Override
    public ZoneId zone() {
        return clock.getZone();
    }
}
