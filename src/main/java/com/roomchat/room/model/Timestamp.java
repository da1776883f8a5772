package com.roomchat.room.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import lombok.EqualsAndHashCode;

/**
 * @class Timestamp
 * @brief epoch 기준 밀리초 시각. 코어 로직 안에서는 절대 시스템 시계를 직접 읽지 않고 RoomClock 으로만 생성한다.
 */
@EqualsAndHashCode
public final class Timestamp implements Comparable<Timestamp> {

    private final long epochMillis;

    private Timestamp(long epochMillis) {
        this.epochMillis = epochMillis;
    }

    public static Timestamp ofEpochMillis(long epochMillis) {
        return new Timestamp(epochMillis);
    }

    public long toEpochMillis() {
        return epochMillis;
    }

    /** RFC 3339 문자열(초 단위, 오프셋 포함). 예) 2025-01-01T09:00:00+09:00 */
    public String toRfc3339(ZoneId zone) {
        return Instant.ofEpochMilli(epochMillis)
                .atZone(zone)
                .withNano(0)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    @Override
    public int compareTo(Timestamp other) {
        return Long.compare(epochMillis, other.epochMillis);
    }

    @Override
    public String toString() {
        return String.valueOf(epochMillis);
    }
}
