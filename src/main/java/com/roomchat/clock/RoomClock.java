package com.roomchat.clock;

import java.time.ZoneId;

import com.roomchat.room.model.Timestamp;

/**
 * @interface RoomClock
 * @brief 코어가 시각을 얻는 유일한 통로. 테스트에서는 고정/수동 시계로 교체한다.
 */
public interface RoomClock {

    Timestamp now();

    /** 시각을 사람이 읽는 문자열로 바꿀 때 쓰는 고정 시간대 */
    ZoneId zone();
}
