package com.roomchat.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.roomchat.clock.RoomClock;
import com.roomchat.clock.SystemRoomClock;
import com.roomchat.room.RoomContextFactory;
import com.roomchat.room.RoomDirectory;
import com.roomchat.room.RoomSettings;
import com.roomchat.websocketcore.converter.JsonRoomEventRenderer;

/**
 * 방 코어 조립 설정
 *
 * - 시계, 렌더러, 방 생성 정책을 application.properties 값으로 구성
 * - 저장소/레지스트리 구현 선택은 RoomContextFactory 에서 이루어진다
 */
@Configuration
public class RoomChatConfig {

    @Value("${chat.clock.zone:Asia/Tokyo}")
    private String clockZone;

    @Value("${chat.room.participant-capacity:10}")
    private int participantCapacity;

    @Value("${chat.room.message-capacity:100}")
    private int messageCapacity;

    @Value("${chat.message.max-length:10000}")
    private int maxContentLength;

    @Bean
    public RoomClock roomClock() {
        return new SystemRoomClock(Clock.system(ZoneId.of(clockZone)));
    }

    @Bean
    public JsonRoomEventRenderer jsonRoomEventRenderer() {
        return new JsonRoomEventRenderer();
    }

    @Bean
    public RoomSettings roomSettings() {
        return new RoomSettings(participantCapacity, messageCapacity, maxContentLength);
    }

    @Bean
    public RoomContextFactory roomContextFactory(RoomClock roomClock, JsonRoomEventRenderer renderer, RoomSettings roomSettings) {
        return new RoomContextFactory(roomClock, renderer, roomSettings);
    }

    @Bean
    public RoomDirectory roomDirectory(RoomContextFactory roomContextFactory) {
        return new RoomDirectory(roomContextFactory);
    }
}
