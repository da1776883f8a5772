package com.roomchat.websocketcore.core;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.roomchat.clock.RoomClock;
import com.roomchat.room.RoomDirectory;
import com.roomchat.websocketcore.converter.ChatFrameConverter;
import com.roomchat.websocketcore.converter.JsonRoomEventRenderer;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RoomDirectory roomDirectory;
    private final RoomClock roomClock;
    private final JsonRoomEventRenderer renderer;

    @Value("${chat.websocket.path:/ws}")
    private String path;

    @Value("${chat.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${chat.websocket.send-time-limit-ms:5000}")
    private int sendTimeLimitMs;

    @Value("${chat.websocket.buffer-size-limit:524288}")
    private int bufferSizeLimit;

    public WebSocketConfig(RoomDirectory roomDirectory, RoomClock roomClock, JsonRoomEventRenderer renderer) {
        this.roomDirectory = roomDirectory;
        this.roomClock = roomClock;
        this.renderer = renderer;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatTextWebSocketHandler(), path)
                .addInterceptors(chatHandShakeIntercepter())
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Bean
    public ChatTextWebSocketHandler chatTextWebSocketHandler() {
        return new ChatTextWebSocketHandler(roomDirectory, roomClock, renderer, new ChatFrameConverter(),
                sendTimeLimitMs, bufferSizeLimit);
    }

    @Bean
    public ChatHandShakeIntercepter chatHandShakeIntercepter() {
        return new ChatHandShakeIntercepter(roomDirectory);
    }
}
