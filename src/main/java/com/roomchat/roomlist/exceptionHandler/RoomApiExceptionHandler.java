package com.roomchat.roomlist.exceptionHandler;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.roomchat.room.exception.InvalidRoomIdException;
import com.roomchat.room.exception.RoomNotFoundException;

@RestControllerAdvice(basePackages = "com.roomchat.roomlist.controller")
public class RoomApiExceptionHandler {

	private static final Logger logger = LoggerFactory.getLogger(RoomApiExceptionHandler.class);

	@ExceptionHandler(RoomNotFoundException.class)
	public ResponseEntity<Map<String, String>> handleRoomNotFound(RoomNotFoundException ex) {
		logger.info("[조회 실패] {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.NOT_FOUND)
				.body(Map.of("error", "room-not-found", "message", ex.getMessage()));
	}

	@ExceptionHandler(InvalidRoomIdException.class)
	public ResponseEntity<Map<String, String>> handleInvalidRoomId(InvalidRoomIdException ex) {
		logger.info("[조회 실패] {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.BAD_REQUEST)
				.body(Map.of("error", "invalid-room-id", "message", ex.getMessage()));
	}
}
