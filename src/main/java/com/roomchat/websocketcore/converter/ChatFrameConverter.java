package com.roomchat.websocketcore.converter;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * @class ChatFrameConverter
 * @brief 수신 텍스트 프레임 → 메시지 원문 추출.
 *
 * @note
 * - JSON 객체이고 "content" 문자열 필드가 있으면 그 값을 사용. 그 외 필드(client_id 등)는 무시한다.
 *   발신자 식별은 항상 세션 기준이며 프레임이 주장하는 값을 믿지 않는다.
 * - JSON 이 아니거나 content 가 없으면 프레임 전체를 원문으로 취급.
 */
public class ChatFrameConverter {

    public String toContent(String frame) {
        if (frame == null) {
            return "";
        }
        String trimmed = frame.trim();
        if (!trimmed.startsWith("{")) {
            return frame;
        }
        try {
            JSONObject json = new JSONObject(trimmed);
            Object content = json.opt("content");
            if (content instanceof String) {
                return (String) content;
            }
            return frame;
        } catch (JSONException e) {
            return frame;
        }
    }
}
