package com.roomchat.delivery;

public enum DeliveryError {

    /** 등록된 sink 없음(이미 퇴장했거나 한 번도 등록되지 않음) */
    UNKNOWN,

    /** sink 가 payload 를 거부함. 레지스트리에서 제거됨 */
    CLOSED
}
