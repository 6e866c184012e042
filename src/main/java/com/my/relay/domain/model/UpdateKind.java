package com.my.relay.domain.model;

/**
 * 왜: 텔레그램 업데이트 유형을 닫힌 집합으로 고정해 라우팅 분기를 단일 switch로 표현하기 위함.
 */
public enum UpdateKind {
    PRIVATE_MESSAGE,
    PUBLIC_MESSAGE,
    PRIVATE_MESSAGE_EDITED,
    PUBLIC_MESSAGE_EDITED,
    CHANNEL_POST,
    CHANNEL_POST_EDITED,
    INLINE_QUERY,
    CALLBACK_QUERY,
    CHOSEN_INLINE_RESULT,
    UNSUPPORTED
}
