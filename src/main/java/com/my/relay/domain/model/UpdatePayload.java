package com.my.relay.domain.model;

/**
 * 왜: 업데이트 유형별 본문을 봉인된 타입으로 묶어 리스너가 형 변환 없이 필요한 필드만 받도록 하기 위함.
 */
public sealed interface UpdatePayload
        permits MessagePayload, InlineQueryPayload, CallbackQueryPayload, ChosenInlineResultPayload, UnsupportedPayload {
}
