package com.my.relay.domain.port.out;

import com.my.relay.domain.model.CallbackQueryPayload;
import com.my.relay.domain.model.ChosenInlineResultPayload;
import com.my.relay.domain.model.InlineQueryPayload;
import com.my.relay.domain.model.MessagePayload;

/**
 * 왜: 업데이트 유형별 알림 채널을 타입이 있는 메서드로 나눠 애플리케이션 로직이 필요한 유형만 구현하게 하기 위함.
 * <p>
 * 예외를 던지면 해당 업데이트는 실패로 기록되고 재시도 예산에 따라 다시 전달되거나 포기된다.
 */
public interface UpdateListener {

    default void onPrivateMessage(long updateId, MessagePayload message) {
    }

    default void onPublicMessage(long updateId, MessagePayload message) {
    }

    default void onPrivateMessageEdited(long updateId, MessagePayload message) {
    }

    default void onPublicMessageEdited(long updateId, MessagePayload message) {
    }

    default void onChannelPost(long updateId, MessagePayload post) {
    }

    default void onChannelPostEdited(long updateId, MessagePayload post) {
    }

    default void onInlineQuery(long updateId, InlineQueryPayload query) {
    }

    default void onCallbackQuery(long updateId, CallbackQueryPayload callback) {
    }

    default void onChosenInlineResult(long updateId, ChosenInlineResultPayload result) {
    }
}
