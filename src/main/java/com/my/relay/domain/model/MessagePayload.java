package com.my.relay.domain.model;

import java.util.Objects;

/**
 * 왜: 일반/수정/채널 메시지가 공유하는 본문 필드를 하나의 계약으로 고정하기 위함.
 */
public record MessagePayload(long messageId,
                             long chatId,
                             String chatType,
                             String chatTitle,
                             TelegramUser from,
                             String text,
                             long epochSeconds) implements UpdatePayload {

    public MessagePayload {
        Objects.requireNonNull(chatType, "chatType");
        Objects.requireNonNull(from, "from");
    }

    public boolean isPrivateChat() {
        return "private".equalsIgnoreCase(chatType);
    }
}
