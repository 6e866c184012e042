package com.my.relay.domain.model;

import java.util.Objects;

/**
 * 왜: 인라인 키보드 콜백은 원본 메시지가 없을 수 있어(인라인 메시지) chatId/messageId를 선택값으로 둔다.
 */
public record CallbackQueryPayload(String queryId,
                                   TelegramUser from,
                                   Long chatId,
                                   Long messageId,
                                   String inlineMessageId,
                                   String data) implements UpdatePayload {

    public CallbackQueryPayload {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(from, "from");
    }
}
