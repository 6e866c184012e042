package com.my.relay.domain.model;

import java.util.Objects;

/**
 * 왜: 소스가 부여한 updateId로 정렬/중복 판단을 하고, 원본 JSON을 함께 보관해 큐에 그대로 영속화하기 위함.
 */
public record TelegramUpdate(long updateId, UpdateKind kind, UpdatePayload payload, String rawJson) {

    public TelegramUpdate {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(rawJson, "rawJson");
        boolean unsupportedKind = kind == UpdateKind.UNSUPPORTED;
        if (unsupportedKind != (payload instanceof UnsupportedPayload)) {
            throw new IllegalArgumentException("kind와 payload가 일치하지 않습니다: " + kind);
        }
    }

    public MessagePayload message() {
        return payloadAs(MessagePayload.class);
    }

    public InlineQueryPayload inlineQuery() {
        return payloadAs(InlineQueryPayload.class);
    }

    public CallbackQueryPayload callbackQuery() {
        return payloadAs(CallbackQueryPayload.class);
    }

    public ChosenInlineResultPayload chosenInlineResult() {
        return payloadAs(ChosenInlineResultPayload.class);
    }

    private <T extends UpdatePayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("업데이트 " + updateId + "(" + kind + ")의 payload는 "
                    + type.getSimpleName() + "가 아닙니다.");
        }
        return type.cast(payload);
    }
}
