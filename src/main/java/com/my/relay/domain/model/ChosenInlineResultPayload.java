package com.my.relay.domain.model;

import java.util.Objects;

public record ChosenInlineResultPayload(String resultId,
                                        TelegramUser from,
                                        String query,
                                        String inlineMessageId) implements UpdatePayload {

    public ChosenInlineResultPayload {
        Objects.requireNonNull(resultId, "resultId");
        Objects.requireNonNull(from, "from");
    }
}
