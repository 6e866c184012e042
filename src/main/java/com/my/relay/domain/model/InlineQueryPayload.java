package com.my.relay.domain.model;

import java.util.Objects;

public record InlineQueryPayload(String queryId, TelegramUser from, String query, String offset) implements UpdatePayload {

    public InlineQueryPayload {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(from, "from");
    }
}
