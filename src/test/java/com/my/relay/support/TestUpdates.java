package com.my.relay.support;

import com.my.relay.domain.model.CallbackQueryPayload;
import com.my.relay.domain.model.MessagePayload;
import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.model.TelegramUser;
import com.my.relay.domain.model.UpdateKind;

public final class TestUpdates {

    private TestUpdates() {
    }

    public static TelegramUpdate privateMessage(long updateId) {
        return privateMessage(updateId, "hello " + updateId);
    }

    public static TelegramUpdate privateMessage(long updateId, String text) {
        MessagePayload payload = new MessagePayload(updateId * 10, 42L, "private", null,
                new TelegramUser(7L, false, "Jin", "Park", "jin"), text, 1_700_000_000L);
        String raw = "{\"update_id\":" + updateId + ",\"message\":{\"message_id\":" + (updateId * 10)
                + ",\"chat\":{\"id\":42,\"type\":\"private\"},"
                + "\"from\":{\"id\":7,\"is_bot\":false,\"first_name\":\"Jin\",\"last_name\":\"Park\",\"username\":\"jin\"},"
                + "\"text\":\"" + text + "\",\"date\":1700000000}}";
        return new TelegramUpdate(updateId, UpdateKind.PRIVATE_MESSAGE, payload, raw);
    }

    public static TelegramUpdate callback(long updateId, String data) {
        CallbackQueryPayload payload = new CallbackQueryPayload("cb-" + updateId,
                new TelegramUser(7L, false, "Jin", null, "jin"), 42L, 99L, null, data);
        String raw = "{\"update_id\":" + updateId + ",\"callback_query\":{\"id\":\"cb-" + updateId + "\","
                + "\"from\":{\"id\":7,\"is_bot\":false,\"first_name\":\"Jin\",\"username\":\"jin\"},"
                + "\"message\":{\"message_id\":99,\"chat\":{\"id\":42,\"type\":\"private\"}},"
                + "\"data\":\"" + data + "\"}}";
        return new TelegramUpdate(updateId, UpdateKind.CALLBACK_QUERY, payload, raw);
    }
}
