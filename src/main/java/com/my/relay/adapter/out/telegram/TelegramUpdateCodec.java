package com.my.relay.adapter.out.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.domain.exception.InvalidUpdateException;
import com.my.relay.domain.model.CallbackQueryPayload;
import com.my.relay.domain.model.ChosenInlineResultPayload;
import com.my.relay.domain.model.InlineQueryPayload;
import com.my.relay.domain.model.MessagePayload;
import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.model.TelegramUser;
import com.my.relay.domain.model.UnsupportedPayload;
import com.my.relay.domain.model.UpdateKind;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Iterator;

/**
 * 왜: Bot API의 Update JSON을 도메인 업데이트로 바꾸는 규칙을 한 곳에 모아 조회와 큐 복원이 같은 판별을 쓰게 하기 위함.
 * <p>
 * 유형 판별 우선순위: callback_query, channel_post, chosen_inline_result, edited_channel_post,
 * inline_query, edited_message, message.
 */
@ApplicationScoped
public class TelegramUpdateCodec {

    private final ObjectMapper objectMapper;

    @Inject
    public TelegramUpdateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TelegramUpdate decode(String rawJson) {
        return decode(readTree(rawJson));
    }

    /**
     * 큐에서 복원할 때 사용한다. 본문을 해석할 수 없으면 {@link #unsupported(JsonNode)}로 돌려준다.
     */
    public TelegramUpdate decodeOrUnsupported(String rawJson) {
        JsonNode node = readTree(rawJson);
        try {
            return decode(node);
        } catch (InvalidUpdateException e) {
            return unsupported(node);
        }
    }

    public TelegramUpdate decode(JsonNode node) {
        requireUpdateId(node);
        long updateId = node.get("update_id").asLong();
        String raw = node.toString();
        if (node.hasNonNull("callback_query")) {
            return new TelegramUpdate(updateId, UpdateKind.CALLBACK_QUERY, callbackQuery(node.get("callback_query")), raw);
        }
        if (node.hasNonNull("channel_post")) {
            return new TelegramUpdate(updateId, UpdateKind.CHANNEL_POST, message(node.get("channel_post")), raw);
        }
        if (node.hasNonNull("chosen_inline_result")) {
            return new TelegramUpdate(updateId, UpdateKind.CHOSEN_INLINE_RESULT,
                    chosenInlineResult(node.get("chosen_inline_result")), raw);
        }
        if (node.hasNonNull("edited_channel_post")) {
            return new TelegramUpdate(updateId, UpdateKind.CHANNEL_POST_EDITED, message(node.get("edited_channel_post")), raw);
        }
        if (node.hasNonNull("inline_query")) {
            return new TelegramUpdate(updateId, UpdateKind.INLINE_QUERY, inlineQuery(node.get("inline_query")), raw);
        }
        if (node.hasNonNull("edited_message")) {
            MessagePayload edited = message(node.get("edited_message"));
            UpdateKind kind = edited.isPrivateChat() ? UpdateKind.PRIVATE_MESSAGE_EDITED : UpdateKind.PUBLIC_MESSAGE_EDITED;
            return new TelegramUpdate(updateId, kind, edited, raw);
        }
        if (node.hasNonNull("message")) {
            MessagePayload message = message(node.get("message"));
            UpdateKind kind = message.isPrivateChat() ? UpdateKind.PRIVATE_MESSAGE : UpdateKind.PUBLIC_MESSAGE;
            return new TelegramUpdate(updateId, kind, message, raw);
        }
        return new TelegramUpdate(updateId, UpdateKind.UNSUPPORTED, new UnsupportedPayload(typeOf(node)), raw);
    }

    /**
     * update_id만 읽을 수 있는 업데이트를 원본 JSON 그대로 UNSUPPORTED로 감싼다.
     */
    public TelegramUpdate unsupported(JsonNode node) {
        requireUpdateId(node);
        return new TelegramUpdate(node.get("update_id").asLong(), UpdateKind.UNSUPPORTED,
                new UnsupportedPayload(typeOf(node)), node.toString());
    }

    public boolean hasUpdateId(JsonNode node) {
        return node != null && node.isObject() && node.path("update_id").canConvertToLong();
    }

    private void requireUpdateId(JsonNode node) {
        if (!hasUpdateId(node)) {
            throw new InvalidUpdateException("update_id가 없는 업데이트입니다: " + node);
        }
    }

    private JsonNode readTree(String rawJson) {
        try {
            return objectMapper.readTree(rawJson);
        } catch (JsonProcessingException e) {
            throw new InvalidUpdateException("업데이트 JSON 파싱 실패", e);
        }
    }

    private MessagePayload message(JsonNode message) {
        JsonNode chat = message.path("chat");
        if (!chat.path("id").canConvertToLong()) {
            throw new InvalidUpdateException("chat.id가 없는 메시지입니다.");
        }
        String text = message.hasNonNull("text") ? message.get("text").asText() : textOrNull(message, "caption");
        return new MessagePayload(
                message.path("message_id").asLong(),
                chat.get("id").asLong(),
                chat.path("type").asText(""),
                textOrNull(chat, "title"),
                user(message.path("from")),
                text,
                message.path("date").asLong(0L));
    }

    private InlineQueryPayload inlineQuery(JsonNode query) {
        return new InlineQueryPayload(
                requiredText(query, "id"),
                user(query.path("from")),
                query.path("query").asText(""),
                query.path("offset").asText(""));
    }

    private CallbackQueryPayload callbackQuery(JsonNode callback) {
        JsonNode message = callback.path("message");
        Long chatId = message.path("chat").path("id").canConvertToLong() ? message.path("chat").get("id").asLong() : null;
        Long messageId = message.path("message_id").canConvertToLong() ? message.get("message_id").asLong() : null;
        return new CallbackQueryPayload(
                requiredText(callback, "id"),
                user(callback.path("from")),
                chatId,
                messageId,
                textOrNull(callback, "inline_message_id"),
                textOrNull(callback, "data"));
    }

    private ChosenInlineResultPayload chosenInlineResult(JsonNode result) {
        return new ChosenInlineResultPayload(
                requiredText(result, "result_id"),
                user(result.path("from")),
                result.path("query").asText(""),
                textOrNull(result, "inline_message_id"));
    }

    private TelegramUser user(JsonNode from) {
        if (from.isMissingNode() || from.isNull()) {
            return TelegramUser.unknown();
        }
        return new TelegramUser(
                from.path("id").asLong(),
                from.path("is_bot").asBoolean(false),
                textOrNull(from, "first_name"),
                textOrNull(from, "last_name"),
                textOrNull(from, "username"));
    }

    private String requiredText(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null) {
            throw new InvalidUpdateException(field + " 필드가 없습니다.");
        }
        return value;
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private String typeOf(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!"update_id".equals(name)) {
                return name;
            }
        }
        return "unknown";
    }
}
