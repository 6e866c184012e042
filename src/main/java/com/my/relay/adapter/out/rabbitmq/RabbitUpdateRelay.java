package com.my.relay.adapter.out.rabbitmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.config.AppConfig;
import com.my.relay.domain.exception.UpdateDispatchException;
import com.my.relay.domain.model.CallbackQueryPayload;
import com.my.relay.domain.model.ChosenInlineResultPayload;
import com.my.relay.domain.model.InlineQueryPayload;
import com.my.relay.domain.model.MessagePayload;
import com.my.relay.domain.model.UpdateKind;
import com.my.relay.domain.model.UpdatePayload;
import com.my.relay.domain.port.out.UpdateListener;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 왜: 전달된 업데이트를 RabbitMQ로 내보내는 드리븐 어댑터를 분리해 후속 소비자(명령 해석 등)와 전달 경로를 명확히 하기 위함.
 * <p>
 * 브로커 확인을 기다려 nack/타임아웃이면 예외를 던지므로 처리기의 재시도 예산이 적용된다.
 */
@ApplicationScoped
public class RabbitUpdateRelay implements UpdateListener {

    private static final Logger log = Logger.getLogger(RabbitUpdateRelay.class);

    private final Emitter<String> emitter;
    private final ObjectMapper objectMapper;
    private final int sendTimeoutSeconds;

    @Inject
    public RabbitUpdateRelay(@Channel("telegram-incoming") Emitter<String> emitter,
                             ObjectMapper objectMapper,
                             AppConfig appConfig) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
        this.sendTimeoutSeconds = appConfig.relay().sendTimeoutSeconds();
    }

    @Override
    public void onPrivateMessage(long updateId, MessagePayload message) {
        publish(updateId, UpdateKind.PRIVATE_MESSAGE, message);
    }

    @Override
    public void onPublicMessage(long updateId, MessagePayload message) {
        publish(updateId, UpdateKind.PUBLIC_MESSAGE, message);
    }

    @Override
    public void onPrivateMessageEdited(long updateId, MessagePayload message) {
        publish(updateId, UpdateKind.PRIVATE_MESSAGE_EDITED, message);
    }

    @Override
    public void onPublicMessageEdited(long updateId, MessagePayload message) {
        publish(updateId, UpdateKind.PUBLIC_MESSAGE_EDITED, message);
    }

    @Override
    public void onChannelPost(long updateId, MessagePayload post) {
        publish(updateId, UpdateKind.CHANNEL_POST, post);
    }

    @Override
    public void onChannelPostEdited(long updateId, MessagePayload post) {
        publish(updateId, UpdateKind.CHANNEL_POST_EDITED, post);
    }

    @Override
    public void onInlineQuery(long updateId, InlineQueryPayload query) {
        publish(updateId, UpdateKind.INLINE_QUERY, query);
    }

    @Override
    public void onCallbackQuery(long updateId, CallbackQueryPayload callback) {
        publish(updateId, UpdateKind.CALLBACK_QUERY, callback);
    }

    @Override
    public void onChosenInlineResult(long updateId, ChosenInlineResultPayload result) {
        publish(updateId, UpdateKind.CHOSEN_INLINE_RESULT, result);
    }

    private void publish(long updateId, UpdateKind kind, UpdatePayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new OutgoingPayload(updateId, kind, payload));
        } catch (JsonProcessingException e) {
            throw new UpdateDispatchException("업데이트 직렬화 실패 updateId=" + updateId, e);
        }
        try {
            emitter.send(body).toCompletableFuture().get(sendTimeoutSeconds, TimeUnit.SECONDS);
            log.debugf("업데이트 %d(%s)를 RabbitMQ로 전달했습니다.", updateId, kind);
        } catch (ExecutionException e) {
            throw new UpdateDispatchException("RabbitMQ 전달 실패 updateId=" + updateId, e.getCause());
        } catch (TimeoutException e) {
            throw new UpdateDispatchException("RabbitMQ 전달 확인 대기 시간 초과 updateId=" + updateId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpdateDispatchException("RabbitMQ 전달 대기가 중단되었습니다 updateId=" + updateId, e);
        }
    }

    private record OutgoingPayload(long updateId, UpdateKind kind, UpdatePayload payload) {
    }
}
