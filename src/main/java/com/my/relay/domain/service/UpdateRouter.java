package com.my.relay.domain.service;

import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.port.out.UpdateDispatcher;
import com.my.relay.domain.port.out.UpdateListener;

import java.util.List;

/**
 * 왜: 업데이트 유형 판별을 한 번의 switch로 끝내고 등록된 모든 리스너의 해당 채널로 전달하기 위함.
 * <p>
 * 리스너 예외는 그대로 전파해 처리기가 재시도 여부를 판단한다. UNSUPPORTED는 성공으로 간주한다.
 */
public class UpdateRouter implements UpdateDispatcher {

    private final List<UpdateListener> listeners;

    public UpdateRouter(List<UpdateListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void dispatch(TelegramUpdate update) {
        for (UpdateListener listener : listeners) {
            route(listener, update);
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    private void route(UpdateListener listener, TelegramUpdate update) {
        long id = update.updateId();
        switch (update.kind()) {
            case PRIVATE_MESSAGE -> listener.onPrivateMessage(id, update.message());
            case PUBLIC_MESSAGE -> listener.onPublicMessage(id, update.message());
            case PRIVATE_MESSAGE_EDITED -> listener.onPrivateMessageEdited(id, update.message());
            case PUBLIC_MESSAGE_EDITED -> listener.onPublicMessageEdited(id, update.message());
            case CHANNEL_POST -> listener.onChannelPost(id, update.message());
            case CHANNEL_POST_EDITED -> listener.onChannelPostEdited(id, update.message());
            case INLINE_QUERY -> listener.onInlineQuery(id, update.inlineQuery());
            case CALLBACK_QUERY -> listener.onCallbackQuery(id, update.callbackQuery());
            case CHOSEN_INLINE_RESULT -> listener.onChosenInlineResult(id, update.chosenInlineResult());
            case UNSUPPORTED -> {
            }
        }
    }
}
