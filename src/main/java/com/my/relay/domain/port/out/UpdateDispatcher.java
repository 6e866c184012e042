package com.my.relay.domain.port.out;

import com.my.relay.domain.model.TelegramUpdate;

/**
 * 왜: 큐에서 꺼낸 업데이트의 최종 전달처를 추상화해 처리기가 라우팅 세부를 모르게 하기 위함.
 * 실패는 예외로 알리며, 멱등을 가정하지 않는다.
 */
public interface UpdateDispatcher {
    void dispatch(TelegramUpdate update);
}
