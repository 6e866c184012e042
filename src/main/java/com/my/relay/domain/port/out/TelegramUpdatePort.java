package com.my.relay.domain.port.out;

import com.my.relay.domain.model.TelegramUpdate;

import java.util.List;

/**
 * 왜: 텔레그램 업데이트 조회 방법을 추상화해 폴링/웹훅 등 구현 교체 시 도메인 계약을 유지하기 위함.
 * <p>
 * 같은 offset으로 반복 호출해도 안전해야 하며, 결과는 updateId 오름차순이다.
 * 전송 실패는 {@link com.my.relay.domain.exception.UpdateFetchException}으로 알린다.
 */
public interface TelegramUpdatePort {
    List<TelegramUpdate> fetchUpdates(long offset, int limit, int timeoutSeconds);
}
