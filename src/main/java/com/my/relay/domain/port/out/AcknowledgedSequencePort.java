package com.my.relay.domain.port.out;

import java.util.OptionalLong;

/**
 * 왜: 조회 후 큐에 적재까지 끝난 마지막 updateId를 단일 행으로 보관해 다음 조회 offset을 결정하기 위함.
 * <p>
 * 구현체는 읽기와 쓰기를 하나의 임계 구역으로 직렬화해야 한다.
 */
public interface AcknowledgedSequencePort {

    OptionalLong lastAcknowledged();

    void acknowledge(long updateId);
}
