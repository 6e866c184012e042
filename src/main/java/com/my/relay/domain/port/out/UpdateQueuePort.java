package com.my.relay.domain.port.out;

import com.my.relay.domain.model.QueueRecord;
import com.my.relay.domain.model.TelegramUpdate;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 대기 중인 업데이트를 재시작 후에도 잃지 않도록 영속 큐의 최소 연산만 도메인에 노출하기 위함.
 */
public interface UpdateQueuePort {

    QueueRecord enqueue(TelegramUpdate update);

    /**
     * abandoned가 아닌 레코드 중 updateId가 가장 작은 것.
     */
    Optional<QueueRecord> findNextPending();

    void update(QueueRecord record);

    void delete(long recordId);

    List<QueueRecord> findAbandoned(int limit);

    long countPending();

    long countAbandoned();
}
