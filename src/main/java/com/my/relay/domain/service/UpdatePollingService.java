package com.my.relay.domain.service;

import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.port.out.AcknowledgedSequencePort;
import com.my.relay.domain.port.out.TelegramUpdatePort;
import com.my.relay.domain.port.out.UpdateQueuePort;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;

/**
 * 왜: 텔레그램 업데이트 조회와 큐 적재, 확인 시퀀스 전진을 도메인 계층에서 조율해 누락을 방지하기 위함.
 * <p>
 * 확인 시퀀스는 해당 업데이트들이 모두 큐에 커밋된 뒤에만 전진한다. 그 사이에 실패하면 다음 주기에
 * 같은 offset으로 다시 조회해 중복 적재될 수 있지만 건너뛰지는 않는다.
 */
public class UpdatePollingService {

    /**
     * 확인된 업데이트가 없을 때의 offset. 0 이하는 조회 시 생략되어 확인되지 않은 모든 업데이트를 받는다.
     */
    public static final long INITIAL_OFFSET = 0L;

    private final TelegramUpdatePort telegramUpdatePort;
    private final UpdateQueuePort updateQueuePort;
    private final AcknowledgedSequencePort acknowledgedSequencePort;
    private final int fetchLimit;
    private final int timeoutSeconds;

    public UpdatePollingService(TelegramUpdatePort telegramUpdatePort,
                                UpdateQueuePort updateQueuePort,
                                AcknowledgedSequencePort acknowledgedSequencePort,
                                int fetchLimit,
                                int timeoutSeconds) {
        this.telegramUpdatePort = telegramUpdatePort;
        this.updateQueuePort = updateQueuePort;
        this.acknowledgedSequencePort = acknowledgedSequencePort;
        this.fetchLimit = fetchLimit;
        this.timeoutSeconds = timeoutSeconds;
    }

    public long nextOffset() {
        OptionalLong acknowledged = acknowledgedSequencePort.lastAcknowledged();
        return acknowledged.isPresent() ? acknowledged.getAsLong() + 1 : INITIAL_OFFSET;
    }

    /**
     * @return 이번 주기에 큐에 적재한 업데이트 수
     */
    public int fetchAndEnqueue() {
        List<TelegramUpdate> updates = telegramUpdatePort.fetchUpdates(nextOffset(), fetchLimit, timeoutSeconds)
                .stream()
                .sorted(Comparator.comparingLong(TelegramUpdate::updateId))
                .toList();
        if (updates.isEmpty()) {
            return 0;
        }
        for (TelegramUpdate update : updates) {
            updateQueuePort.enqueue(update);
        }
        acknowledgedSequencePort.acknowledge(updates.get(updates.size() - 1).updateId());
        return updates.size();
    }
}
