package com.my.relay.adapter.out.persistence;

import com.my.relay.domain.model.QueueRecord;
import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.port.out.AcknowledgedSequencePort;
import com.my.relay.domain.port.out.UpdateQueuePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 왜: 로컬 실행과 테스트에서 파일 없이 같은 큐 계약을 쓰기 위함. 재시작하면 내용은 사라진다.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryUpdateStore implements UpdateQueuePort, AcknowledgedSequencePort {

    private static final Comparator<QueueRecord> QUEUE_ORDER =
            Comparator.comparingLong(QueueRecord::updateId).thenComparingLong(QueueRecord::id);

    private final Map<Long, QueueRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final Object sequenceLock = new Object();
    private Long lastAcknowledged;

    @Override
    public QueueRecord enqueue(TelegramUpdate update) {
        QueueRecord record = QueueRecord.fresh(nextId.getAndIncrement(), update, Instant.now());
        records.put(record.id(), record);
        return record;
    }

    @Override
    public Optional<QueueRecord> findNextPending() {
        return records.values().stream()
                .filter(record -> !record.abandoned())
                .min(QUEUE_ORDER);
    }

    @Override
    public void update(QueueRecord record) {
        records.computeIfPresent(record.id(), (id, previous) -> record);
    }

    @Override
    public void delete(long recordId) {
        records.remove(recordId);
    }

    @Override
    public List<QueueRecord> findAbandoned(int limit) {
        return records.values().stream()
                .filter(QueueRecord::abandoned)
                .sorted(QUEUE_ORDER.reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public long countPending() {
        return records.values().stream().filter(record -> !record.abandoned()).count();
    }

    @Override
    public long countAbandoned() {
        return records.values().stream().filter(QueueRecord::abandoned).count();
    }

    @Override
    public OptionalLong lastAcknowledged() {
        synchronized (sequenceLock) {
            return lastAcknowledged == null ? OptionalLong.empty() : OptionalLong.of(lastAcknowledged);
        }
    }

    @Override
    public void acknowledge(long updateId) {
        synchronized (sequenceLock) {
            lastAcknowledged = lastAcknowledged == null ? updateId : Math.max(lastAcknowledged, updateId);
        }
    }
}
