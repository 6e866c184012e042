package com.my.relay.domain.service;

import com.my.relay.domain.model.DeliveryResult;
import com.my.relay.domain.model.QueueRecord;
import com.my.relay.domain.model.QueueStatistics;
import com.my.relay.domain.port.out.AcknowledgedSequencePort;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.UpdateDispatcher;
import com.my.relay.domain.port.out.UpdateQueuePort;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 큐에 쌓인 업데이트를 순서대로 전달하고, 레코드별 실패 횟수로 재시도와 영구 포기를 결정하기 위함.
 * <p>
 * 항상 가장 작은 updateId를 고르므로 아직 포기되지 않은 실패 레코드는 뒤의 레코드를 막는다(head-of-line).
 */
public class UpdateProcessingService {

    private final UpdateQueuePort updateQueuePort;
    private final AcknowledgedSequencePort acknowledgedSequencePort;
    private final UpdateDispatcher updateDispatcher;
    private final ClockPort clockPort;
    private final int retryBudget;

    public UpdateProcessingService(UpdateQueuePort updateQueuePort,
                                   AcknowledgedSequencePort acknowledgedSequencePort,
                                   UpdateDispatcher updateDispatcher,
                                   ClockPort clockPort,
                                   int retryBudget) {
        if (retryBudget < 1) {
            throw new IllegalArgumentException("retryBudget은 1 이상이어야 합니다: " + retryBudget);
        }
        this.updateQueuePort = updateQueuePort;
        this.acknowledgedSequencePort = acknowledgedSequencePort;
        this.updateDispatcher = updateDispatcher;
        this.clockPort = clockPort;
        this.retryBudget = retryBudget;
    }

    public DeliveryResult processNext() {
        Optional<QueueRecord> next = updateQueuePort.findNextPending();
        if (next.isEmpty()) {
            return DeliveryResult.idle();
        }
        QueueRecord record = next.get();
        try {
            updateDispatcher.dispatch(record.update());
        } catch (RuntimeException e) {
            if (interrupted(e)) {
                // 종료로 중단된 전달은 실패가 아니다. 레코드를 그대로 두고 다음 실행에서 다시 전달한다.
                throw e;
            }
            return recordFailure(record, e);
        }
        // 전달 이후의 저장소 오류는 전달 실패가 아니므로 루프로 전파한다.
        updateQueuePort.delete(record.id());
        return new DeliveryResult(DeliveryResult.Status.DELIVERED, record);
    }

    public List<QueueRecord> abandonedRecords(int limit) {
        return updateQueuePort.findAbandoned(limit);
    }

    public QueueStatistics queueStatistics() {
        return new QueueStatistics(updateQueuePort.countPending(),
                updateQueuePort.countAbandoned(),
                acknowledgedSequencePort.lastAcknowledged());
    }

    public int retryBudget() {
        return retryBudget;
    }

    private static boolean interrupted(Throwable failure) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private DeliveryResult recordFailure(QueueRecord record, Exception cause) {
        String description = String.format("%s: Failed to process update %d: %s",
                clockPort.now(), record.updateId(), cause);
        QueueRecord failed = record.withFailure(description, retryBudget);
        updateQueuePort.update(failed);
        DeliveryResult.Status status = failed.abandoned()
                ? DeliveryResult.Status.ABANDONED
                : DeliveryResult.Status.RETRY_SCHEDULED;
        return new DeliveryResult(status, failed);
    }
}
