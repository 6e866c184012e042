package com.my.relay.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 큐에 적재된 업데이트와 전달 메타데이터(실패 횟수, 포기 여부, 실패 이력)를 한 단위로 다루기 위함.
 * <p>
 * 실패 횟수는 재시도 예산을 넘지 않으며, 한 번 abandoned가 되면 다시 false로 돌아가지 않는다.
 */
public record QueueRecord(long id,
                          TelegramUpdate update,
                          Instant enqueuedAt,
                          int failureCount,
                          boolean abandoned,
                          List<String> failures) {

    public QueueRecord {
        Objects.requireNonNull(update, "update");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount는 음수일 수 없습니다.");
        }
        failures = List.copyOf(failures == null ? List.of() : failures);
    }

    public static QueueRecord fresh(long id, TelegramUpdate update, Instant enqueuedAt) {
        return new QueueRecord(id, update, enqueuedAt, 0, false, List.of());
    }

    public long updateId() {
        return update.updateId();
    }

    public QueueRecord withFailure(String description, int retryBudget) {
        if (abandoned) {
            throw new IllegalStateException("이미 포기된 레코드입니다: " + id);
        }
        List<String> appended = new ArrayList<>(failures);
        appended.add(description);
        int count = failureCount + 1;
        return new QueueRecord(id, update, enqueuedAt, count, count >= retryBudget, appended);
    }
}
