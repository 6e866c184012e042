package com.my.relay.domain.model;

import java.util.Optional;

/**
 * 왜: 처리 한 사이클의 결과를 루프에 돌려줘 로그 수준과 대기 시간을 도메인 밖에서 결정하게 하기 위함.
 */
public record DeliveryResult(Status status, QueueRecord record) {

    public enum Status {
        IDLE,
        DELIVERED,
        RETRY_SCHEDULED,
        ABANDONED
    }

    public static DeliveryResult idle() {
        return new DeliveryResult(Status.IDLE, null);
    }

    public Optional<QueueRecord> recordIfAny() {
        return Optional.ofNullable(record);
    }

    public boolean failed() {
        return status == Status.RETRY_SCHEDULED || status == Status.ABANDONED;
    }

    public String lastFailure() {
        if (record == null || record.failures().isEmpty()) {
            return "";
        }
        return record.failures().get(record.failures().size() - 1);
    }
}
