package com.my.relay.domain.model;

import com.my.relay.support.TestUpdates;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueueRecordTest {

    private final QueueRecord fresh = QueueRecord.fresh(1L, TestUpdates.privateMessage(5L), Instant.EPOCH);

    @Test
    void freshRecordHasNoFailures() {
        assertThat(fresh.failureCount()).isZero();
        assertThat(fresh.abandoned()).isFalse();
        assertThat(fresh.failures()).isEmpty();
        assertThat(fresh.updateId()).isEqualTo(5L);
    }

    @Test
    void abandonsOnlyWhenBudgetReached() {
        QueueRecord once = fresh.withFailure("first", 3);
        QueueRecord twice = once.withFailure("second", 3);
        QueueRecord thrice = twice.withFailure("third", 3);

        assertThat(once.abandoned()).isFalse();
        assertThat(twice.abandoned()).isFalse();
        assertThat(thrice.abandoned()).isTrue();
        assertThat(thrice.failureCount()).isEqualTo(3);
        assertThat(thrice.failures()).containsExactly("first", "second", "third");
    }

    @Test
    void budgetOfOneAbandonsOnFirstFailure() {
        QueueRecord failed = fresh.withFailure("boom", 1);

        assertThat(failed.abandoned()).isTrue();
        assertThat(failed.failureCount()).isEqualTo(1);
    }

    @Test
    void abandonedRecordCannotFailAgain() {
        QueueRecord abandoned = fresh.withFailure("boom", 1);

        assertThrows(IllegalStateException.class, () -> abandoned.withFailure("again", 1));
    }

    @Test
    void failuresAreImmutable() {
        QueueRecord failed = fresh.withFailure("boom", 2);

        assertThrows(UnsupportedOperationException.class, () -> failed.failures().add("tamper"));
    }
}
