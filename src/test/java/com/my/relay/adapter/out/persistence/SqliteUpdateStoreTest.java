package com.my.relay.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.adapter.out.telegram.TelegramUpdateCodec;
import com.my.relay.domain.model.QueueRecord;
import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.support.TestAppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.util.List;

import static com.my.relay.support.TestUpdates.callback;
import static com.my.relay.support.TestUpdates.privateMessage;
import static org.assertj.core.api.Assertions.assertThat;

class SqliteUpdateStoreTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;
    private TestAppConfig config;

    @BeforeEach
    void setUp() {
        Path dbPath = tempDir.resolve("nested/updates.db");
        dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        config = new TestAppConfig();
        config.sqlitePath = dbPath.toString();
    }

    private SqliteUpdateStore openStore() {
        ObjectMapper objectMapper = new ObjectMapper();
        SqliteUpdateStore store = new SqliteUpdateStore(dataSource, new TelegramUpdateCodec(objectMapper), objectMapper, config);
        store.init();
        return store;
    }

    @Test
    void enqueuedRecordRoundTripsThroughPayload() {
        SqliteUpdateStore store = openStore();

        QueueRecord stored = store.enqueue(callback(5L, "ok"));
        QueueRecord loaded = store.findNextPending().orElseThrow();

        assertThat(loaded.id()).isEqualTo(stored.id());
        assertThat(loaded.update()).isEqualTo(callback(5L, "ok"));
        assertThat(loaded.enqueuedAt()).isEqualTo(stored.enqueuedAt());
        assertThat(loaded.failureCount()).isZero();
        assertThat(loaded.failures()).isEmpty();
    }

    @Test
    void pendingOrderFollowsUpdateIdThenInsertion() {
        SqliteUpdateStore store = openStore();
        QueueRecord later = store.enqueue(privateMessage(9L));
        QueueRecord first = store.enqueue(privateMessage(3L));
        QueueRecord duplicate = store.enqueue(privateMessage(3L));

        assertThat(store.findNextPending()).map(QueueRecord::id).hasValue(first.id());
        store.delete(first.id());
        assertThat(store.findNextPending()).map(QueueRecord::id).hasValue(duplicate.id());
        store.delete(duplicate.id());
        assertThat(store.findNextPending()).map(QueueRecord::id).hasValue(later.id());
    }

    @Test
    void failureHistoryAndAbandonmentPersist() {
        SqliteUpdateStore store = openStore();
        QueueRecord record = store.enqueue(privateMessage(4L));

        QueueRecord retried = record.withFailure("t1: Failed to process update 4: boom", 2);
        store.update(retried);
        assertThat(store.findNextPending().orElseThrow().failures()).containsExactly("t1: Failed to process update 4: boom");

        store.update(retried.withFailure("t2: Failed to process update 4: boom", 2));

        assertThat(store.findNextPending()).isEmpty();
        assertThat(store.countPending()).isZero();
        assertThat(store.countAbandoned()).isEqualTo(1);
        List<QueueRecord> abandoned = store.findAbandoned(10);
        assertThat(abandoned).hasSize(1);
        assertThat(abandoned.get(0).failureCount()).isEqualTo(2);
        assertThat(abandoned.get(0).abandoned()).isTrue();
        assertThat(abandoned.get(0).failures()).hasSize(2);
    }

    @Test
    void abandonedListingIsNewestFirstAndLimited() {
        SqliteUpdateStore store = openStore();
        for (long id = 1; id <= 3; id++) {
            store.update(store.enqueue(privateMessage(id)).withFailure("f", 1));
        }

        assertThat(store.findAbandoned(2)).extracting(QueueRecord::updateId).containsExactly(3L, 2L);
    }

    @Test
    void acknowledgedSequenceNeverMovesBackwards() {
        SqliteUpdateStore store = openStore();
        assertThat(store.lastAcknowledged()).isEmpty();

        store.acknowledge(12L);
        store.acknowledge(7L);

        assertThat(store.lastAcknowledged()).hasValue(12L);
    }

    @Test
    void stateSurvivesReopen() {
        SqliteUpdateStore store = openStore();
        store.enqueue(privateMessage(30L));
        store.enqueue(privateMessage(31L));
        store.acknowledge(31L);

        SqliteUpdateStore reopened = openStore();

        assertThat(reopened.countPending()).isEqualTo(2);
        assertThat(reopened.lastAcknowledged()).hasValue(31L);
        assertThat(reopened.findNextPending().orElseThrow().update()).isEqualTo(privateMessage(30L));
    }

    @Test
    void unsupportedFallbackRecordIsRestored() {
        SqliteUpdateStore store = openStore();
        ObjectMapper objectMapper = new ObjectMapper();
        TelegramUpdate fallback = new TelegramUpdateCodec(objectMapper)
                .decodeOrUnsupported("{\"update_id\":40,\"edited_message\":{\"text\":\"no chat\"}}");

        store.enqueue(fallback);

        assertThat(store.findNextPending().orElseThrow().update()).isEqualTo(fallback);
    }

    @Test
    void deletingUnknownRecordIsNoop() {
        SqliteUpdateStore store = openStore();
        store.enqueue(privateMessage(1L));

        store.delete(999L);

        assertThat(store.countPending()).isEqualTo(1);
    }
}
