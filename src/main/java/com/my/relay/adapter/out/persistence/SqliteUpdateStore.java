package com.my.relay.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.adapter.out.telegram.TelegramUpdateCodec;
import com.my.relay.config.AppConfig;
import com.my.relay.domain.exception.UpdateStoreException;
import com.my.relay.domain.model.QueueRecord;
import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.port.out.AcknowledgedSequencePort;
import com.my.relay.domain.port.out.UpdateQueuePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 왜: 단일 프로세스에서도 재시작 후 대기 업데이트와 확인 시퀀스를 잃지 않도록 파일 기반 SQLite를 사용한다.
 * <p>
 * 모든 변경은 단일 SQL 문으로 원자적이다. bot_state는 id=1 한 행만 가진다.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteUpdateStore implements UpdateQueuePort, AcknowledgedSequencePort {

    private static final String QUEUE_DDL = """
            CREATE TABLE IF NOT EXISTS update_queue (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                update_id INTEGER NOT NULL,
                kind TEXT NOT NULL,
                payload TEXT NOT NULL,
                enqueued_at INTEGER NOT NULL,
                failure_count INTEGER NOT NULL DEFAULT 0,
                abandoned INTEGER NOT NULL DEFAULT 0,
                failures TEXT NOT NULL DEFAULT '[]'
            )
            """;
    private static final String QUEUE_INDEX_DDL =
            "CREATE INDEX IF NOT EXISTS idx_update_queue_pending ON update_queue(abandoned, update_id, id)";
    private static final String STATE_DDL = """
            CREATE TABLE IF NOT EXISTS bot_state (
                id INTEGER PRIMARY KEY CHECK (id = 1),
                last_update_id INTEGER NOT NULL
            )
            """;
    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    private static final String COLUMNS = "id, payload, enqueued_at, failure_count, abandoned, failures";
    private static final String INSERT_SQL =
            "INSERT INTO update_queue(update_id, kind, payload, enqueued_at) VALUES (?, ?, ?, ?)";
    private static final String LAST_ROWID_SQL = "SELECT last_insert_rowid()";
    private static final String SELECT_NEXT_SQL =
            "SELECT " + COLUMNS + " FROM update_queue WHERE abandoned = 0 ORDER BY update_id ASC, id ASC LIMIT 1";
    private static final String SELECT_ABANDONED_SQL =
            "SELECT " + COLUMNS + " FROM update_queue WHERE abandoned = 1 ORDER BY update_id DESC, id DESC LIMIT ?";
    private static final String UPDATE_SQL =
            "UPDATE update_queue SET failure_count = ?, abandoned = ?, failures = ? WHERE id = ?";
    private static final String DELETE_SQL = "DELETE FROM update_queue WHERE id = ?";
    private static final String COUNT_SQL = "SELECT COUNT(*) FROM update_queue WHERE abandoned = ?";
    private static final String SELECT_STATE_SQL = "SELECT last_update_id FROM bot_state WHERE id = 1";
    private static final String UPSERT_STATE_SQL = """
            INSERT INTO bot_state(id, last_update_id) VALUES (1, ?)
            ON CONFLICT(id) DO UPDATE SET last_update_id = MAX(last_update_id, excluded.last_update_id)
            """;

    private static final TypeReference<List<String>> FAILURES_TYPE = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final TelegramUpdateCodec codec;
    private final ObjectMapper objectMapper;
    private final Path sqlitePath;
    private final Object sequenceLock = new Object();

    public SqliteUpdateStore(DataSource dataSource,
                             TelegramUpdateCodec codec,
                             ObjectMapper objectMapper,
                             AppConfig appConfig) {
        this.dataSource = dataSource;
        this.codec = codec;
        this.objectMapper = objectMapper;
        this.sqlitePath = Path.of(appConfig.store().sqlitePath());
    }

    @PostConstruct
    void init() {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(QUEUE_DDL);
            stmt.execute(QUEUE_INDEX_DDL);
            stmt.execute(STATE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("업데이트 큐 테이블 초기화 실패", e);
        }
    }

    @Override
    public QueueRecord enqueue(TelegramUpdate update) {
        Instant now = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL);
             Statement rowId = conn.createStatement()) {
            ps.setLong(1, update.updateId());
            ps.setString(2, update.kind().name());
            ps.setString(3, update.rawJson());
            ps.setLong(4, now.toEpochMilli());
            ps.executeUpdate();
            try (ResultSet keys = rowId.executeQuery(LAST_ROWID_SQL)) {
                if (!keys.next()) {
                    throw new SQLException("생성된 레코드 id가 없습니다.");
                }
                return QueueRecord.fresh(keys.getLong(1), update, Instant.ofEpochMilli(now.toEpochMilli()));
            }
        } catch (SQLException e) {
            throw new UpdateStoreException("업데이트 적재 실패 updateId=" + update.updateId(), e);
        }
    }

    @Override
    public Optional<QueueRecord> findNextPending() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_NEXT_SQL);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(map(rs)) : Optional.empty();
        } catch (SQLException e) {
            throw new UpdateStoreException("대기 업데이트 조회 실패", e);
        }
    }

    @Override
    public void update(QueueRecord record) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPDATE_SQL)) {
            ps.setInt(1, record.failureCount());
            ps.setInt(2, record.abandoned() ? 1 : 0);
            ps.setString(3, objectMapper.writeValueAsString(record.failures()));
            ps.setLong(4, record.id());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new UpdateStoreException("업데이트 레코드 갱신 실패 id=" + record.id(), e);
        }
    }

    @Override
    public void delete(long recordId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setLong(1, recordId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new UpdateStoreException("업데이트 레코드 삭제 실패 id=" + recordId, e);
        }
    }

    @Override
    public List<QueueRecord> findAbandoned(int limit) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_ABANDONED_SQL)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                List<QueueRecord> records = new ArrayList<>();
                while (rs.next()) {
                    records.add(map(rs));
                }
                return records;
            }
        } catch (SQLException e) {
            throw new UpdateStoreException("포기된 업데이트 조회 실패", e);
        }
    }

    @Override
    public long countPending() {
        return count(false);
    }

    @Override
    public long countAbandoned() {
        return count(true);
    }

    @Override
    public OptionalLong lastAcknowledged() {
        synchronized (sequenceLock) {
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement ps = conn.prepareStatement(SELECT_STATE_SQL);
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            } catch (SQLException e) {
                throw new UpdateStoreException("확인 시퀀스 조회 실패", e);
            }
        }
    }

    @Override
    public void acknowledge(long updateId) {
        synchronized (sequenceLock) {
            try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_STATE_SQL)) {
                ps.setLong(1, updateId);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new UpdateStoreException("확인 시퀀스 기록 실패 updateId=" + updateId, e);
            }
        }
    }

    private long count(boolean abandoned) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(COUNT_SQL)) {
            ps.setInt(1, abandoned ? 1 : 0);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new UpdateStoreException("큐 건수 조회 실패", e);
        }
    }

    private QueueRecord map(ResultSet rs) throws SQLException {
        List<String> failures;
        try {
            failures = objectMapper.readValue(rs.getString("failures"), FAILURES_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("실패 이력 컬럼을 해석할 수 없습니다.", e);
        }
        return new QueueRecord(
                rs.getLong("id"),
                codec.decodeOrUnsupported(rs.getString("payload")),
                Instant.ofEpochMilli(rs.getLong("enqueued_at")),
                rs.getInt("failure_count"),
                rs.getInt("abandoned") == 1,
                failures);
    }
}
