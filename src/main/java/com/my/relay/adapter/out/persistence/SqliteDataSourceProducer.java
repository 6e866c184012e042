package com.my.relay.adapter.out.persistence;

import com.my.relay.config.AppConfig;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * 왜: 폴러와 처리기 스레드가 같은 SQLite 파일을 동시에 쓰므로 busy timeout과 WAL이 설정된 데이터소스를 제공하기 위함.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteDataSourceProducer {

    @Produces
    @ApplicationScoped
    public DataSource sqliteDataSource(AppConfig appConfig) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(appConfig.store().busyTimeoutMillis());
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + Path.of(appConfig.store().sqlitePath()).toAbsolutePath());
        return dataSource;
    }
}
