package com.my.relay.adapter.in.scheduler;

import com.my.relay.config.AppConfig;
import com.my.relay.domain.exception.UpdateFetchException;
import com.my.relay.domain.service.UpdatePollingService;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * 왜: 텔레그램 업데이트를 최소 간격으로 폴링해 영속 큐에 적재하는 전용 실행 단위가 필요하기 때문.
 */
@ApplicationScoped
public class UpdatePollerLoop extends WorkerLoop {

    private static final Logger log = Logger.getLogger(UpdatePollerLoop.class);

    private final UpdatePollingService updatePollingService;
    private final long minIntervalMillis;

    @Inject
    public UpdatePollerLoop(UpdatePollingService updatePollingService, AppConfig appConfig) {
        super("update-poller", appConfig.poller().shutdownTimeoutSeconds(), appConfig.poller().errorBackoffMillis());
        this.updatePollingService = updatePollingService;
        this.minIntervalMillis = appConfig.poller().minIntervalMillis();
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    @PreDestroy
    void onStop() {
        stop();
    }

    @Override
    long runCycle() {
        long startedAt = System.nanoTime();
        try {
            int enqueued = updatePollingService.fetchAndEnqueue();
            if (enqueued > 0) {
                log.debugf("업데이트 %d건을 큐에 적재했습니다. (%dms)", enqueued, elapsedMillis(startedAt));
            }
        } catch (UpdateFetchException e) {
            log.warnf("텔레그램 업데이트 조회 실패, 다음 주기에 같은 offset으로 재시도합니다: %s", e.getMessage());
        }
        return Math.max(0L, minIntervalMillis - elapsedMillis(startedAt));
    }

    private static long elapsedMillis(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000L;
    }
}
