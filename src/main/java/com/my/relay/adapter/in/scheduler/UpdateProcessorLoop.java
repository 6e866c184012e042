package com.my.relay.adapter.in.scheduler;

import com.my.relay.config.AppConfig;
import com.my.relay.domain.model.DeliveryResult;
import com.my.relay.domain.model.QueueRecord;
import com.my.relay.domain.service.UpdateProcessingService;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * 왜: 큐에 적재된 업데이트를 순서대로 꺼내 전달하고, 실패 시 독성 업데이트에 갇혀 헛돌지 않도록 대기 시간을 두기 위함.
 */
@ApplicationScoped
public class UpdateProcessorLoop extends WorkerLoop {

    private static final Logger log = Logger.getLogger(UpdateProcessorLoop.class);

    private final UpdateProcessingService updateProcessingService;
    private final long idleDelayMillis;
    private final long failureDelayMillis;

    @Inject
    public UpdateProcessorLoop(UpdateProcessingService updateProcessingService, AppConfig appConfig) {
        super("update-processor", appConfig.processor().shutdownTimeoutSeconds(),
                appConfig.processor().errorBackoffMillis());
        this.updateProcessingService = updateProcessingService;
        this.idleDelayMillis = appConfig.processor().idleDelayMillis();
        this.failureDelayMillis = appConfig.processor().failureDelayMillis();
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
        DeliveryResult result = updateProcessingService.processNext();
        report(result);
        return result.failed() ? failureDelayMillis + idleDelayMillis : idleDelayMillis;
    }

    private void report(DeliveryResult result) {
        switch (result.status()) {
            case IDLE -> {
            }
            case DELIVERED -> log.debugf("업데이트 %d 전달 완료", result.record().updateId());
            case RETRY_SCHEDULED -> {
                QueueRecord record = result.record();
                log.warnf("업데이트 처리 실패 시도 %d/%d: %s",
                        record.failureCount(), updateProcessingService.retryBudget(), result.lastFailure());
            }
            case ABANDONED -> log.errorf("PERMANENT FAILURE: %s", result.lastFailure());
        }
    }
}
