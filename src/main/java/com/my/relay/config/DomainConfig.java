package com.my.relay.config;

import com.my.relay.adapter.out.clock.OffsetClockAdapter;
import com.my.relay.adapter.out.dispatch.LoggingUpdateDispatcher;
import com.my.relay.domain.port.out.AcknowledgedSequencePort;
import com.my.relay.domain.port.out.ClockPort;
import com.my.relay.domain.port.out.TelegramUpdatePort;
import com.my.relay.domain.port.out.UpdateDispatcher;
import com.my.relay.domain.port.out.UpdateListener;
import com.my.relay.domain.port.out.UpdateQueuePort;
import com.my.relay.domain.service.UpdatePollingService;
import com.my.relay.domain.service.UpdateProcessingService;
import com.my.relay.domain.service.UpdateRouter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public UpdatePollingService updatePollingService(TelegramUpdatePort telegramUpdatePort,
                                                     UpdateQueuePort updateQueuePort,
                                                     AcknowledgedSequencePort acknowledgedSequencePort,
                                                     AppConfig appConfig) {
        return new UpdatePollingService(telegramUpdatePort, updateQueuePort, acknowledgedSequencePort,
                appConfig.telegram().fetchLimit(), appConfig.telegram().pollTimeoutSeconds());
    }

    @Produces
    @ApplicationScoped
    public UpdateDispatcher updateDispatcher(Instance<UpdateListener> listeners) {
        return new LoggingUpdateDispatcher(new UpdateRouter(listeners.stream().toList()));
    }

    @Produces
    @ApplicationScoped
    public UpdateProcessingService updateProcessingService(UpdateQueuePort updateQueuePort,
                                                           AcknowledgedSequencePort acknowledgedSequencePort,
                                                           UpdateDispatcher updateDispatcher,
                                                           ClockPort clockPort,
                                                           AppConfig appConfig) {
        return new UpdateProcessingService(updateQueuePort, acknowledgedSequencePort, updateDispatcher,
                clockPort, appConfig.processor().retryBudget());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return OffsetClockAdapter.system();
    }
}
