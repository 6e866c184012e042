package com.my.relay.adapter.out.health;

import com.my.relay.domain.model.QueueStatistics;
import com.my.relay.domain.service.UpdateProcessingService;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class QueueReadinessCheck implements HealthCheck {

    private final UpdateProcessingService updateProcessingService;

    public QueueReadinessCheck(UpdateProcessingService updateProcessingService) {
        this.updateProcessingService = updateProcessingService;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("update-queue");
        try {
            QueueStatistics statistics = updateProcessingService.queueStatistics();
            return builder
                    .withData("pending", statistics.pending())
                    .withData("abandoned", statistics.abandoned())
                    .withData("lastAcknowledged", statistics.lastAcknowledged().isPresent()
                            ? String.valueOf(statistics.lastAcknowledged().getAsLong())
                            : "none")
                    .up()
                    .build();
        } catch (RuntimeException e) {
            return builder
                    .withData("error", String.valueOf(e.getMessage()))
                    .down()
                    .build();
        }
    }
}
