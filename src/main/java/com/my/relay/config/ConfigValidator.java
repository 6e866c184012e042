package com.my.relay.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private static final int MAX_FETCH_LIMIT = 100;

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        validate(LaunchMode.current() == LaunchMode.NORMAL);
    }

    void validate(boolean isProd) {
        validateRequired("TELEGRAM_BOT_TOKEN", appConfig.telegram().botToken().orElse(null), isProd);
        int fetchLimit = appConfig.telegram().fetchLimit();
        if (fetchLimit < 1 || fetchLimit > MAX_FETCH_LIMIT) {
            throw new IllegalStateException("app.telegram.fetch-limit는 1~" + MAX_FETCH_LIMIT + " 사이여야 합니다: " + fetchLimit);
        }
        if (appConfig.processor().retryBudget() < 1) {
            throw new IllegalStateException("app.processor.retry-budget는 1 이상이어야 합니다: "
                    + appConfig.processor().retryBudget());
        }
        validateNonNegative("app.telegram.poll-timeout-seconds", appConfig.telegram().pollTimeoutSeconds());
        validateNonNegative("app.poller.min-interval-millis", appConfig.poller().minIntervalMillis());
        validateNonNegative("app.poller.error-backoff-millis", appConfig.poller().errorBackoffMillis());
        validateNonNegative("app.processor.idle-delay-millis", appConfig.processor().idleDelayMillis());
        validateNonNegative("app.processor.failure-delay-millis", appConfig.processor().failureDelayMillis());
        validateNonNegative("app.processor.error-backoff-millis", appConfig.processor().errorBackoffMillis());
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validateNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalStateException(name + "는 음수일 수 없습니다: " + value);
        }
    }
}
