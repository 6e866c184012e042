package com.my.relay.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    TelegramConfig telegram();

    PollerConfig poller();

    ProcessorConfig processor();

    StoreConfig store();

    RelayConfig relay();

    interface TelegramConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("api-base-url")
        @WithDefault("https://api.telegram.org")
        String apiBaseUrl();

        @WithName("poll-timeout-seconds")
        @WithDefault("2")
        int pollTimeoutSeconds();

        @WithName("request-timeout-seconds")
        @WithDefault("37")
        int requestTimeoutSeconds();

        @WithName("fetch-limit")
        @WithDefault("25")
        int fetchLimit();

        @WithName("allowed-updates")
        @WithDefault("message,edited_message,channel_post,edited_channel_post,inline_query,chosen_inline_result,callback_query")
        List<String> allowedUpdates();
    }

    interface PollerConfig {
        @WithName("min-interval-millis")
        @WithDefault("1009")
        long minIntervalMillis();

        @WithName("error-backoff-millis")
        @WithDefault("503")
        long errorBackoffMillis();

        @WithName("shutdown-timeout-seconds")
        @WithDefault("5")
        int shutdownTimeoutSeconds();
    }

    interface ProcessorConfig {
        @WithName("retry-budget")
        @WithDefault("1")
        int retryBudget();

        @WithName("idle-delay-millis")
        @WithDefault("10")
        long idleDelayMillis();

        @WithName("failure-delay-millis")
        @WithDefault("500")
        long failureDelayMillis();

        @WithName("error-backoff-millis")
        @WithDefault("500")
        long errorBackoffMillis();

        @WithName("shutdown-timeout-seconds")
        @WithDefault("5")
        int shutdownTimeoutSeconds();
    }

    interface StoreConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/updates.db")
        String sqlitePath();

        @WithName("busy-timeout-millis")
        @WithDefault("5000")
        int busyTimeoutMillis();
    }

    interface RelayConfig {
        @WithName("send-timeout-seconds")
        @WithDefault("10")
        int sendTimeoutSeconds();
    }
}
