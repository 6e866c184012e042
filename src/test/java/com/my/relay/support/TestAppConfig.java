package com.my.relay.support;

import com.my.relay.config.AppConfig;

import java.util.List;
import java.util.Optional;

public class TestAppConfig implements AppConfig {

    public String botToken;
    public String apiBaseUrl = "https://api.telegram.org";
    public int pollTimeoutSeconds = 1;
    public int requestTimeoutSeconds = 5;
    public int fetchLimit = 25;
    public List<String> allowedUpdates = List.of("message", "edited_message", "callback_query");
    public long minIntervalMillis = 200;
    public long pollerErrorBackoffMillis = 50;
    public int retryBudget = 1;
    public long idleDelayMillis = 10;
    public long failureDelayMillis = 100;
    public long processorErrorBackoffMillis = 70;
    public int shutdownTimeoutSeconds = 2;
    public String sqlitePath = "./data/updates.db";
    public int sendTimeoutSeconds = 1;

    @Override
    public TelegramConfig telegram() {
        return new TelegramConfig() {
            @Override
            public Optional<String> botToken() {
                return Optional.ofNullable(botToken);
            }

            @Override
            public String apiBaseUrl() {
                return apiBaseUrl;
            }

            @Override
            public int pollTimeoutSeconds() {
                return pollTimeoutSeconds;
            }

            @Override
            public int requestTimeoutSeconds() {
                return requestTimeoutSeconds;
            }

            @Override
            public int fetchLimit() {
                return fetchLimit;
            }

            @Override
            public List<String> allowedUpdates() {
                return allowedUpdates;
            }
        };
    }

    @Override
    public PollerConfig poller() {
        return new PollerConfig() {
            @Override
            public long minIntervalMillis() {
                return minIntervalMillis;
            }

            @Override
            public long errorBackoffMillis() {
                return pollerErrorBackoffMillis;
            }

            @Override
            public int shutdownTimeoutSeconds() {
                return shutdownTimeoutSeconds;
            }
        };
    }

    @Override
    public ProcessorConfig processor() {
        return new ProcessorConfig() {
            @Override
            public int retryBudget() {
                return retryBudget;
            }

            @Override
            public long idleDelayMillis() {
                return idleDelayMillis;
            }

            @Override
            public long failureDelayMillis() {
                return failureDelayMillis;
            }

            @Override
            public long errorBackoffMillis() {
                return processorErrorBackoffMillis;
            }

            @Override
            public int shutdownTimeoutSeconds() {
                return shutdownTimeoutSeconds;
            }
        };
    }

    @Override
    public StoreConfig store() {
        return new StoreConfig() {
            @Override
            public String backend() {
                return "memory";
            }

            @Override
            public String sqlitePath() {
                return sqlitePath;
            }

            @Override
            public int busyTimeoutMillis() {
                return 1000;
            }
        };
    }

    @Override
    public RelayConfig relay() {
        return () -> sendTimeoutSeconds;
    }
}
