package com.my.relay.config;

import com.my.relay.support.TestAppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigValidatorTest {

    private TestAppConfig config;

    @BeforeEach
    void setUp() {
        config = new TestAppConfig();
        config.botToken = "123:abc";
    }

    @Test
    void validConfigurationPasses() {
        assertThatCode(() -> new ConfigValidator(config).validate(true)).doesNotThrowAnyException();
    }

    @Test
    void missingTokenFailsOnlyInProduction() {
        config.botToken = " ";

        assertThatThrownBy(() -> new ConfigValidator(config).validate(true))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TELEGRAM_BOT_TOKEN");
        assertThatCode(() -> new ConfigValidator(config).validate(false)).doesNotThrowAnyException();
    }

    @Test
    void fetchLimitMustStayWithinApiRange() {
        config.fetchLimit = 101;

        assertThatThrownBy(() -> new ConfigValidator(config).validate(false))
                .hasMessageContaining("fetch-limit");

        config.fetchLimit = 0;
        assertThatThrownBy(() -> new ConfigValidator(config).validate(false))
                .hasMessageContaining("fetch-limit");
    }

    @Test
    void retryBudgetMustBePositive() {
        config.retryBudget = 0;

        assertThatThrownBy(() -> new ConfigValidator(config).validate(false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("retry-budget");
    }

    @Test
    void negativeDelaysAreRejected() {
        config.failureDelayMillis = -1;

        assertThatThrownBy(() -> new ConfigValidator(config).validate(false))
                .hasMessageContaining("failure-delay-millis");
    }
}
