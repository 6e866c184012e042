package com.my.relay.adapter.out.dispatch;

import com.my.relay.domain.exception.UpdateDispatchException;
import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.port.out.UpdateDispatcher;
import org.jboss.logging.MDC;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static com.my.relay.support.TestUpdates.privateMessage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LoggingUpdateDispatcherTest {

    @Test
    void delegate_sees_update_context_which_is_cleared_afterwards() {
        AtomicReference<Object> seenId = new AtomicReference<>();
        AtomicReference<Object> seenKind = new AtomicReference<>();
        UpdateDispatcher delegate = update -> {
            seenId.set(MDC.get("updateId"));
            seenKind.set(MDC.get("updateKind"));
        };

        new LoggingUpdateDispatcher(delegate).dispatch(privateMessage(55L));

        assertThat(seenId.get()).isEqualTo("55");
        assertThat(seenKind.get()).isEqualTo("PRIVATE_MESSAGE");
        assertThat(MDC.get("updateId")).isNull();
        assertThat(MDC.get("updateKind")).isNull();
    }

    @Test
    void failure_propagates_and_context_is_cleared() {
        UpdateDispatcher delegate = update -> {
            throw new UpdateDispatchException("nack");
        };
        TelegramUpdate update = privateMessage(56L);

        assertThrows(UpdateDispatchException.class, () -> new LoggingUpdateDispatcher(delegate).dispatch(update));

        assertThat(MDC.get("updateId")).isNull();
    }
}
