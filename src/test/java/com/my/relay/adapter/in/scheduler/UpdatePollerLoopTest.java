package com.my.relay.adapter.in.scheduler;

import com.my.relay.domain.exception.UpdateFetchException;
import com.my.relay.domain.exception.UpdateStoreException;
import com.my.relay.domain.service.UpdatePollingService;
import com.my.relay.support.TestAppConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UpdatePollerLoopTest {

    private UpdatePollingService pollingService;
    private UpdatePollerLoop loop;

    @BeforeEach
    void setUp() {
        pollingService = mock(UpdatePollingService.class);
        loop = new UpdatePollerLoop(pollingService, new TestAppConfig());
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    void successful_cycle_waits_out_minimum_interval() {
        when(pollingService.fetchAndEnqueue()).thenReturn(2);

        long delay = loop.runCycle();

        assertThat(delay).isBetween(100L, 200L);
    }

    @Test
    void fetch_failure_keeps_regular_cadence() {
        when(pollingService.fetchAndEnqueue()).thenThrow(new UpdateFetchException("HTTP 502"));

        long delay = loop.runCycle();

        assertThat(delay).isBetween(100L, 200L);
    }

    @Test
    void store_failure_backs_off() {
        when(pollingService.fetchAndEnqueue()).thenThrow(new UpdateStoreException("locked", null));

        assertEquals(50L, loop.cycle());
    }

    @Test
    void slow_cycle_polls_again_immediately() {
        when(pollingService.fetchAndEnqueue()).thenAnswer(invocation -> {
            Thread.sleep(250);
            return 0;
        });

        assertEquals(0L, loop.runCycle());
    }

    @Test
    void keeps_polling_after_unexpected_error() throws Exception {
        CountDownLatch recovered = new CountDownLatch(1);
        when(pollingService.fetchAndEnqueue())
                .thenThrow(new NoClassDefFoundError("com/example/Missing"))
                .thenAnswer(invocation -> {
                    recovered.countDown();
                    return 0;
                });

        loop.start();

        assertTrue(recovered.await(5, TimeUnit.SECONDS));
        assertThat(loop.isRunning()).isTrue();
    }

    @Test
    void runs_until_stopped() throws Exception {
        CountDownLatch cycles = new CountDownLatch(2);
        when(pollingService.fetchAndEnqueue()).thenAnswer(invocation -> {
            cycles.countDown();
            return 0;
        });

        loop.start();

        assertTrue(cycles.await(5, TimeUnit.SECONDS));
        assertThat(loop.isRunning()).isTrue();
        assertThrows(IllegalStateException.class, loop::start);
        loop.stop();
        assertThat(loop.isRunning()).isFalse();
    }
}
