package com.my.relay.adapter.out.clock;

import com.my.relay.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * 왜: 실패 이력에 남는 시각을 UTC로 고정하고, 테스트에서는 고정 시계를 주입하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final Clock clock;

    private OffsetClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static OffsetClockAdapter system() {
        return new OffsetClockAdapter(Clock.systemUTC());
    }

    public static OffsetClockAdapter fixed(Clock clock) {
        return new OffsetClockAdapter(clock);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
