package com.my.relay.domain.model;

import java.util.OptionalLong;

public record QueueStatistics(long pending, long abandoned, OptionalLong lastAcknowledged) {
}
