package com.myorg.cafe.eventstore;

import java.time.Instant;

public record StoredSnapshot(
        String aggregateId,
        String aggregateType,
        long sequence,
        String stateJson,
        Instant createdAt
) {}
