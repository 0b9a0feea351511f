package com.myorg.cafe.deadletter;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class DeadLetterScheduleValues {
    private final CafeDeadLetterProperties props;

    public long getFixedDelayMs() { return props.getProcessor().getFixedDelay().toMillis(); }
    public long getInitialDelayMs() { return props.getProcessor().getInitialDelay().toMillis(); }
}
