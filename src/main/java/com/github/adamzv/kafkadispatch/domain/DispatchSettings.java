package com.github.adamzv.kafkadispatch.domain;

import java.time.Duration;

public record DispatchSettings(
    int maxRetries,
    int workers,
    int queueCapacity,
    String deadLetterSuffix,
    Duration drainTimeout
) {}
