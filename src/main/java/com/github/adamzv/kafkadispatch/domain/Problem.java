package com.github.adamzv.kafkadispatch.domain;

import java.util.Map;

public record Problem(
    String code,
    String message,
    Map<String, Object> details
) {}
