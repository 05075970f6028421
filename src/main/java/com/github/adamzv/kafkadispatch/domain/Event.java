package com.github.adamzv.kafkadispatch.domain;

import java.util.Map;

public record Event(
    String key,
    Object payload,
    Map<String, String> headers
) {

  public Event {
    headers = headers == null ? Map.of() : headers;
  }

  public static Event of(String key, Object payload) {
    return new Event(key, payload, Map.of());
  }
}
