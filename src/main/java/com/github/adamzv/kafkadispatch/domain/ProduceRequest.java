package com.github.adamzv.kafkadispatch.domain;

import java.util.Map;

public record ProduceRequest(
    String topic,
    byte[] key,
    Map<String, String> headers,
    byte[] value
) {

  public ProduceRequest {
    headers = headers == null ? Map.of() : headers;
  }
}
