package com.github.adamzv.kafkadispatch.domain;

import java.util.Map;

public record FetchedRecord(
    String topic,
    int partition,
    long offset,
    byte[] key,
    byte[] body,
    long timestamp,
    Map<String, String> headers
) {

  public FetchedRecord {
    key = key == null ? new byte[0] : key;
    headers = headers == null ? Map.of() : headers;
  }
}
