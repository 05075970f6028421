package com.github.adamzv.kafkadispatch.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkadispatch.domain.Event;
import com.github.adamzv.kafkadispatch.domain.ProblemException;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.domain.ProduceRequest;
import com.github.adamzv.kafkadispatch.domain.ProduceResult;
import com.github.adamzv.kafkadispatch.ports.KafkaProducerPort;
import com.github.adamzv.kafkadispatch.ports.TraceSpan;
import com.github.adamzv.kafkadispatch.ports.TracingPort;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class MessagePublisher {

  static final String PUBLISH_SPAN = "kafka.publish";

  private final KafkaProducerPort producerPort;
  private final ObjectMapper objectMapper;
  private final TracingPort tracing;

  public MessagePublisher(KafkaProducerPort producerPort, ObjectMapper objectMapper, TracingPort tracing) {
    this.producerPort = producerPort;
    this.objectMapper = objectMapper;
    this.tracing = tracing == null ? TracingPort.NOOP : tracing;
  }

  public ProduceResult publish(String topic, Event event) {
    validate(topic, event);
    return producerPort.produce(encode(topic, event, sanitizeHeaders(event.headers())));
  }

  public ProduceResult publishWithTracer(String topic, Event event) {
    validate(topic, event);
    Map<String, String> headers = sanitizeHeaders(event.headers());
    try (TraceSpan span = tracing.startProducer(PUBLISH_SPAN, headers)) {
      span.tag("messaging.destination", topic);
      if (event.key() != null) {
        span.tag("messaging.kafka.message_key", event.key());
      }
      try {
        ProduceResult result = producerPort.produce(encode(topic, event, headers));
        span.tag("messaging.kafka.partition", result.partition());
        span.tag("messaging.kafka.offset", result.offset());
        return result;
      } catch (ProblemException ex) {
        span.error(ex);
        throw ex;
      }
    }
  }

  public ProduceResult publishRaw(ProduceRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Produce request is required", Map.of());
    }
    if (request.topic() == null || request.topic().isBlank()) {
      throw Problems.invalidArgument("Topic must not be blank", Map.of());
    }
    return producerPort.produce(request);
  }

  private void validate(String topic, Event event) {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Topic must not be blank", Map.of());
    }
    if (event == null) {
      throw Problems.invalidArgument("Event is required", Map.of("topic", topic));
    }
  }

  private ProduceRequest encode(String topic, Event event, Map<String, String> headers) {
    byte[] key = event.key() == null ? null : event.key().getBytes(StandardCharsets.UTF_8);
    return new ProduceRequest(topic, key, Collections.unmodifiableMap(headers), serialize(topic, event));
  }

  private byte[] serialize(String topic, Event event) {
    try {
      return objectMapper.writeValueAsBytes(event.payload());
    } catch (JsonProcessingException ex) {
      throw Problems.serializationFailed(
          "Event payload could not be serialized",
          Map.of("topic", topic, "error", String.valueOf(ex.getOriginalMessage()))
      );
    }
  }

  private Map<String, String> sanitizeHeaders(Map<String, String> headers) {
    Map<String, String> copy = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw Problems.invalidArgument("Header names must not be blank", Map.of());
      }
      copy.put(key, entry.getValue());
    }
    return copy;
  }
}
