package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.ports.TraceSpan;
import com.github.adamzv.kafkadispatch.ports.TracingPort;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every span it starts. Producer spans write a {@code traceparent} header into the carrier.
 */
final class RecordingTracing implements TracingPort {

  static final String TRACEPARENT = "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01";

  final List<Span> spans = new CopyOnWriteArrayList<>();

  @Override
  public TraceSpan startConsumer(String name, Map<String, String> carrier) {
    Span span = new Span(name, "consumer", carrier);
    spans.add(span);
    return span;
  }

  @Override
  public TraceSpan startProducer(String name, Map<String, String> carrier) {
    carrier.put("traceparent", TRACEPARENT);
    Span span = new Span(name, "producer", carrier);
    spans.add(span);
    return span;
  }

  Span only(String name) {
    List<Span> matching = spans.stream().filter(span -> span.name.equals(name)).toList();
    if (matching.size() != 1) {
      throw new AssertionError("expected one span named " + name + " but found " + matching.size());
    }
    return matching.get(0);
  }

  static final class Span implements TraceSpan {

    final String name;
    final String kind;
    final Map<String, String> carrier;
    final Map<String, Object> tags = new LinkedHashMap<>();
    volatile Throwable error;
    volatile boolean closed;

    Span(String name, String kind, Map<String, String> carrier) {
      this.name = name;
      this.kind = kind;
      this.carrier = carrier;
    }

    @Override
    public synchronized TraceSpan tag(String key, Object value) {
      tags.put(key, value);
      return this;
    }

    @Override
    public void error(Throwable error) {
      this.error = error;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
