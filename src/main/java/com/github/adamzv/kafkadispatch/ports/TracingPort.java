package com.github.adamzv.kafkadispatch.ports;

import java.util.Map;

public interface TracingPort {

  TracingPort NOOP = new TracingPort() {
    @Override
    public TraceSpan startConsumer(String name, Map<String, String> carrier) {
      return TraceSpan.NOOP;
    }

    @Override
    public TraceSpan startProducer(String name, Map<String, String> carrier) {
      return TraceSpan.NOOP;
    }
  };

  TraceSpan startConsumer(String name, Map<String, String> carrier);

  TraceSpan startProducer(String name, Map<String, String> carrier);
}
