package com.github.adamzv.kafkadispatch.ports;

public interface TraceSpan extends AutoCloseable {

  TraceSpan NOOP = new TraceSpan() {
    @Override
    public TraceSpan tag(String key, Object value) {
      return this;
    }

    @Override
    public void error(Throwable error) {
    }

    @Override
    public void close() {
    }
  };

  TraceSpan tag(String key, Object value);

  void error(Throwable error);

  @Override
  void close();
}
