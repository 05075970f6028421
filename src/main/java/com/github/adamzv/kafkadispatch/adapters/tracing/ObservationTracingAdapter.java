package com.github.adamzv.kafkadispatch.adapters.tracing;

import com.github.adamzv.kafkadispatch.ports.TraceSpan;
import com.github.adamzv.kafkadispatch.ports.TracingPort;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.transport.ReceiverContext;
import io.micrometer.observation.transport.SenderContext;
import java.util.Map;

public class ObservationTracingAdapter implements TracingPort {

  private final ObservationRegistry registry;

  public ObservationTracingAdapter(ObservationRegistry registry) {
    this.registry = registry;
  }

  @Override
  public TraceSpan startConsumer(String name, Map<String, String> carrier) {
    ReceiverContext<Map<String, String>> context =
        new ReceiverContext<>((headers, key) -> headers == null ? null : headers.get(key));
    context.setCarrier(carrier);
    return start(Observation.createNotStarted(name, () -> context, registry));
  }

  @Override
  public TraceSpan startProducer(String name, Map<String, String> carrier) {
    SenderContext<Map<String, String>> context = new SenderContext<>((headers, key, value) -> {
      if (headers != null) {
        headers.put(key, value);
      }
    });
    context.setCarrier(carrier);
    return start(Observation.createNotStarted(name, () -> context, registry));
  }

  private static TraceSpan start(Observation observation) {
    observation.lowCardinalityKeyValue("messaging.system", "kafka");
    observation.start();
    return new ObservationSpan(observation, observation.openScope());
  }

  private static final class ObservationSpan implements TraceSpan {

    private final Observation observation;
    private final Observation.Scope scope;
    private boolean closed;

    private ObservationSpan(Observation observation, Observation.Scope scope) {
      this.observation = observation;
      this.scope = scope;
    }

    @Override
    public TraceSpan tag(String key, Object value) {
      observation.highCardinalityKeyValue(key, String.valueOf(value));
      return this;
    }

    @Override
    public void error(Throwable error) {
      observation.error(error);
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      scope.close();
      observation.stop();
    }
  }
}
