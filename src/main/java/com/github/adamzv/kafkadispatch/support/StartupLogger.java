package com.github.adamzv.kafkadispatch.support;

import com.github.adamzv.kafkadispatch.domain.DispatchSettings;
import com.github.adamzv.kafkadispatch.domain.ReaderSettings;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

public class StartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final ReaderSettings readerSettings;
  private final DispatchSettings dispatchSettings;
  private final DispatchProperties dispatchProperties;
  private final List<String> topics;

  public StartupLogger(ReaderSettings readerSettings,
                       DispatchSettings dispatchSettings,
                       DispatchProperties dispatchProperties,
                       List<String> topics) {
    this.readerSettings = readerSettings;
    this.dispatchSettings = dispatchSettings;
    this.dispatchProperties = dispatchProperties;
    this.topics = topics;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    DispatchProperties.Backoff backoff = dispatchProperties.backoff();
    log.info(
        "kafka_dispatch_ready bootstrapServers={} topics={} groupId={} clientId={} maxRetries={} workers={} queueCapacity={} deadLetterSuffix={} tracingEnabled={} backoff={{initialInterval={}, multiplier={}, maxInterval={}, maxElapsedTime={}}}",
        readerSettings.bootstrapServers(),
        topics,
        readerSettings.groupId(),
        readerSettings.clientId(),
        dispatchSettings.maxRetries(),
        dispatchSettings.workers(),
        dispatchSettings.queueCapacity(),
        dispatchSettings.deadLetterSuffix(),
        dispatchProperties.tracingEnabled(),
        backoff.initialInterval(),
        backoff.multiplier(),
        backoff.maxInterval(),
        backoff.maxElapsedTime()
    );
  }
}
