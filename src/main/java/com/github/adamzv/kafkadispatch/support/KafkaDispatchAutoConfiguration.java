package com.github.adamzv.kafkadispatch.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkadispatch.adapters.kafka.KafkaAdminAdapter;
import com.github.adamzv.kafkadispatch.adapters.kafka.KafkaProducerAdapter;
import com.github.adamzv.kafkadispatch.adapters.kafka.KafkaTopicReaderFactory;
import com.github.adamzv.kafkadispatch.adapters.metrics.MicrometerDispatchMetrics;
import com.github.adamzv.kafkadispatch.adapters.tracing.ObservationTracingAdapter;
import com.github.adamzv.kafkadispatch.application.BackoffPolicy;
import com.github.adamzv.kafkadispatch.application.Cancellation;
import com.github.adamzv.kafkadispatch.application.DeadLetterRouter;
import com.github.adamzv.kafkadispatch.application.DeadLetterTopics;
import com.github.adamzv.kafkadispatch.application.DispatchWorkerPool;
import com.github.adamzv.kafkadispatch.application.KafkaClient;
import com.github.adamzv.kafkadispatch.application.MessageDispatcher;
import com.github.adamzv.kafkadispatch.application.MessageHandler;
import com.github.adamzv.kafkadispatch.application.MessagePublisher;
import com.github.adamzv.kafkadispatch.application.ReaderPool;
import com.github.adamzv.kafkadispatch.domain.DispatchSettings;
import com.github.adamzv.kafkadispatch.domain.ReaderSettings;
import com.github.adamzv.kafkadispatch.ports.DispatchMetrics;
import com.github.adamzv.kafkadispatch.ports.KafkaAdminPort;
import com.github.adamzv.kafkadispatch.ports.KafkaProducerPort;
import com.github.adamzv.kafkadispatch.ports.TopicReaderFactory;
import com.github.adamzv.kafkadispatch.ports.TracingPort;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Properties;
import java.util.UUID;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnProperty(prefix = "kafka.dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({KafkaProperties.class, DispatchProperties.class})
public class KafkaDispatchAutoConfiguration {

  private static final Duration CLIENT_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration FETCH_STOP_TIMEOUT = Duration.ofSeconds(5);

  @Bean
  @ConditionalOnMissingBean
  public ReaderSettings kafkaReaderSettings(KafkaProperties kafkaProperties) {
    String clientId = "kafka-dispatch-" + UUID.randomUUID().toString().substring(0, 8);
    return kafkaProperties.toReaderSettings(clientId);
  }

  @Bean
  @ConditionalOnMissingBean
  public DispatchSettings dispatchSettings(KafkaProperties kafkaProperties, DispatchProperties dispatchProperties) {
    return dispatchProperties.toSettings(kafkaProperties.maxRetries());
  }

  @Bean
  @ConditionalOnMissingBean
  public Cancellation dispatchCancellation() {
    return new Cancellation();
  }

  @Bean
  @ConditionalOnMissingBean
  public BackoffPolicy dispatchBackoffPolicy(DispatchProperties dispatchProperties) {
    return dispatchProperties.backoff().toPolicy(Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public DispatchMetrics dispatchMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    MeterRegistry registry = meterRegistry.getIfAvailable();
    return registry == null ? DispatchMetrics.NOOP : new MicrometerDispatchMetrics(registry);
  }

  @Bean
  @ConditionalOnMissingBean
  public TracingPort dispatchTracing(DispatchProperties dispatchProperties,
                                     ObjectProvider<ObservationRegistry> observationRegistry) {
    ObservationRegistry registry = observationRegistry.getIfAvailable();
    if (!dispatchProperties.tracingEnabled() || registry == null) {
      return TracingPort.NOOP;
    }
    return new ObservationTracingAdapter(registry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(KafkaAdminPort.class)
  public Admin kafkaDispatchAdminClient(KafkaProperties kafkaProperties) {
    Properties props = new Properties();
    int timeoutMs = Math.toIntExact(CLIENT_TIMEOUT.toMillis());
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
    return Admin.create(props);
  }

  @Bean
  @ConditionalOnMissingBean
  public KafkaAdminPort kafkaAdminPort(Admin kafkaDispatchAdminClient, KafkaProperties kafkaProperties) {
    return new KafkaAdminAdapter(kafkaDispatchAdminClient, kafkaProperties.bootstrapServers());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(KafkaProducerPort.class)
  public Producer<byte[], byte[]> kafkaDispatchProducer(KafkaProperties kafkaProperties, ReaderSettings readerSettings) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, readerSettings.clientId() + "-producer");
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
    props.put(ProducerConfig.SOCKET_CONNECTION_SETUP_TIMEOUT_MS_CONFIG, kafkaProperties.dialTimeout().toMillis());
    return new KafkaProducer<>(props, new ByteArraySerializer(), new ByteArraySerializer());
  }

  @Bean
  @ConditionalOnMissingBean
  public KafkaProducerPort kafkaProducerPort(Producer<byte[], byte[]> kafkaDispatchProducer,
                                             KafkaProperties kafkaProperties) {
    return new KafkaProducerAdapter(kafkaDispatchProducer, kafkaProperties.bootstrapServers());
  }

  @Bean
  @ConditionalOnMissingBean
  public TopicReaderFactory topicReaderFactory() {
    return new KafkaTopicReaderFactory();
  }

  @Bean
  @ConditionalOnMissingBean
  public MessagePublisher messagePublisher(KafkaProducerPort producerPort,
                                           ObjectProvider<ObjectMapper> objectMapper,
                                           TracingPort tracing) {
    return new MessagePublisher(producerPort, objectMapper.getIfAvailable(ObjectMapper::new), tracing);
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterRouter deadLetterRouter(MessagePublisher publisher,
                                           DispatchSettings dispatchSettings,
                                           TracingPort tracing,
                                           DispatchMetrics metrics) {
    return new DeadLetterRouter(publisher, new DeadLetterTopics(dispatchSettings.deadLetterSuffix()), tracing, metrics);
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageDispatcher messageDispatcher(DispatchSettings dispatchSettings,
                                             BackoffPolicy backoffPolicy,
                                             DeadLetterRouter deadLetterRouter,
                                             Cancellation cancellation,
                                             TracingPort tracing,
                                             DispatchMetrics metrics) {
    return new MessageDispatcher(
        dispatchSettings.maxRetries(),
        backoffPolicy,
        deadLetterRouter,
        cancellation,
        tracing,
        metrics
    );
  }

  @Bean
  @ConditionalOnMissingBean
  public DispatchWorkerPool dispatchWorkerPool(DispatchSettings dispatchSettings) {
    return new DispatchWorkerPool(
        dispatchSettings.workers(),
        dispatchSettings.queueCapacity(),
        dispatchSettings.drainTimeout()
    );
  }

  @Bean
  @ConditionalOnMissingBean
  public ReaderPool readerPool(KafkaProperties kafkaProperties,
                               ReaderSettings readerSettings,
                               TopicReaderFactory topicReaderFactory,
                               MessageDispatcher dispatcher,
                               DispatchWorkerPool workers,
                               DeadLetterRouter deadLetterRouter,
                               Cancellation cancellation,
                               DispatchMetrics metrics) {
    return ReaderPool.open(
        kafkaProperties.topics(),
        readerSettings,
        topicReaderFactory,
        dispatcher,
        workers,
        deadLetterRouter,
        cancellation,
        metrics
    );
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public KafkaClient kafkaClient(ReaderPool readerPool,
                                 MessagePublisher publisher,
                                 KafkaAdminPort adminPort,
                                 DispatchWorkerPool workers,
                                 Cancellation cancellation) {
    return new KafkaClient(readerPool, publisher, adminPort, workers, cancellation, FETCH_STOP_TIMEOUT);
  }

  @Bean
  @ConditionalOnBean(MessageHandler.class)
  @ConditionalOnMissingBean
  public DispatchLifecycle dispatchLifecycle(KafkaClient kafkaClient, MessageHandler messageHandler) {
    return new DispatchLifecycle(kafkaClient, messageHandler);
  }

  @Bean
  @ConditionalOnMissingBean
  public StartupLogger dispatchStartupLogger(ReaderSettings readerSettings,
                                             DispatchSettings dispatchSettings,
                                             DispatchProperties dispatchProperties,
                                             KafkaProperties kafkaProperties) {
    return new StartupLogger(readerSettings, dispatchSettings, dispatchProperties, kafkaProperties.topics());
  }
}
