package com.github.adamzv.kafkadispatch.support;

import com.github.adamzv.kafkadispatch.application.KafkaClient;
import com.github.adamzv.kafkadispatch.application.MessageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

public class DispatchLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(DispatchLifecycle.class);

  private final KafkaClient kafkaClient;
  private final MessageHandler messageHandler;
  private volatile boolean running;

  public DispatchLifecycle(KafkaClient kafkaClient, MessageHandler messageHandler) {
    this.kafkaClient = kafkaClient;
    this.messageHandler = messageHandler;
  }

  @Override
  public void start() {
    kafkaClient.listen(messageHandler);
    running = true;
    log.info("dispatch_lifecycle outcome=started handler={}", messageHandler.getClass().getName());
  }

  @Override
  public void stop() {
    running = false;
    kafkaClient.close();
    log.info("dispatch_lifecycle outcome=stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
