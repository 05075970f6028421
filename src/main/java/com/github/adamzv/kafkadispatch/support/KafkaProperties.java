package com.github.adamzv.kafkadispatch.support;

import com.github.adamzv.kafkadispatch.domain.ReaderSettings;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "kafka")
public record KafkaProperties(
    @NotEmpty(message = "kafka.brokers must not be empty")
    List<String> brokers,
    @NotEmpty(message = "kafka.topics must not be empty")
    List<String> topics,
    @NotBlank(message = "kafka.groupId must not be blank")
    String groupId,
    @DefaultValue("3")
    @Positive(message = "kafka.maxRetries must be > 0")
    int maxRetries,
    @DefaultValue("3s")
    Duration dialTimeout,
    @DefaultValue("5s")
    Duration keepAlive,
    @DefaultValue("10000000")
    @Positive(message = "kafka.batchBytes must be > 0")
    int batchBytes
) {

  public String bootstrapServers() {
    return String.join(",", brokers);
  }

  public ReaderSettings toReaderSettings(String clientId) {
    return new ReaderSettings(List.copyOf(brokers), groupId, clientId, dialTimeout, keepAlive, batchBytes);
  }

  @AssertTrue(message = "kafka.dialTimeout must be > 0")
  public boolean isDialTimeoutPositive() {
    return dialTimeout != null && !dialTimeout.isZero() && !dialTimeout.isNegative();
  }

  @AssertTrue(message = "kafka.keepAlive must be > 0")
  public boolean isKeepAlivePositive() {
    return keepAlive != null && !keepAlive.isZero() && !keepAlive.isNegative();
  }
}
