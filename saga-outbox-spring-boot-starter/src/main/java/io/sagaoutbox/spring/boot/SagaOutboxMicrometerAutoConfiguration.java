package io.sagaoutbox.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.sagaoutbox.micrometer.MicrometerMetricsExporter;
import io.sagaoutbox.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} is present and {@code saga-outbox.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SagaOutboxAutoConfiguration} so the exporter reaches the publisher.
 */
@AutoConfiguration(before = SagaOutboxAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "saga-outbox.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SagaOutboxProperties.class)
public class SagaOutboxMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, SagaOutboxProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
