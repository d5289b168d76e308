package turnstile.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import turnstile.micrometer.MicrometerMetricsExporter;
import turnstile.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code turnstile.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link TurnstileAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the coordinator, bus and event log.
 */
@AutoConfiguration(before = TurnstileAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "turnstile.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(TurnstileProperties.class)
public class TurnstileMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, TurnstileProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
