package turnstile.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import turnstile.events.BuildEventLog;
import turnstile.events.BuildStatus;
import turnstile.events.LogEvent;
import turnstile.lock.LockCoordinator;
import turnstile.micrometer.MicrometerMetricsExporter;
import turnstile.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.*;

class TurnstileMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(TurnstileMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void exporterIsTheMetricsExporter() {
    runner.run(ctx ->
        assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class)));
  }

  @Test
  void namePrefixIsConfigurable() {
    runner.withPropertyValues("turnstile.metrics.name-prefix=ci.turnstile").run(ctx -> {
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("ci.turnstile.events.appended").counter());
      assertNull(registry.find("turnstile.events.appended").counter());
    });
  }

  @Test
  void invalidPrefixFailsStartup() {
    runner.withPropertyValues("turnstile.metrics.name-prefix=turnstile.").run(ctx ->
        assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void noExporterWhenDisabled() {
    runner.withPropertyValues("turnstile.metrics.enabled=false").run(ctx ->
        assertTrue(ctx.getBeansOfType(MetricsExporter.class).isEmpty()));
  }

  @Test
  void userExporterWins() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx ->
        assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class)));
  }

  @Test
  void coordinatorAndEventLogReportThroughMicrometer() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            TurnstileMicrometerAutoConfiguration.class, TurnstileAutoConfiguration.class))
        .withUserConfiguration(MeterRegistryConfig.class, TurnstileAutoConfigurationTest.H2Config.class)
        .withPropertyValues("turnstile.initialize-schema=true")
        .run(ctx -> {
          LockCoordinator locks = ctx.getBean(LockCoordinator.class);
          BuildEventLog log = ctx.getBean(BuildEventLog.class);
          MeterRegistry registry = ctx.getBean(MeterRegistry.class);

          locks.acquireTaskLock("gc").orElseThrow().release();
          log.start(3);
          log.append(3, new LogEvent("stdout", "done\n", 0L));
          log.finish(3, BuildStatus.SUCCEEDED);

          assertEquals(1.0, registry.get("turnstile.lock.acquired").counter().count());
          assertEquals(3.0, registry.get("turnstile.events.appended").counter().count());
          assertEquals(1.0, registry.get("turnstile.builds.finished").counter().count());
        });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customMetricsExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
