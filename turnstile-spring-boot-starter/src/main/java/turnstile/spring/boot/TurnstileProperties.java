package turnstile.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import turnstile.jdbc.TableNames;

import java.time.Duration;

/**
 * Configuration properties for turnstile.
 *
 * @see TurnstileAutoConfiguration
 */
@ConfigurationProperties(prefix = "turnstile")
public class TurnstileProperties {

  /**
   * Whether to create the turnstile tables on startup if they do not exist.
   */
  private boolean initializeSchema = false;

  private final Tables tables = new Tables();
  private final Bus bus = new Bus();
  private final EventLog eventLog = new EventLog();
  private final ConnectionRetry connectionRetry = new ConnectionRetry();
  private final Metrics metrics = new Metrics();

  public boolean isInitializeSchema() {
    return initializeSchema;
  }

  public void setInitializeSchema(boolean initializeSchema) {
    this.initializeSchema = initializeSchema;
  }

  public Tables getTables() {
    return tables;
  }

  public Bus getBus() {
    return bus;
  }

  public EventLog getEventLog() {
    return eventLog;
  }

  public ConnectionRetry getConnectionRetry() {
    return connectionRetry;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Tables {
    private String lease = TableNames.DEFAULT_LEASE_TABLE;
    private String event = TableNames.DEFAULT_EVENT_TABLE;
    private String sequence = TableNames.DEFAULT_SEQUENCE_TABLE;

    public String getLease() {
      return lease;
    }

    public void setLease(String lease) {
      this.lease = lease;
    }

    public String getEvent() {
      return event;
    }

    public void setEvent(String event) {
      this.event = event;
    }

    public String getSequence() {
      return sequence;
    }

    public void setSequence(String sequence) {
      this.sequence = sequence;
    }
  }

  public static class Bus {
    /**
     * How long the dispatch thread waits on the listening connection per poll.
     */
    private Duration receiveTimeout = Duration.ofSeconds(1);
    private long reconnectBaseDelayMs = 200;
    private long reconnectMaxDelayMs = 10000;

    public Duration getReceiveTimeout() {
      return receiveTimeout;
    }

    public void setReceiveTimeout(Duration receiveTimeout) {
      this.receiveTimeout = receiveTimeout;
    }

    public long getReconnectBaseDelayMs() {
      return reconnectBaseDelayMs;
    }

    public void setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
      this.reconnectBaseDelayMs = reconnectBaseDelayMs;
    }

    public long getReconnectMaxDelayMs() {
      return reconnectMaxDelayMs;
    }

    public void setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
      this.reconnectMaxDelayMs = reconnectMaxDelayMs;
    }
  }

  public static class EventLog {
    private int batchSize = 100;

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class ConnectionRetry {
    private boolean enabled = true;
    private int maxAttempts = 5;
    private long baseDelayMs = 200;
    private long maxDelayMs = 5000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "turnstile";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
