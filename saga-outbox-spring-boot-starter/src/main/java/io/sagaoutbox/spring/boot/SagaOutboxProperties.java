package io.sagaoutbox.spring.boot;

import io.sagaoutbox.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the saga outbox.
 *
 * @see SagaOutboxAutoConfiguration
 */
@ConfigurationProperties(prefix = "saga-outbox")
public class SagaOutboxProperties {

  private final Tables tables = new Tables();
  private final Publisher publisher = new Publisher();
  private final Sweeper sweeper = new Sweeper();
  private final Metrics metrics = new Metrics();

  public Tables getTables() {
    return tables;
  }

  public Publisher getPublisher() {
    return publisher;
  }

  public Sweeper getSweeper() {
    return sweeper;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Tables {
    /**
     * Table holding immediate pending commands.
     */
    private String command = TableNames.DEFAULT_COMMAND_TABLE;

    /**
     * Table holding scheduled pending commands.
     */
    private String scheduledCommand = TableNames.DEFAULT_SCHEDULED_COMMAND_TABLE;

    /**
     * Table holding process manager state.
     */
    private String processManager = TableNames.DEFAULT_PROCESS_MANAGER_TABLE;

    public String getCommand() {
      return command;
    }

    public void setCommand(String command) {
      this.command = command;
    }

    public String getScheduledCommand() {
      return scheduledCommand;
    }

    public void setScheduledCommand(String scheduledCommand) {
      this.scheduledCommand = scheduledCommand;
    }

    public String getProcessManager() {
      return processManager;
    }

    public void setProcessManager(String processManager) {
      this.processManager = processManager;
    }
  }

  public static class Publisher {
    /**
     * Flushes a sweep pass runs in parallel.
     */
    private int workerCount = 4;

    /**
     * Owner ids each sweep probe may return per row kind.
     */
    private int probeLimit = 1;

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public int getProbeLimit() {
      return probeLimit;
    }

    public void setProbeLimit(int probeLimit) {
      this.probeLimit = probeLimit;
    }
  }

  public static class Sweeper {
    private boolean enabled = true;
    private long initialDelayMs = 1000L;
    private long intervalMs = 5000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getInitialDelayMs() {
      return initialDelayMs;
    }

    public void setInitialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "saga.outbox";

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
