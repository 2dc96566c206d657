package com.acme.mailflow.config;

import com.acme.mailflow.queue.BackoffPolicy;
import com.acme.mailflow.queue.QueueName;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Queue defaults shared by every named queue. Pure POJO - no framework dependencies.
 *
 * <p>Concurrency depends on the deployment environment unless a queue has an explicit override
 * (campaign dispatch runs 5 slots by default).
 */
public class QueueConfig {

  public static final String BROKER_REDIS = "redis";
  public static final String BROKER_MEMORY = "memory";
  public static final String BROKER_NONE = "none";

  private String broker = BROKER_REDIS;
  private String environment = "development";
  private int productionConcurrency = 3;
  private int developmentConcurrency = 2;
  private int jobsPerSecondPerSlot = 10;
  private int defaultAttempts = 3;
  private Duration backoffDelay = Duration.ofSeconds(5);
  private Duration pollInterval = Duration.ofMillis(250);
  private Map<String, Integer> concurrency = new HashMap<>(Map.of("campaign-dispatch", 5));

  public String getBroker() {
    return broker;
  }

  public void setBroker(String broker) {
    this.broker = broker;
  }

  public String getEnvironment() {
    return environment;
  }

  public void setEnvironment(String environment) {
    this.environment = environment;
  }

  public boolean isProduction() {
    return "production".equalsIgnoreCase(environment);
  }

  public int getProductionConcurrency() {
    return productionConcurrency;
  }

  public void setProductionConcurrency(int productionConcurrency) {
    this.productionConcurrency = productionConcurrency;
  }

  public int getDevelopmentConcurrency() {
    return developmentConcurrency;
  }

  public void setDevelopmentConcurrency(int developmentConcurrency) {
    this.developmentConcurrency = developmentConcurrency;
  }

  public int getJobsPerSecondPerSlot() {
    return jobsPerSecondPerSlot;
  }

  public void setJobsPerSecondPerSlot(int jobsPerSecondPerSlot) {
    this.jobsPerSecondPerSlot = jobsPerSecondPerSlot;
  }

  public int getDefaultAttempts() {
    return defaultAttempts;
  }

  public void setDefaultAttempts(int defaultAttempts) {
    this.defaultAttempts = defaultAttempts;
  }

  public Duration getBackoffDelay() {
    return backoffDelay;
  }

  public void setBackoffDelay(Duration backoffDelay) {
    this.backoffDelay = backoffDelay;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public Map<String, Integer> getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(Map<String, Integer> concurrency) {
    this.concurrency = concurrency;
  }

  public int concurrencyFor(QueueName queue) {
    Integer override = concurrency.get(queue.id());
    if (override != null && override > 0) {
      return override;
    }
    return isProduction() ? productionConcurrency : developmentConcurrency;
  }

  public BackoffPolicy defaultBackoff() {
    return BackoffPolicy.exponential(backoffDelay);
  }
}
