package com.acme.mailflow.config;

import java.time.Duration;

/**
 * Timeouts for collaborator calls, stalled jobs and shutdown. Pure POJO - no framework
 * dependencies.
 */
public class TimeoutConfig {

  private Duration collaboratorCall = Duration.ofSeconds(10);
  private Duration stalledJobLease = Duration.ofMinutes(5);
  private Duration workerShutdownGrace = Duration.ofSeconds(10);
  private Duration shutdownCeiling = Duration.ofSeconds(30);
  private Duration shutdownBuffer = Duration.ofSeconds(2);

  public Duration getCollaboratorCall() {
    return collaboratorCall;
  }

  public void setCollaboratorCall(Duration collaboratorCall) {
    this.collaboratorCall = collaboratorCall;
  }

  public Duration getStalledJobLease() {
    return stalledJobLease;
  }

  public void setStalledJobLease(Duration stalledJobLease) {
    this.stalledJobLease = stalledJobLease;
  }

  public Duration getWorkerShutdownGrace() {
    return workerShutdownGrace;
  }

  public void setWorkerShutdownGrace(Duration workerShutdownGrace) {
    this.workerShutdownGrace = workerShutdownGrace;
  }

  public Duration getShutdownCeiling() {
    return shutdownCeiling;
  }

  public void setShutdownCeiling(Duration shutdownCeiling) {
    this.shutdownCeiling = shutdownCeiling;
  }

  public Duration getShutdownBuffer() {
    return shutdownBuffer;
  }

  public void setShutdownBuffer(Duration shutdownBuffer) {
    this.shutdownBuffer = shutdownBuffer;
  }
}
