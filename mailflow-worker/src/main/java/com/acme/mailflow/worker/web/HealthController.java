package com.acme.mailflow.worker.web;

import com.acme.mailflow.queue.QueueFactory;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Health checks for the platform. {@code /health} always answers 200 and reports degraded services in
 * the body; {@code /ready} answers 503 until both the database and the job broker are usable.
 */
@Controller
@ExecuteOn(TaskExecutors.BLOCKING)
public class HealthController {
  private static final Logger LOG = LoggerFactory.getLogger(HealthController.class);
  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  static final String OK = "ok";
  static final String ERROR = "error";
  static final String DEGRADED = "degraded";

  private final DataSource dataSource;
  private final QueueFactory queueFactory;
  private final Clock clock;

  public HealthController(DataSource dataSource, QueueFactory queueFactory, Clock clock) {
    this.dataSource = dataSource;
    this.queueFactory = queueFactory;
    this.clock = clock;
  }

  @Get("/health")
  public HttpResponse<Map<String, Object>> health() {
    Map<String, String> services = services();
    boolean healthy = services.values().stream().allMatch(OK::equals);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", healthy ? OK : DEGRADED);
    body.put("timestamp", clock.instant().toString());
    body.put("services", services);
    return HttpResponse.ok(body);
  }

  @Get("/ready")
  public HttpResponse<Map<String, String>> ready() {
    Map<String, String> services = services();
    if (services.values().stream().allMatch(OK::equals)) {
      return HttpResponse.ok(Map.of("status", "ready"));
    }
    LOG.warn("Readiness check failed: {}", services);
    return HttpResponse.<Map<String, String>>status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("status", "not ready", "error", "Service unavailable"));
  }

  @Get("/live")
  public HttpResponse<Map<String, String>> live() {
    return HttpResponse.ok(Map.of("status", "alive"));
  }

  private Map<String, String> services() {
    Map<String, String> services = new LinkedHashMap<>();
    services.put("database", databaseStatus());
    services.put("broker", queueFactory.isDegraded() ? DEGRADED : OK);
    return services;
  }

  private String databaseStatus() {
    try (Connection conn = dataSource.getConnection()) {
      return conn.isValid(VALIDATION_TIMEOUT_SECONDS) ? OK : ERROR;
    } catch (Exception e) {
      LOG.warn("Database health check failed: {}", e.getMessage());
      return ERROR;
    }
  }
}
