package com.acme.mailflow.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.awaitility.Awaitility.await;

import com.acme.mailflow.queue.QueueFactory;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import io.micronaut.test.support.TestPropertyProvider;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

/** Boots the worker on H2 with the in-process broker and calls it over HTTP. */
@MicronautTest(environments = "test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisplayName("Mailflow worker application Tests")
class MailflowApplicationTest implements TestPropertyProvider {

  @Inject
  @Client("/")
  HttpClient client;

  @Inject QueueFactory queueFactory;

  @Override
  public Map<String, String> getProperties() {
    Map<String, String> props = new HashMap<>();
    props.put("datasources.default.url", "jdbc:h2:mem:mailflowapp;DB_CLOSE_DELAY=-1");
    props.put("datasources.default.driver-class-name", "org.h2.Driver");
    props.put("datasources.default.username", "sa");
    props.put("datasources.default.password", "");
    props.put("db.dialect", "H2");
    props.put("redisson.enabled", "false");
    props.put("mailflow.queue.broker", "memory");
    props.put("mailflow.pollers.enabled", "false");
    props.put("mailflow.rate-limit.ip-max-requests", "2");
    props.put("mailflow.rate-limit.excluded-paths", "/health,/ready");
    props.put("mailflow.timeouts.shutdown-buffer", "0s");
    return props;
  }

  @Test
  @DisplayName("should run with a live in-process broker")
  void testBrokerActive() {
    assertThat(queueFactory.isDegraded()).isFalse();
  }

  @Test
  @DisplayName("live endpoint should answer 200")
  void testLive() {
    HttpResponse<Map> response =
        client
            .toBlocking()
            .exchange(HttpRequest.GET("/live").header("X-Forwarded-For", "198.51.100.2"), Map.class);

    assertThat(response.getStatus()).isEqualTo(HttpStatus.OK);
    assertThat(response.body()).containsEntry("status", "alive");
    assertThat(response.getHeaders().get("X-RateLimit-Limit")).isEqualTo("2");
    assertThat(response.getHeaders().get("X-RateLimit-Remaining")).isEqualTo("1");
  }

  @Test
  @DisplayName("ready endpoint should answer 200 once the database answers")
  void testReady() {
    await()
        .atMost(Duration.ofSeconds(10))
        .untilAsserted(
            () -> {
              HttpResponse<Map> response =
                  client.toBlocking().exchange(HttpRequest.GET("/ready"), Map.class);
              assertThat(response.body()).containsEntry("status", "ready");
            });
  }

  @Test
  @DisplayName("health endpoints should never be rate limited")
  void testHealthEndpointsBypassLimiter() {
    for (int i = 0; i < 5; i++) {
      HttpResponse<Map> response =
          client
              .toBlocking()
              .exchange(HttpRequest.GET("/health").header("X-Forwarded-For", "198.51.100.1"), Map.class);
      assertThat(response.getStatus()).isEqualTo(HttpStatus.OK);
      assertThat(response.getHeaders().contains("X-RateLimit-Limit")).isFalse();
    }
  }

  @Test
  @DisplayName("should answer 429 once a client exceeds its ceiling")
  void testRateLimited() {
    // Given
    for (int i = 0; i < 2; i++) {
      HttpResponse<Map> admitted =
          client
              .toBlocking()
              .exchange(HttpRequest.GET("/live").header("X-Forwarded-For", "198.51.100.7"), Map.class);
      assertThat(admitted.getStatus()).isEqualTo(HttpStatus.OK);
    }

    // When
    HttpClientResponseException limited =
        catchThrowableOfType(
            () -> client.toBlocking().exchange(HttpRequest.GET("/live").header("X-Forwarded-For", "198.51.100.7")),
            HttpClientResponseException.class);

    // Then
    assertThat(limited.getStatus()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(limited.getResponse().getHeaders().get(HttpHeaders.RETRY_AFTER)).isEqualTo("60");
    assertThat(limited.getResponse().getHeaders().get("X-RateLimit-Remaining")).isEqualTo("0");
  }
}
