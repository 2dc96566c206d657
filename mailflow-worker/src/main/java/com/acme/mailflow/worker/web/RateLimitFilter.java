package com.acme.mailflow.worker.web;

import com.acme.mailflow.config.RateLimitConfig;
import com.acme.mailflow.ratelimit.FixedWindowRateLimiter;
import com.acme.mailflow.ratelimit.RateLimitDecision;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.RequestFilter;
import io.micronaut.http.annotation.ResponseFilter;
import io.micronaut.http.annotation.ServerFilter;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.net.InetSocketAddress;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the per-user ceiling to requests that carry the authenticated user header and the per-IP
 * ceiling to all other requests. Admitted responses get the {@code X-RateLimit-*} headers of the
 * tier that applied.
 */
@ServerFilter("/**")
public class RateLimitFilter {
  private static final Logger LOG = LoggerFactory.getLogger(RateLimitFilter.class);

  static final String DECISION_ATTRIBUTE = "mailflow.rate-limit.decision";
  static final String LIMIT_HEADER = "X-RateLimit-Limit";
  static final String REMAINING_HEADER = "X-RateLimit-Remaining";
  static final String RESET_HEADER = "X-RateLimit-Reset";
  static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  static final String UNKNOWN_IP = "unknown";

  private final FixedWindowRateLimiter limiter;
  private final RateLimitConfig config;

  public RateLimitFilter(FixedWindowRateLimiter limiter, RateLimitConfig config) {
    this.limiter = limiter;
    this.config = config;
  }

  /** Returns a 429 response to stop the request, or null to let it through. */
  @RequestFilter
  @ExecuteOn(TaskExecutors.BLOCKING)
  @Nullable
  public HttpResponse<ErrorResponse> limit(HttpRequest<?> request) {
    if (limiter.isExcluded(request.getPath())) {
      return null;
    }

    String userId = request.getHeaders().get(config.getUserHeader());
    Optional<RateLimitDecision> applied;
    if (userId != null && !userId.isBlank()) {
      applied = limiter.checkUser(userId.trim());
      if (applied.isPresent() && !applied.get().allowed()) {
        LOG.warn("User rate limit exceeded userId={} path={}", userId, request.getPath());
        return tooManyRequests(applied.get());
      }
    } else {
      String ip = clientIp(request);
      applied = limiter.checkIp(ip);
      if (applied.isPresent() && !applied.get().allowed()) {
        LOG.warn("Rate limit exceeded ip={} path={}", ip, request.getPath());
        return tooManyRequests(applied.get());
      }
    }

    applied.ifPresent(decision -> request.setAttribute(DECISION_ATTRIBUTE, decision));
    return null;
  }

  @ResponseFilter
  public void addHeaders(HttpRequest<?> request, MutableHttpResponse<?> response) {
    if (response.getHeaders().contains(LIMIT_HEADER)) {
      return;
    }
    request
        .getAttribute(DECISION_ATTRIBUTE, RateLimitDecision.class)
        .ifPresent(decision -> applyHeaders(response, decision));
  }

  static MutableHttpResponse<ErrorResponse> tooManyRequests(RateLimitDecision decision) {
    MutableHttpResponse<ErrorResponse> response =
        HttpResponse.<ErrorResponse>status(HttpStatus.TOO_MANY_REQUESTS)
            .body(
                new ErrorResponse(
                    "Too many requests",
                    "Rate limit exceeded. Maximum " + decision.limit() + " requests per window.",
                    decision.retryAfterSeconds()))
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
    applyHeaders(response, decision);
    return response;
  }

  private static void applyHeaders(MutableHttpResponse<?> response, RateLimitDecision decision) {
    response.header(LIMIT_HEADER, String.valueOf(decision.limit()));
    response.header(REMAINING_HEADER, String.valueOf(decision.remaining()));
    response.header(RESET_HEADER, String.valueOf(decision.resetEpochSeconds()));
  }

  /** First hop of {@code X-Forwarded-For} when behind a proxy, else the socket peer. */
  static String clientIp(HttpRequest<?> request) {
    String forwarded = request.getHeaders().get(FORWARDED_FOR_HEADER);
    if (forwarded != null && !forwarded.isBlank()) {
      return forwarded.split(",")[0].trim();
    }
    try {
      InetSocketAddress remote = request.getRemoteAddress();
      if (remote.getAddress() != null) {
        return remote.getAddress().getHostAddress();
      }
      return remote.getHostString();
    } catch (RuntimeException e) {
      LOG.debug("Could not resolve remote address: {}", e.getMessage());
      return UNKNOWN_IP;
    }
  }
}
