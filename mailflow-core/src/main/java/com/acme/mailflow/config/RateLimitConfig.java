package com.acme.mailflow.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** HTTP rate limiting ceilings. Pure POJO - no framework dependencies. */
public class RateLimitConfig {

  private boolean enabled = true;
  private long ipMaxRequests = 100;
  private long userMaxRequests = 200;
  private Duration window = Duration.ofSeconds(60);
  private List<String> excludedPaths = new ArrayList<>(List.of("/health", "/ready", "/live"));
  private String userHeader = "X-User-Id";

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public long getIpMaxRequests() {
    return ipMaxRequests;
  }

  public void setIpMaxRequests(long ipMaxRequests) {
    this.ipMaxRequests = ipMaxRequests;
  }

  public long getUserMaxRequests() {
    return userMaxRequests;
  }

  public void setUserMaxRequests(long userMaxRequests) {
    this.userMaxRequests = userMaxRequests;
  }

  public Duration getWindow() {
    return window;
  }

  public void setWindow(Duration window) {
    this.window = window;
  }

  public List<String> getExcludedPaths() {
    return excludedPaths;
  }

  public void setExcludedPaths(List<String> excludedPaths) {
    this.excludedPaths = excludedPaths;
  }

  public String getUserHeader() {
    return userHeader;
  }

  public void setUserHeader(String userHeader) {
    this.userHeader = userHeader;
  }
}
