package com.acme.mailflow.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Extra bounce classification rules evaluated before the built-in ones.
 *
 * <p>Each entry reads {@code TYPE:CATEGORY:phrase one|phrase two}, for example {@code
 * HARD:BLOCKED:listed on dnsbl|blacklisted}.
 */
public class BounceConfig {

  private List<String> extraRules = new ArrayList<>();
  private int hardBounceThreshold = 1;
  private int softBounceThreshold = 3;

  public List<String> getExtraRules() {
    return extraRules;
  }

  public void setExtraRules(List<String> extraRules) {
    this.extraRules = extraRules;
  }

  public int getHardBounceThreshold() {
    return hardBounceThreshold;
  }

  public void setHardBounceThreshold(int hardBounceThreshold) {
    this.hardBounceThreshold = hardBounceThreshold;
  }

  public int getSoftBounceThreshold() {
    return softBounceThreshold;
  }

  public void setSoftBounceThreshold(int softBounceThreshold) {
    this.softBounceThreshold = softBounceThreshold;
  }
}
