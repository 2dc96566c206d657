package com.acme.mailflow.reputation;

import java.util.Optional;

/**
 * Pure reputation arithmetic: rates, score bands, standing and sending limits. Same inputs always
 * give the same outputs.
 */
public final class ReputationCalculator {

  public static final int WARMUP_START_VOLUME = 50;
  public static final double WARMUP_GROWTH = 1.5;
  public static final int MAX_DAILY_VOLUME = 10_000;
  public static final int WARMUP_DAYS = 30;
  public static final int LOW_SCORE = 50;

  private static final SendingLimits UNKNOWN_DOMAIN = new SendingLimits(50, 5, true);

  private ReputationCalculator() {}

  public static ReputationMetrics calculate(
      long sent, long delivered, long bounced, long complained, long opened, long clicked) {
    double bounceRate = percent(bounced, sent);
    double complaintRate = percent(complained, sent);
    double openRate = percent(opened, delivered);
    double clickRate = percent(clicked, delivered);
    return new ReputationMetrics(
        bounceRate, complaintRate, openRate, clickRate,
        score(bounceRate, complaintRate, openRate, clickRate));
  }

  public static int score(double bounceRate, double complaintRate, double openRate, double clickRate) {
    int score = 100;

    if (bounceRate > 5) {
      score -= 50;
    } else if (bounceRate > 2) {
      score -= 25;
    } else if (bounceRate > 1) {
      score -= 10;
    }

    if (complaintRate > 0.5) {
      score -= 40;
    } else if (complaintRate > 0.1) {
      score -= 20;
    } else if (complaintRate > 0.05) {
      score -= 10;
    }

    score = Math.max(0, score);

    if (openRate > 30) {
      score += 5;
    }
    if (clickRate > 5) {
      score += 5;
    }
    return Math.min(100, score);
  }

  public static boolean isGoodStanding(Optional<DomainReputation> reputation) {
    if (reputation.isEmpty()) {
      return true;
    }
    DomainReputation r = reputation.get();
    return r.bounceRate() <= 5 && r.complaintRate() <= 0.5 && r.reputationScore() >= LOW_SCORE;
  }

  /**
   * Daily and hourly ceilings. Domains in warm-up grow by half per completed warm-up period,
   * mature domains are bucketed by score.
   */
  public static SendingLimits sendingLimits(Optional<DomainReputation> reputation, int warmupDays) {
    if (reputation.isEmpty()) {
      return UNKNOWN_DOMAIN;
    }
    DomainReputation r = reputation.get();
    if (r.inWarmup()) {
      int daily = warmupDailyLimit(warmupDays);
      return new SendingLimits(daily, daily / 24, true);
    }
    int daily;
    if (r.reputationScore() < 50) {
      daily = 100;
    } else if (r.reputationScore() < 75) {
      daily = 1_000;
    } else if (r.reputationScore() < 90) {
      daily = 5_000;
    } else {
      daily = MAX_DAILY_VOLUME;
    }
    return new SendingLimits(daily, daily / 24, false);
  }

  public static int warmupDailyLimit(int warmupDays) {
    return (int)
        Math.floor(Math.min(MAX_DAILY_VOLUME, WARMUP_START_VOLUME * Math.pow(WARMUP_GROWTH, warmupDays)));
  }

  /** Target for the warm-up day after one with {@code previousTarget}. */
  public static int nextWarmupTarget(int previousTarget) {
    return (int) Math.min(MAX_DAILY_VOLUME, Math.floor(previousTarget * WARMUP_GROWTH));
  }

  private static double percent(long part, long whole) {
    return whole > 0 ? (double) part / whole * 100 : 0;
  }
}
