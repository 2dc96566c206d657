package com.acme.mailflow.bounce;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies raw delivery errors into bounce type and category. Rules are evaluated in order; the
 * first match wins and unmatched errors are treated as soft.
 */
public class BounceClassifier {

  public static final List<BounceRule> DEFAULT_RULES =
      List.of(
          BounceRule.of(
              BounceType.HARD,
              BounceCategory.INVALID_EMAIL,
              "invalid",
              "does not exist",
              "no such user",
              "user unknown",
              "address rejected"),
          BounceRule.of(
              BounceType.SOFT,
              BounceCategory.MAILBOX_FULL,
              "mailbox full",
              "quota exceeded",
              "over quota"),
          BounceRule.of(
              BounceType.SOFT, BounceCategory.MESSAGE_TOO_LARGE, "too large", "message size"),
          BounceRule.of(BounceType.HARD, BounceCategory.BLOCKED, "blocked", "spam"));

  private final List<BounceRule> rules;

  public BounceClassifier(List<BounceRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static BounceClassifier defaults() {
    return new BounceClassifier(DEFAULT_RULES);
  }

  /** Builds a classifier whose extra rules take precedence over the defaults. */
  public static BounceClassifier withExtraRules(List<BounceRule> extra) {
    List<BounceRule> all = new ArrayList<>(extra);
    all.addAll(DEFAULT_RULES);
    return new BounceClassifier(all);
  }

  public BounceClassification classify(String rawError) {
    String raw = rawError == null ? "" : rawError;
    String lower = raw.toLowerCase(Locale.ROOT);
    for (BounceRule rule : rules) {
      if (rule.matches(lower)) {
        return new BounceClassification(rule.type(), rule.category(), raw);
      }
    }
    return new BounceClassification(BounceType.SOFT, BounceCategory.OTHER, raw);
  }

  public List<BounceRule> rules() {
    return rules;
  }
}
