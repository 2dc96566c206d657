package com.acme.mailflow.bounce;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Matches when the lower-cased provider response contains any of the phrases. */
public record BounceRule(List<String> phrases, BounceType type, BounceCategory category) {

  public BounceRule {
    phrases = phrases.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
  }

  public static BounceRule of(BounceType type, BounceCategory category, String... phrases) {
    return new BounceRule(List.of(phrases), type, category);
  }

  /** Parses {@code TYPE:CATEGORY:phrase one|phrase two}. */
  public static BounceRule parse(String text) {
    String[] parts = text.split(":", 3);
    if (parts.length != 3 || parts[2].isBlank()) {
      throw new IllegalArgumentException("Bounce rule must read TYPE:CATEGORY:phrases, got: " + text);
    }
    List<String> phrases =
        Arrays.stream(parts[2].split("\\|")).map(String::trim).filter(p -> !p.isEmpty()).toList();
    return new BounceRule(
        phrases,
        BounceType.valueOf(parts[0].trim().toUpperCase(Locale.ROOT)),
        BounceCategory.valueOf(parts[1].trim().toUpperCase(Locale.ROOT)));
  }

  boolean matches(String lowerCased) {
    return phrases.stream().anyMatch(lowerCased::contains);
  }
}
