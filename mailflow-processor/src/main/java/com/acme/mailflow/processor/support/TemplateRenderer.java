package com.acme.mailflow.processor.support;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Replaces {@code {{ field }}} merge fields; unknown fields render as an empty string. */
public final class TemplateRenderer {

  private static final Pattern FIELD = Pattern.compile("\\{\\{\\s*([\\w.-]+)\\s*}}");
  private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

  private TemplateRenderer() {}

  public static String render(String template, Map<String, ?> data) {
    if (template == null) {
      return "";
    }
    String cleaned = CONTROL.matcher(template).replaceAll("");
    Matcher m = FIELD.matcher(cleaned);
    StringBuilder out = new StringBuilder();
    while (m.find()) {
      Object value = data == null ? null : data.get(m.group(1));
      String replacement =
          value == null ? "" : CONTROL.matcher(String.valueOf(value).trim()).replaceAll("");
      m.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(out);
    return out.toString();
  }
}
