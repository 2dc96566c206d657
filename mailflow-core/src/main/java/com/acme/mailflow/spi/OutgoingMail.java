package com.acme.mailflow.spi;

import java.util.List;
import java.util.Map;

/**
 * A message to send from a user's mailbox. {@code threadId} is set for replies so the provider
 * files the message in the existing conversation.
 */
public record OutgoingMail(
    String userId,
    String to,
    List<String> cc,
    List<String> bcc,
    String subject,
    String html,
    Map<String, String> headers,
    String threadId) {

  public static OutgoingMail simple(String userId, String to, String subject, String html) {
    return new OutgoingMail(userId, to, List.of(), List.of(), subject, html, Map.of(), null);
  }
}
