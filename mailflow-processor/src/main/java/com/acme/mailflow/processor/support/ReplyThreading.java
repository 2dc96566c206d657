package com.acme.mailflow.processor.support;

import com.acme.mailflow.spi.MailboxClient;
import jakarta.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves the thread an outgoing message replies into. */
@Singleton
public class ReplyThreading {
  private static final Logger LOG = LoggerFactory.getLogger(ReplyThreading.class);

  private final MailboxClient mailbox;
  private final CollaboratorInvoker invoker;

  public ReplyThreading(MailboxClient mailbox, CollaboratorInvoker invoker) {
    this.mailbox = mailbox;
    this.invoker = invoker;
  }

  /**
   * A known thread id wins; otherwise the provider is asked for the thread of {@code messageId}.
   * A failed lookup sends the message as a new thread.
   */
  public Optional<ReplyThread> resolve(String userId, String threadId, String messageId) {
    if (threadId != null && !threadId.isBlank()) {
      return Optional.of(new ReplyThread(threadId, messageId));
    }
    if (messageId == null || messageId.isBlank()) {
      return Optional.empty();
    }
    try {
      return invoker
          .call("find thread of " + messageId, () -> mailbox.findThreadId(userId, messageId))
          .map(found -> new ReplyThread(found, messageId));
    } catch (Exception e) {
      LOG.warn("Thread lookup failed user={} messageId={}, sending as new thread: {}",
          userId, messageId, e.getMessage());
      return Optional.empty();
    }
  }

  public static String replySubject(String subject) {
    String s = subject == null ? "" : subject;
    if (s.toLowerCase(Locale.ROOT).startsWith("re:")) {
      return s;
    }
    return "Re: " + s;
  }

  public record ReplyThread(String threadId, String inReplyTo) {

    public Map<String, String> headers() {
      Map<String, String> headers = new LinkedHashMap<>();
      if (inReplyTo != null && !inReplyTo.isBlank()) {
        headers.put("In-Reply-To", inReplyTo);
        headers.put("References", inReplyTo);
      }
      return headers;
    }
  }
}
