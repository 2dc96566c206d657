package com.acme.mailflow.worker.provider;

import com.acme.mailflow.spi.MailSender;
import com.acme.mailflow.spi.OutgoingMail;
import com.acme.mailflow.spi.SentMail;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Dry-run sender used until a mailbox provider integration is deployed alongside the worker. It
 * logs the message and reports a generated message id.
 */
@Singleton
@Secondary
@Slf4j
public class LoggingMailSender implements MailSender {

  @Override
  public SentMail send(OutgoingMail mail) {
    String messageId = "<" + UUID.randomUUID() + "@mailflow.local>";
    String threadId = mail.threadId() != null ? mail.threadId() : messageId;
    log.info("Dry-run send userId={} to={} subject='{}' threadId={} messageId={}",
        mail.userId(), mail.to(), mail.subject(), threadId, messageId);
    return new SentMail(messageId, threadId);
  }
}
