package com.acme.mailflow.worker.provider;

import com.acme.mailflow.spi.MailboxClient;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Dry-run mailbox: label changes are logged and thread lookups find nothing. */
@Singleton
@Secondary
@Slf4j
public class LoggingMailboxClient implements MailboxClient {

  @Override
  public void restoreLabels(String userId, String messageId, List<String> labelIds) {
    log.info("Dry-run label restore userId={} messageId={} labels={}", userId, messageId, labelIds);
  }

  @Override
  public Optional<String> findThreadId(String userId, String messageId) {
    log.debug("Dry-run thread lookup userId={} messageId={}", userId, messageId);
    return Optional.empty();
  }
}
