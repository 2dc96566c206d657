package com.acme.mailflow.spi;

import java.util.List;
import java.util.Optional;

public interface MailboxClient {

  /** Adds the given labels back to a message. */
  void restoreLabels(String userId, String messageId, List<String> labelIds) throws Exception;

  /** Looks up the conversation a message belongs to. */
  Optional<String> findThreadId(String userId, String messageId) throws Exception;
}
