package com.acme.mailflow.domain;

/** Threading hints stored with a scheduled email. */
public record ReplyMetadata(boolean sendAsReply, String replyToMessageId, String replyToThreadId) {

  public static final ReplyMetadata NONE = new ReplyMetadata(false, null, null);
}
