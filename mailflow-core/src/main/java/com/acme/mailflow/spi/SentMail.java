package com.acme.mailflow.spi;

public record SentMail(String messageId, String threadId) {}
