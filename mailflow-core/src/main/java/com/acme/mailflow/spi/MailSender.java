package com.acme.mailflow.spi;

/** Sends mail through the user's connected mailbox provider. */
public interface MailSender {

  SentMail send(OutgoingMail mail) throws Exception;
}
