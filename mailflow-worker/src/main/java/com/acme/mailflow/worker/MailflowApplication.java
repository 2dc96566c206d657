package com.acme.mailflow.worker;

import io.micronaut.runtime.Micronaut;

/**
 * Mailflow worker - hosts the job queues, their workers and the promotion pollers behind a small
 * HTTP surface for health checks. Several instances can share one Redis broker.
 */
public class MailflowApplication {
    public static void main(String[] args) {
        Micronaut.run(MailflowApplication.class, args);
    }
}
