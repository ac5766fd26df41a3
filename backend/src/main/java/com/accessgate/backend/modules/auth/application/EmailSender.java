package com.accessgate.backend.modules.auth.application;

/**
 * Outbound mail collaborator. Implementations report delivery problems by throwing.
 */
public interface EmailSender {

    void send(String to, String subject, String htmlBody, String textBody);
}
