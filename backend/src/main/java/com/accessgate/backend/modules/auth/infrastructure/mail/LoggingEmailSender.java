package com.accessgate.backend.modules.auth.infrastructure.mail;

import com.accessgate.backend.modules.auth.application.EmailSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes outgoing mail to the application log instead of delivering it.
 */
@Component
public class LoggingEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    private final String from;

    public LoggingEmailSender(@Value("${app.mail.from:no-reply@accessgate.local}") String from) {
        this.from = from;
    }

    @Override
    public void send(String to, String subject, String htmlBody, String textBody) {
        log.info("Mail from={} to={} subject=\"{}\"", from, to, subject);
        log.debug("Mail body:\n{}", textBody);
    }
}
