package com.example.authservice.service;

import com.example.authservice.entity.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier used until a mail transport is wired in. Records the
 * dispatch without the token itself.
 */
@Component
public class LoggingPasswordResetNotifier implements PasswordResetNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingPasswordResetNotifier.class);

    @Override
    public void send(User user, String resetToken) {
        log.info("Password reset requested for user {}; token dispatch delegated to mail transport", user.getId());
    }
}
