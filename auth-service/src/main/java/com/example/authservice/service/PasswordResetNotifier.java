package com.example.authservice.service;

import com.example.authservice.entity.User;

/**
 * Delivers a password reset token to its owner (e.g. by email).
 */
public interface PasswordResetNotifier {

    void send(User user, String resetToken);
}
