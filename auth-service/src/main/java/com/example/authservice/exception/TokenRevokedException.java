package com.example.authservice.exception;

/**
 * Thrown when a token is blacklisted, its refresh record is revoked or missing,
 * or its whole family has been revoked.
 */
public class TokenRevokedException extends TokenInvalidException {

    public TokenRevokedException() {
        super("Token revoked");
    }

    public TokenRevokedException(String message) {
        super(message);
    }
}
