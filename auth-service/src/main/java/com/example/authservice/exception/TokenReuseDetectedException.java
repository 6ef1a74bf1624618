package com.example.authservice.exception;

/**
 * Security event: a superseded refresh token was replayed.
 * The token family has already been revoked when this is thrown.
 */
public class TokenReuseDetectedException extends TokenInvalidException {

    public TokenReuseDetectedException() {
        super("Token reuse detected");
    }
}
