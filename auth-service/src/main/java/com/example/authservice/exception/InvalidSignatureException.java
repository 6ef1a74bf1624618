package com.example.authservice.exception;

/**
 * Thrown when a token was tampered with or signed by an untrusted key.
 */
public class InvalidSignatureException extends TokenInvalidException {

    public InvalidSignatureException() {
        super("Token signature invalid");
    }
}
