package com.example.authservice.exception;

/**
 * Thrown when a token is structurally invalid, unsigned, misses mandatory
 * claims or is presented where another token type is expected.
 */
public class MalformedTokenException extends TokenInvalidException {

    public MalformedTokenException() {
        super("Token malformed");
    }

    public MalformedTokenException(String message) {
        super(message);
    }
}
