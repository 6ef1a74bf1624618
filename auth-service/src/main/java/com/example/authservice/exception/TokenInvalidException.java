package com.example.authservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Base type for every token-validity failure (the caller is unauthenticated).
 * Response: 401 Unauthorized.
 *
 * Subclasses narrow the reason: signature, structure, expiry, revocation, reuse.
 */
@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class TokenInvalidException extends RuntimeException {

    public TokenInvalidException() {
        super("Token invalid");
    }

    public TokenInvalidException(String message) {
        super(message);
    }
}
