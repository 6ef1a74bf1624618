package com.example.authservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the relational store or the revocation store times out or is unreachable.
 * Token checks fail closed: callers never fall back to "not revoked".
 * Response: 503 Service Unavailable
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
