package com.example.authservice.exception;

/**
 * Thrown when token is expired.
 * Response: 401 Unauthorized - "Token expired"
 */
public class TokenExpiredException extends TokenInvalidException {

    public TokenExpiredException() {
        super("Token expired");
    }
}
