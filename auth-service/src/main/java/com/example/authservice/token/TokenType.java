package com.example.authservice.token;

import com.example.authservice.exception.MalformedTokenException;

/**
 * Value of the {@code type} claim. Each kind is accepted only where it belongs.
 */
public enum TokenType {

    ACCESS("access"),
    REFRESH("refresh"),
    PASSWORD_RESET("password-reset");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static TokenType fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return type;
            }
        }
        throw new MalformedTokenException("Unknown token type");
    }
}
