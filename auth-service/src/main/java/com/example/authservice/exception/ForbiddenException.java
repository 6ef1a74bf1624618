package com.example.authservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the caller is authenticated but its role lacks a permission.
 * Response: 403 Forbidden
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class ForbiddenException extends RuntimeException {

    private final String permission;

    public ForbiddenException(String permission) {
        super("Missing permission: " + permission);
        this.permission = permission;
    }

    public String getPermission() {
        return permission;
    }
}
