package com.example.authservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Role settings bound from the {@code auth.*} keys.
 *
 * @param adminRole   role name that satisfies every permission
 * @param defaultRole role assigned on self-registration
 */
@ConfigurationProperties(prefix = "auth")
public record RbacProperties(String adminRole, String defaultRole) {

    public RbacProperties {
        if (adminRole == null || adminRole.isBlank()) {
            adminRole = "admin";
        }
        if (defaultRole == null || defaultRole.isBlank()) {
            defaultRole = "user";
        }
    }
}
