package com.example.authservice.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Configuration;

/**
 * In-process caches (Spring Boot's simple ConcurrentMap provider).
 *
 * {@value #ROLES}: role name to role, filled on first permission check. Roles are
 * not edited through this service.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ROLES = "roles";
}
