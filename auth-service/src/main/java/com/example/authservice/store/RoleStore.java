package com.example.authservice.store;

import com.example.authservice.entity.Role;

import java.util.List;
import java.util.Optional;

/**
 * Read-only role lookup used for permission resolution.
 */
public interface RoleStore {

    Optional<Role> findByName(String name);

    /**
     * @return every role, ordered by name
     */
    List<Role> findAll();
}
