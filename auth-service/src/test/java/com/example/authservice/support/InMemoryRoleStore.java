package com.example.authservice.support;

import com.example.authservice.entity.Role;
import com.example.authservice.store.RoleStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRoleStore implements RoleStore {

    private final Map<String, Role> roles = new ConcurrentHashMap<>();

    public InMemoryRoleStore with(String name, String... permissions) {
        roles.put(name, new Role(name, null, List.of(permissions)));
        return this;
    }

    @Override
    public Optional<Role> findByName(String name) {
        return Optional.ofNullable(roles.get(name));
    }

    @Override
    public List<Role> findAll() {
        return roles.values().stream().sorted(Comparator.comparing(Role::getName)).toList();
    }
}
