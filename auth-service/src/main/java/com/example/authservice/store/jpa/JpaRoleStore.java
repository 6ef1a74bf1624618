package com.example.authservice.store.jpa;

import com.example.authservice.config.CacheConfig;
import com.example.authservice.entity.Role;
import com.example.authservice.repository.RoleRepository;
import com.example.authservice.store.RoleStore;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link RoleStore} backed by the roles table.
 *
 * Roles are read-only here, so name lookups on the authorization path are cached.
 */
@Component
public class JpaRoleStore implements RoleStore {

    private static final String STORE = "Role store";

    private final RoleRepository roleRepository;

    public JpaRoleStore(RoleRepository roleRepository) {
        this.roleRepository = roleRepository;
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.ROLES, key = "#name", sync = true)
    @Transactional(readOnly = true)
    public Optional<Role> findByName(String name) {
        return StoreCalls.guard(STORE, () -> roleRepository.findByName(name));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Role> findAll() {
        return StoreCalls.guard(STORE, () -> roleRepository.findAll(Sort.by("name")));
    }
}
