package com.example.authservice.store.jpa;

import com.example.authservice.config.CacheConfig;
import com.example.authservice.entity.Role;
import com.example.authservice.repository.RoleRepository;
import com.example.authservice.store.RoleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringJUnitConfig(JpaRoleStoreTest.TestConfig.class)
class JpaRoleStoreTest {

    @Configuration
    @Import(CacheConfig.class)
    static class TestConfig {

        @Bean
        CacheManager cacheManager() {
            return new ConcurrentMapCacheManager(CacheConfig.ROLES);
        }

        @Bean
        RoleRepository roleRepository() {
            return mock(RoleRepository.class);
        }

        @Bean
        JpaRoleStore jpaRoleStore(RoleRepository roleRepository) {
            return new JpaRoleStore(roleRepository);
        }
    }

    @Autowired
    private RoleStore store;

    @Autowired
    private RoleRepository roleRepository;

    @Autowired
    private CacheManager cacheManager;

    @BeforeEach
    void setUp() {
        reset(roleRepository);
        cacheManager.getCache(CacheConfig.ROLES).clear();
    }

    @Test
    void repeatedLookupsHitTheDatabaseOnce() {
        when(roleRepository.findByName("editor"))
                .thenReturn(Optional.of(new Role("editor", null, List.of("documents:write"))));

        Optional<Role> first = store.findByName("editor");
        Optional<Role> second = store.findByName("editor");

        assertTrue(first.isPresent());
        assertTrue(second.orElseThrow().grants("documents:write"));
        verify(roleRepository, times(1)).findByName("editor");
    }

    @Test
    void unknownRoleIsCachedAsAbsent() {
        when(roleRepository.findByName("ghost")).thenReturn(Optional.empty());

        assertTrue(store.findByName("ghost").isEmpty());
        assertTrue(store.findByName("ghost").isEmpty());

        verify(roleRepository, times(1)).findByName("ghost");
    }
}
