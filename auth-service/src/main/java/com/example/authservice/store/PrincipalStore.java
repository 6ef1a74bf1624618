package com.example.authservice.store;

import com.example.authservice.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.Optional;

/**
 * Read path (plus credential writes) into principal records.
 *
 * Implementations bound every call with a timeout and raise
 * {@link com.example.authservice.exception.UpstreamUnavailableException} when
 * the store cannot answer.
 */
public interface PrincipalStore {

    /**
     * @param email already normalized email
     */
    Optional<User> findByEmail(String email);

    Optional<User> findById(Long id);

    Page<User> findAll(Pageable pageable);

    /**
     * @throws com.example.authservice.exception.EmailAlreadyExistsException on duplicate email
     */
    User create(User user);

    void updatePasswordHash(Long id, String passwordHash);

    void recordLogin(Long id);
}
