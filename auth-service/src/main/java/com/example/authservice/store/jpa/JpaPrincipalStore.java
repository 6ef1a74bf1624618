package com.example.authservice.store.jpa;

import com.example.authservice.entity.User;
import com.example.authservice.exception.EmailAlreadyExistsException;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.store.PrincipalStore;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * {@link PrincipalStore} backed by the users table.
 */
@Component
public class JpaPrincipalStore implements PrincipalStore {

    private static final String STORE = "Principal store";

    private final UserRepository userRepository;

    public JpaPrincipalStore(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return StoreCalls.guard(STORE, () -> userRepository.findByEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(Long id) {
        return StoreCalls.guard(STORE, () -> userRepository.findById(id));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<User> findAll(Pageable pageable) {
        return StoreCalls.guard(STORE, () -> userRepository.findAll(pageable));
    }

    @Override
    @Transactional
    public User create(User user) {
        // DB UNIQUE constraint handles the registration race
        try {
            return StoreCalls.guard(STORE, () -> userRepository.saveAndFlush(user));
        } catch (DataIntegrityViolationException ex) {
            throw new EmailAlreadyExistsException();
        }
    }

    @Override
    @Transactional
    public void updatePasswordHash(Long id, String passwordHash) {
        StoreCalls.run(STORE, () -> userRepository.updatePasswordHash(id, passwordHash, LocalDateTime.now()));
    }

    @Override
    @Transactional
    public void recordLogin(Long id) {
        StoreCalls.run(STORE, () -> userRepository.updateLastLogin(id, LocalDateTime.now()));
    }
}
