package com.example.authservice.store.jpa;

import com.example.authservice.exception.UpstreamUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.util.function.Supplier;

/**
 * Maps timeouts and connectivity failures of the relational store to
 * {@link UpstreamUnavailableException}. Other data access errors propagate unchanged.
 */
final class StoreCalls {

    private StoreCalls() {
    }

    static <T> T guard(String store, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            throw new UpstreamUnavailableException(store + " unavailable", e);
        }
    }

    static void run(String store, Runnable call) {
        guard(store, () -> {
            call.run();
            return null;
        });
    }
}
