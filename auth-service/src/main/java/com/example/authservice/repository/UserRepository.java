package com.example.authservice.repository;

import com.example.authservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Repository for User entity.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find user by normalized email (for login and password reset).
     */
    Optional<User> findByEmail(String email);

    @Modifying
    @Query("UPDATE User u SET u.passwordHash = :passwordHash, u.updatedAt = :now WHERE u.id = :id")
    int updatePasswordHash(@Param("id") Long id,
                           @Param("passwordHash") String passwordHash,
                           @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE User u SET u.lastLoginAt = :now WHERE u.id = :id")
    int updateLastLogin(@Param("id") Long id, @Param("now") LocalDateTime now);
}
