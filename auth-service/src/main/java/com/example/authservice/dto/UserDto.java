package com.example.authservice.dto;

import com.example.authservice.entity.User;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * User DTO for API responses. Never carries the password hash.
 */
public record UserDto(
    @JsonProperty("id")
    Long id,

    @JsonProperty("email")
    String email,

    @JsonProperty("fullName")
    String fullName,

    @JsonProperty("role")
    String role,

    @JsonProperty("active")
    boolean active,

    @JsonProperty("createdAt")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'")
    LocalDateTime createdAt
) {
    public static UserDto fromEntity(User user) {
        return new UserDto(
            user.getId(),
            user.getEmail(),
            user.getFullName(),
            user.getRoleName(),
            user.isActive(),
            user.getCreatedAt()
        );
    }
}
