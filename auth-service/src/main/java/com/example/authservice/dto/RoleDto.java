package com.example.authservice.dto;

import com.example.authservice.entity.Role;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Role DTO for API responses.
 */
public record RoleDto(
    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("permissions")
    List<String> permissions
) {
    public static RoleDto fromEntity(Role role) {
        return new RoleDto(role.getName(), role.getDescription(), role.getPermissions());
    }
}
