package com.example.authservice.entity;

import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Role entity mapping to 'roles' table.
 *
 * A named, ordered set of permission strings. Permissions are an open
 * namespace ("read:self", "users:write", ...) checked by set membership.
 * Roles are read-only for this service.
 */
@Entity
@Table(name = "roles")
public class Role {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "role_permissions", joinColumns = @JoinColumn(name = "role_id"))
    @OrderColumn(name = "permission_order")
    @Column(name = "permission", nullable = false, length = 100)
    private List<String> permissions = new ArrayList<>();

    // Default constructor (JPA requirement)
    public Role() {
    }

    public Role(String name, String description, List<String> permissions) {
        this.name = name;
        this.description = description;
        this.permissions = new ArrayList<>(permissions);
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getPermissions() {
        return List.copyOf(permissions);
    }

    /**
     * Check if this role carries the given permission.
     */
    public boolean grants(String permission) {
        return permission != null && permissions.contains(permission);
    }
}
