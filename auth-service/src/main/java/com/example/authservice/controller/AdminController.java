package com.example.authservice.controller;

import com.example.authservice.dto.PageResponse;
import com.example.authservice.dto.RoleDto;
import com.example.authservice.dto.UserDto;
import com.example.authservice.service.DirectoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin read endpoints. Principals and roles are not edited through this service.
 *
 * Each endpoint is gated by a permission; the admin role passes every check.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final DirectoryService directoryService;

    public AdminController(DirectoryService directoryService) {
        this.directoryService = directoryService;
    }

    /**
     * GET /api/admin/users?page=0&size=20
     *
     * @return 200 OK with one page of users, ordered by id
     */
    @GetMapping("/users")
    @PreAuthorize("@rbac.hasPermission(authentication, 'users:read')")
    public ResponseEntity<PageResponse<UserDto>> listUsers(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        return ResponseEntity.ok(PageResponse.of(directoryService.listUsers(page, size), UserDto::fromEntity));
    }

    /**
     * GET /api/admin/users/{id}
     *
     * @throws com.example.authservice.exception.UserNotFoundException 404 Not Found
     */
    @GetMapping("/users/{id}")
    @PreAuthorize("@rbac.hasPermission(authentication, 'users:read')")
    public ResponseEntity<UserDto> getUser(@PathVariable("id") Long id) {
        return ResponseEntity.ok(UserDto.fromEntity(directoryService.getUser(id)));
    }

    @GetMapping("/roles")
    @PreAuthorize("@rbac.hasPermission(authentication, 'roles:read')")
    public ResponseEntity<List<RoleDto>> listRoles() {
        return ResponseEntity.ok(directoryService.listRoles().stream().map(RoleDto::fromEntity).toList());
    }
}
