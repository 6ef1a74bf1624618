package com.example.authservice.service;

import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.UserNotFoundException;
import com.example.authservice.store.PrincipalStore;
import com.example.authservice.store.RoleStore;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only views of principals and roles for administrators.
 * Permission checks happen at the controller.
 */
@Service
public class DirectoryService {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    private final PrincipalStore principalStore;
    private final RoleStore roleStore;

    public DirectoryService(PrincipalStore principalStore, RoleStore roleStore) {
        this.principalStore = principalStore;
        this.roleStore = roleStore;
    }

    /**
     * Users ordered by id. Out-of-range arguments are clamped: page to 0 or more,
     * size to 1..{@value #MAX_PAGE_SIZE}.
     */
    public Page<User> listUsers(int page, int size) {
        int boundedSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return principalStore.findAll(PageRequest.of(Math.max(page, 0), boundedSize, Sort.by("id")));
    }

    /**
     * @throws UserNotFoundException 404 if no principal has this id
     */
    public User getUser(Long id) {
        return principalStore.findById(id).orElseThrow(() -> new UserNotFoundException(id));
    }

    public List<Role> listRoles() {
        return roleStore.findAll();
    }
}
