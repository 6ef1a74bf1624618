package com.example.authservice.service;

import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.UserNotFoundException;
import com.example.authservice.support.AuthFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryServiceTest {

    private AuthFixture fixture;
    private DirectoryService service;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
        service = new DirectoryService(fixture.principals, fixture.roles);
        fixture.createUser("a@b.com", "Passw0rd!", "user");
        fixture.createUser("c@d.com", "Passw0rd!", "editor");
    }

    @Test
    void pageSizeIsClampedToAllowedRange() {
        assertEquals(DirectoryService.MAX_PAGE_SIZE, service.listUsers(0, 1000).getSize());
        assertEquals(1, service.listUsers(0, 0).getSize());
    }

    @Test
    void negativePageStartsAtFirstPage() {
        Page<User> page = service.listUsers(-3, 1);

        assertEquals(0, page.getNumber());
        assertEquals("a@b.com", page.getContent().get(0).getEmail());
        assertEquals(2, page.getTotalPages());
    }

    @Test
    void unknownUserIsNotFound() {
        assertThrows(UserNotFoundException.class, () -> service.getUser(42L));
    }

    @Test
    void rolesAreListedByName() {
        List<String> names = service.listRoles().stream().map(Role::getName).toList();

        assertEquals(List.of("editor", "user"), names);
    }
}
