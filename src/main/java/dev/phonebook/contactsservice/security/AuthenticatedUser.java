package dev.phonebook.contactsservice.security;

import dev.phonebook.contactsservice.domain.UserEntity;
import dev.phonebook.contactsservice.domain.UserRole;

public record AuthenticatedUser(Long id, String username, String email, UserRole role) {

    public static AuthenticatedUser from(UserEntity user) {
        return new AuthenticatedUser(user.getId(), user.getUsername(), user.getEmail(), user.getRole());
    }
}
