package dev.phonebook.contactsservice.dto;

import dev.phonebook.contactsservice.domain.UserEntity;

public record UserResponse(
    Long id,
    String username,
    String email,
    String avatar,
    String role
) {
    public static UserResponse from(UserEntity user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getEmail(), user.getAvatar(), user.getRole().name());
    }
}
