package dev.phonebook.contactsservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
    @NotBlank(message = "username is required")
    @Size(min = 3, max = 50, message = "username must be 3-50 characters")
    String username,

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    @Size(max = 150)
    String email,

    @NotBlank(message = "password is required")
    @Size(min = 6, max = 72, message = "password must be 6-72 characters")
    String password
) {
}
