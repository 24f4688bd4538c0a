package dev.phonebook.contactsservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

public record ContactRequest(
    @NotBlank(message = "fullname is required")
    @Size(max = 100, message = "fullname must be at most 100 characters")
    String fullname,

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    @Size(max = 150)
    String email,

    @JsonProperty("phone_number")
    @NotBlank(message = "phone_number is required")
    @Size(max = 30, message = "phone_number must be at most 30 characters")
    String phoneNumber,

    @NotNull(message = "birthday is required")
    @PastOrPresent(message = "birthday cannot be in the future")
    LocalDate birthday
) {
}
