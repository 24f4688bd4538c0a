package dev.phonebook.contactsservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.phonebook.contactsservice.domain.ContactEntity;
import java.time.LocalDate;

public record ContactResponse(
    Long id,
    String fullname,
    String email,
    @JsonProperty("phone_number") String phoneNumber,
    LocalDate birthday
) {
    public static ContactResponse from(ContactEntity contact) {
        return new ContactResponse(
            contact.getId(), contact.getFullname(), contact.getEmail(), contact.getPhoneNumber(), contact.getBirthday());
    }
}
