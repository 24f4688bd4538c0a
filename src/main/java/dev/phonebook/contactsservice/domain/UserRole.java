package dev.phonebook.contactsservice.domain;

public enum UserRole {
    admin,
    moderator,
    user
}
