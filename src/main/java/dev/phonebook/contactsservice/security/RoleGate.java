package dev.phonebook.contactsservice.security;

import dev.phonebook.contactsservice.domain.UserRole;
import dev.phonebook.contactsservice.exception.ApiException;
import java.util.Set;

/** Route-level authorization: runs after authentication, before the handler does any work. */
public final class RoleGate {

    public static final String FORBIDDEN_MESSAGE = "FORBIDDEN";

    private RoleGate() {
    }

    public static void authorize(UserRole role, Set<UserRole> allowedRoles) {
        if (role == null || !allowedRoles.contains(role)) {
            throw ApiException.forbidden(FORBIDDEN_MESSAGE);
        }
    }
}
