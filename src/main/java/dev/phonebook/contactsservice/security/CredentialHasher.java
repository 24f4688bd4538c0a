package dev.phonebook.contactsservice.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

@Component
public class CredentialHasher {

    private static final Logger log = LoggerFactory.getLogger(CredentialHasher.class);

    private final PasswordEncoder passwordEncoder;

    public CredentialHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String password) {
        return passwordEncoder.encode(password);
    }

    /** Never throws: a null or malformed stored hash simply does not match. */
    public boolean verify(String plainPassword, String hashedPassword) {
        if (plainPassword == null || hashedPassword == null || hashedPassword.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plainPassword, hashedPassword);
        } catch (IllegalArgumentException ex) {
            log.debug("Stored password hash could not be checked: {}", ex.getMessage());
            return false;
        }
    }
}
