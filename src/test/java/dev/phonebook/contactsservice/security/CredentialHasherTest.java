package dev.phonebook.contactsservice.security;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class CredentialHasherTest {

    private final CredentialHasher hasher = new CredentialHasher(new BCryptPasswordEncoder(4));

    @Test
    void hash_thenVerify() {
        String hash = hasher.hash("s3cret-pass");

        assertNotEquals("s3cret-pass", hash);
        assertTrue(hash.startsWith("$2"));
        assertTrue(hasher.verify("s3cret-pass", hash));
        assertFalse(hasher.verify("wrong-pass", hash));
    }

    @Test
    void hash_isSalted() {
        assertNotEquals(hasher.hash("same"), hasher.hash("same"));
    }

    @Test
    void verify_malformedOrMissingHash_returnsFalse() {
        assertFalse(hasher.verify("pass", "not-a-bcrypt-hash"));
        assertFalse(hasher.verify("pass", null));
        assertFalse(hasher.verify("pass", ""));
        assertFalse(hasher.verify(null, hasher.hash("pass")));
    }
}
