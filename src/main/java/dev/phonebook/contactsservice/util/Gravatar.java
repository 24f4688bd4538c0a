package dev.phonebook.contactsservice.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class Gravatar {

    private static final String BASE_URL = "https://www.gravatar.com/avatar/";

    private Gravatar() {
    }

    /** Default avatar for a freshly registered account. */
    public static String urlFor(String email) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        try {
            // Gravatar addresses images by the MD5 of the normalized email.
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return BASE_URL + HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 is not available", ex);
        }
    }
}
