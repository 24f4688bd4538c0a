package dev.phonebook.contactsservice.security;

/**
 * Value of the {@code scope} claim. Email-verification tokens deliberately carry no scope,
 * so they have no constant here.
 */
public enum TokenScope {
    ACCESS("access_token"),
    REFRESH("refresh_token");

    private final String claimValue;

    TokenScope(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
