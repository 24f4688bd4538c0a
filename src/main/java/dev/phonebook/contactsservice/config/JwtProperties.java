package dev.phonebook.contactsservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.security.jwt")
public record JwtProperties(
    String secret,
    String algorithm,
    long accessTokenExpirationSeconds,
    long refreshTokenExpirationSeconds,
    long emailTokenExpirationSeconds
) {
}
