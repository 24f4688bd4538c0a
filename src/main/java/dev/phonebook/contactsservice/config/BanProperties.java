package dev.phonebook.contactsservice.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.security.ban")
public record BanProperties(List<String> ips, List<String> userAgentPatterns) {

    public BanProperties {
        ips = ips == null ? List.of() : List.copyOf(ips);
        userAgentPatterns = userAgentPatterns == null ? List.of() : List.copyOf(userAgentPatterns);
    }
}
