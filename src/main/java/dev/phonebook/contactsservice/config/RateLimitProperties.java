package dev.phonebook.contactsservice.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-route request quotas. A rule matches on HTTP method and exact request path;
 * requests that match no rule are never limited.
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(List<Rule> rules) {

    public RateLimitProperties {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public record Rule(String method, String path, int times, int seconds) {
        public boolean matches(String requestMethod, String requestPath) {
            return method.equalsIgnoreCase(requestMethod) && path.equals(requestPath);
        }
    }
}
