package dev.phonebook.contactsservice.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AuthMetrics {

    private final Counter signups;
    private final Counter loginSucceeded;
    private final Counter loginFailed;
    private final Counter refreshRotated;
    private final Counter refreshReuseDetected;
    private final Counter emailConfirmed;

    public AuthMetrics(MeterRegistry registry) {
        this.signups = Counter.builder("auth.signup.total")
            .description("Accounts registered")
            .register(registry);
        this.loginSucceeded = Counter.builder("auth.login.total")
            .tag("outcome", "success")
            .description("Login attempts")
            .register(registry);
        this.loginFailed = Counter.builder("auth.login.total")
            .tag("outcome", "failure")
            .description("Login attempts")
            .register(registry);
        this.refreshRotated = Counter.builder("auth.refresh.rotated.total")
            .description("Refresh tokens rotated")
            .register(registry);
        this.refreshReuseDetected = Counter.builder("auth.refresh.reuse.total")
            .description("Refresh tokens presented after rotation; the session was revoked")
            .register(registry);
        this.emailConfirmed = Counter.builder("auth.email.confirmed.total")
            .description("Email addresses confirmed")
            .register(registry);
    }

    public void recordSignup() { signups.increment(); }
    public void recordLoginSucceeded() { loginSucceeded.increment(); }
    public void recordLoginFailed() { loginFailed.increment(); }
    public void recordRefreshRotated() { refreshRotated.increment(); }
    public void recordRefreshReuseDetected() { refreshReuseDetected.increment(); }
    public void recordEmailConfirmed() { emailConfirmed.increment(); }
}
