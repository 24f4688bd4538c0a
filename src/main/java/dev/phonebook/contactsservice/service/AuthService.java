package dev.phonebook.contactsservice.service;

import dev.phonebook.contactsservice.domain.UserEntity;
import dev.phonebook.contactsservice.domain.UserRole;
import dev.phonebook.contactsservice.dto.SignupRequest;
import dev.phonebook.contactsservice.dto.TokenResponse;
import dev.phonebook.contactsservice.exception.ApiException;
import dev.phonebook.contactsservice.repository.UserStore;
import dev.phonebook.contactsservice.security.CredentialHasher;
import dev.phonebook.contactsservice.security.JwtService;
import dev.phonebook.contactsservice.util.BearerTokens;
import dev.phonebook.contactsservice.util.Gravatar;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Signup, login, refresh-token rotation and email confirmation.
 *
 * <p>Each user holds at most one refresh token. Login and refresh overwrite it; presenting any
 * other refresh token than the stored one clears it, so a stolen token that was already
 * rotated is noticed on its first reuse and the session has to log in again.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String ACCOUNT_EXISTS = "Account already exists";
    public static final String INVALID_EMAIL = "Invalid email";
    public static final String EMAIL_NOT_CONFIRMED = "Email not confirmed";
    public static final String INVALID_PASSWORD = "Invalid password";
    public static final String INVALID_REFRESH_TOKEN = "Invalid refresh token";
    public static final String VERIFICATION_ERROR = "Verification error";
    public static final String EMAIL_CONFIRMED = "Email confirmed";
    public static final String ALREADY_CONFIRMED = "Your email is already confirmed";
    public static final String CHECK_EMAIL = "Check your email for confirmation.";

    private final UserStore userStore;
    private final CredentialHasher credentialHasher;
    private final JwtService jwtService;
    private final VerificationMailer verificationMailer;
    private final AuthMetrics authMetrics;

    public AuthService(UserStore userStore,
                       CredentialHasher credentialHasher,
                       JwtService jwtService,
                       VerificationMailer verificationMailer,
                       AuthMetrics authMetrics) {
        this.userStore = userStore;
        this.credentialHasher = credentialHasher;
        this.jwtService = jwtService;
        this.verificationMailer = verificationMailer;
        this.authMetrics = authMetrics;
    }

    public UserEntity signup(SignupRequest request, String baseUrl) {
        if (userStore.findByEmail(request.email()).isPresent()) {
            throw ApiException.conflict(ACCOUNT_EXISTS);
        }

        UserEntity user = new UserEntity();
        user.setUsername(request.username());
        user.setEmail(request.email());
        user.setPasswordHash(credentialHasher.hash(request.password()));
        user.setAvatar(Gravatar.urlFor(request.email()));
        user.setRole(UserRole.user);
        user.setConfirmed(false);

        UserEntity saved;
        try {
            saved = userStore.create(user);
        } catch (DataIntegrityViolationException ex) {
            // Concurrent signup with the same email won the unique constraint.
            throw ApiException.conflict(ACCOUNT_EXISTS);
        }
        authMetrics.recordSignup();
        log.info("Registered user id={} email={}", saved.getId(), saved.getEmail());

        dispatchVerification(saved, baseUrl);
        return saved;
    }

    public TokenResponse login(String email, String password) {
        UserEntity user = userStore.findByEmail(email).orElse(null);
        if (user == null) {
            authMetrics.recordLoginFailed();
            throw ApiException.unauthorized(INVALID_EMAIL);
        }
        if (!user.isConfirmed()) {
            authMetrics.recordLoginFailed();
            throw ApiException.unauthorized(EMAIL_NOT_CONFIRMED);
        }
        if (!credentialHasher.verify(password, user.getPasswordHash())) {
            authMetrics.recordLoginFailed();
            throw ApiException.unauthorized(INVALID_PASSWORD);
        }

        TokenResponse tokens = issueTokenPair(user);
        authMetrics.recordLoginSucceeded();
        return tokens;
    }

    public TokenResponse refresh(String authorizationHeader) {
        String presented = BearerTokens.extract(authorizationHeader)
            .orElseThrow(() -> ApiException.unauthorized(JwtService.CREDENTIALS_ERROR));
        String email = jwtService.verifyRefreshToken(presented);
        UserEntity user = userStore.findByEmail(email)
            .orElseThrow(() -> ApiException.unauthorized(JwtService.CREDENTIALS_ERROR));

        String stored = user.getRefreshToken();
        if (stored == null) {
            // Already revoked or logged out; nothing left to clear.
            log.debug("Refresh attempted for user id={} with no stored refresh token", user.getId());
            throw ApiException.unauthorized(INVALID_REFRESH_TOKEN);
        }
        if (!sameToken(stored, presented)) {
            log.warn("Refresh token mismatch for user id={}, revoking stored refresh token", user.getId());
            authMetrics.recordRefreshReuseDetected();
            userStore.setRefreshToken(user, null);
            throw ApiException.unauthorized(INVALID_REFRESH_TOKEN);
        }

        TokenResponse tokens = issueTokenPair(user);
        authMetrics.recordRefreshRotated();
        return tokens;
    }

    public String confirmEmail(String token) {
        String email = jwtService.verifyEmailToken(token);
        UserEntity user = userStore.findByEmail(email)
            .orElseThrow(() -> ApiException.badRequest(VERIFICATION_ERROR));
        if (user.isConfirmed()) {
            return ALREADY_CONFIRMED;
        }
        userStore.setConfirmed(user);
        authMetrics.recordEmailConfirmed();
        log.info("Email confirmed for user id={}", user.getId());
        return EMAIL_CONFIRMED;
    }

    public String requestEmail(String email, String baseUrl) {
        Optional<UserEntity> user = userStore.findByEmail(email);
        if (user.isPresent() && user.get().isConfirmed()) {
            return ALREADY_CONFIRMED;
        }
        user.ifPresent(u -> dispatchVerification(u, baseUrl));
        return CHECK_EMAIL;
    }

    public UserEntity currentUser(String email) {
        return userStore.findByEmail(email)
            .orElseThrow(() -> ApiException.unauthorized(JwtService.CREDENTIALS_ERROR));
    }

    static String verificationLink(String baseUrl, String token) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/email/confirmed_email/" + token;
    }

    private TokenResponse issueTokenPair(UserEntity user) {
        String accessToken = jwtService.issueAccessToken(user.getEmail());
        String refreshToken = jwtService.issueRefreshToken(user.getEmail());
        userStore.setRefreshToken(user, refreshToken);
        return TokenResponse.bearer(accessToken, refreshToken);
    }

    private void dispatchVerification(UserEntity user, String baseUrl) {
        try {
            String link = verificationLink(baseUrl, jwtService.issueEmailToken(user.getEmail()));
            verificationMailer.sendVerification(user.getEmail(), user.getUsername(), link);
        } catch (RuntimeException ex) {
            log.warn("Could not dispatch verification email to {}: {}", user.getEmail(), ex.getMessage());
        }
    }

    private static boolean sameToken(String stored, String presented) {
        return MessageDigest.isEqual(
            stored.getBytes(StandardCharsets.UTF_8),
            presented.getBytes(StandardCharsets.UTF_8));
    }
}
