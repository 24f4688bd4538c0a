package dev.phonebook.contactsservice.security;

import dev.phonebook.contactsservice.domain.UserEntity;
import dev.phonebook.contactsservice.exception.ApiException;
import dev.phonebook.contactsservice.repository.UserStore;
import dev.phonebook.contactsservice.util.BearerTokens;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@code Authorization} header of a protected request into its user.
 * One token verification and one store lookup per call, nothing is cached between requests.
 * A bad token and an unknown subject fail with the same message.
 */
@Component
public class AuthenticationGate {

    private final JwtService jwtService;
    private final UserStore userStore;

    public AuthenticationGate(JwtService jwtService, UserStore userStore) {
        this.jwtService = jwtService;
        this.userStore = userStore;
    }

    public UserEntity resolveCurrentUser(String authorizationHeader) {
        String token = BearerTokens.extract(authorizationHeader)
            .orElseThrow(() -> ApiException.unauthorized(JwtService.CREDENTIALS_ERROR));
        String email = jwtService.verifyAccessToken(token);
        return userStore.findByEmail(email)
            .orElseThrow(() -> ApiException.unauthorized(JwtService.CREDENTIALS_ERROR));
    }
}
