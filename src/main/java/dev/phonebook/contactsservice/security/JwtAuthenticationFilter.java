package dev.phonebook.contactsservice.security;

import dev.phonebook.contactsservice.domain.UserEntity;
import dev.phonebook.contactsservice.exception.ApiException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the {@link AuthenticationGate} for requests carrying an {@code Authorization} header and
 * publishes the resolved {@link AuthenticatedUser} as the security principal. Rejected tokens
 * leave the request anonymous, so protected routes answer 401 through the entry point.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    // Endpoints that read the header themselves or never need an identity.
    private static final Set<String> SKIPPED_PATHS = Set.of("/auth/signup", "/auth/login", "/auth/refresh_token");

    private final AuthenticationGate authenticationGate;

    public JwtAuthenticationFilter(AuthenticationGate authenticationGate) {
        this.authenticationGate = authenticationGate;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return SKIPPED_PATHS.contains(path) || path.startsWith("/email/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null) {
            try {
                UserEntity user = authenticationGate.resolveCurrentUser(authorization);
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    AuthenticatedUser.from(user),
                    null,
                    List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name())));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ApiException ex) {
                SecurityContextHolder.clearContext();
                log.debug("Bearer authentication rejected for {}: {}", request.getRequestURI(), ex.getMessage());
            }
        }
        filterChain.doFilter(request, response);
    }
}
