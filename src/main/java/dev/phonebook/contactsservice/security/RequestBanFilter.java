package dev.phonebook.contactsservice.security;

import dev.phonebook.contactsservice.config.BanProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Rejects banned client addresses and user agents before anything else runs. */
@Component
@Order(SecurityProperties.DEFAULT_FILTER_ORDER - 20)
public class RequestBanFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestBanFilter.class);

    private final Set<String> bannedIps;
    private final List<Pattern> bannedUserAgents;

    public RequestBanFilter(BanProperties properties) {
        this.bannedIps = Set.copyOf(properties.ips());
        this.bannedUserAgents = properties.userAgentPatterns().stream().map(Pattern::compile).toList();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String remoteAddr = request.getRemoteAddr();
        if (bannedIps.contains(remoteAddr)) {
            log.warn("Rejected request from banned address {}", remoteAddr);
            reject(response);
            return;
        }

        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        if (userAgent != null) {
            for (Pattern pattern : bannedUserAgents) {
                if (pattern.matcher(userAgent).find()) {
                    log.warn("Rejected request from banned user agent '{}' ({})", userAgent, remoteAddr);
                    reject(response);
                    return;
                }
            }
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"detail\":\"You are banned\"}");
    }
}
