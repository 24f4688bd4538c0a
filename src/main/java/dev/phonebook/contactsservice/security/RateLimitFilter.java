package dev.phonebook.contactsservice.security;

import dev.phonebook.contactsservice.config.RateLimitProperties;
import dev.phonebook.contactsservice.config.RateLimitProperties.Rule;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-client, per-route request quotas backed by a Redis sliding window. Runs ahead of the
 * security filter chain, so a throttled request never reaches token verification.
 * When Redis is unreachable the filter keeps limiting with in-process fixed windows.
 */
@Component
@Order(RateLimitFilter.ORDER)
public class RateLimitFilter extends OncePerRequestFilter {

    public static final int ORDER = SecurityProperties.DEFAULT_FILTER_ORDER - 10;

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> rateLimitScript;
    private final RateLimitProperties properties;
    private final Clock clock;

    static final long FALLBACK_SWEEP_INTERVAL_MS = 60_000;

    private final ConcurrentHashMap<String, FallbackWindow> fallbackWindows = new ConcurrentHashMap<>();
    private volatile long lastFallbackSweep;

    @Autowired
    public RateLimitFilter(StringRedisTemplate redisTemplate,
                           RedisScript<Long> rateLimitScript,
                           RateLimitProperties properties) {
        this(redisTemplate, rateLimitScript, properties, Clock.systemUTC());
    }

    RateLimitFilter(StringRedisTemplate redisTemplate,
                    RedisScript<Long> rateLimitScript,
                    RateLimitProperties properties,
                    Clock clock) {
        this.redisTemplate = redisTemplate;
        this.rateLimitScript = rateLimitScript;
        this.properties = properties;
        this.clock = clock;
        this.lastFallbackSweep = clock.millis();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return findRule(request) == null;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Rule rule = findRule(request);
        if (rule == null) {
            filterChain.doFilter(request, response);
            return;
        }

        String clientId = request.getRemoteAddr();
        String key = "rate:" + rule.method().toLowerCase() + ":" + rule.path() + ":" + clientId;
        long now = clock.millis();
        long windowMs = rule.seconds() * 1000L;

        boolean allowed;
        try {
            Long result = redisTemplate.execute(
                rateLimitScript,
                Collections.singletonList(key),
                String.valueOf(now),
                String.valueOf(windowMs),
                String.valueOf(rule.times()),
                now + ":" + UUID.randomUUID()
            );
            allowed = result != null && result != 0L;
        } catch (Exception e) {
            log.warn("Rate limit check failed, using in-memory fallback for client: {}", clientId);
            allowed = allowInMemory(key, rule.times(), windowMs, now);
        }

        if (!allowed) {
            log.warn("Rate limit exceeded for client={} route={} {}", clientId, rule.method(), rule.path());
            sendRateLimitResponse(response, rule.seconds());
            return;
        }

        filterChain.doFilter(request, response);
    }

    private Rule findRule(HttpServletRequest request) {
        String method = request.getMethod();
        String path = request.getRequestURI();
        for (Rule rule : properties.rules()) {
            if (rule.matches(method, path)) {
                return rule;
            }
        }
        return null;
    }

    private boolean allowInMemory(String key, int limit, long windowMs, long now) {
        sweepExpiredWindows(now);
        FallbackWindow window = fallbackWindows.compute(key, (k, existing) ->
            existing == null || existing.isExpired(now) ? new FallbackWindow(now, windowMs) : existing);
        synchronized (window) {
            if (window.count >= limit) {
                return false;
            }
            window.count++;
            return true;
        }
    }

    private void sweepExpiredWindows(long now) {
        if (now - lastFallbackSweep < FALLBACK_SWEEP_INTERVAL_MS) {
            return;
        }
        lastFallbackSweep = now;
        fallbackWindows.values().removeIf(window -> window.isExpired(now));
    }

    int fallbackWindowCount() {
        return fallbackWindows.size();
    }

    private void sendRateLimitResponse(HttpServletResponse response, int retryAfterSeconds) throws IOException {
        response.setStatus(429);
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"detail\":\"Too many requests\"}");
        response.getWriter().flush();
    }

    private static final class FallbackWindow {
        private final long startedAt;
        private final long windowMs;
        private int count;

        private FallbackWindow(long startedAt, long windowMs) {
            this.startedAt = startedAt;
            this.windowMs = windowMs;
        }

        private boolean isExpired(long now) {
            return now - startedAt >= windowMs;
        }
    }
}
