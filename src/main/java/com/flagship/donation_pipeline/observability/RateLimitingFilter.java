package com.flagship.donation_pipeline.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.donation_pipeline.config.DonationProperties;
import com.flagship.donation_pipeline.exception.ApiError;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;

/**
 * Per-client-IP token bucket on the payment endpoints.
 *
 * Webhooks come from PayPal's own infrastructure and health checks from
 * monitoring; neither is limited. Buckets are process-local, bounded in number,
 * and dropped once a client has been idle for a full window.
 *
 * The client is {@link HttpServletRequest#getRemoteAddr()}. Behind a proxy,
 * {@code server.forward-headers-strategy} decides whether forwarded headers are
 * trusted; the filter never reads them itself.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class RateLimitingFilter extends OncePerRequestFilter {

    private static final String PAYMENT_PATH_PREFIX = "/api/paypal";

    private final Cache<String, Bucket> buckets;
    private final DonationProperties.RateLimit settings;
    private final ObjectMapper objectMapper;
    private final DonationMetrics metrics;

    public RateLimitingFilter(DonationProperties properties, ObjectMapper objectMapper, DonationMetrics metrics) {
        this.settings = properties.getRateLimit();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.buckets = Caffeine.newBuilder()
                .maximumSize(settings.getMaxTrackedClients())
                .expireAfterAccess(settings.getWindow())
                .build();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String clientIp = request.getRemoteAddr();
        Bucket bucket = buckets.get(clientIp, key -> newBucket());

        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Rate limit exceeded: clientIp={}, path={}", clientIp, request.getRequestURI());
        metrics.incrementRateLimited();

        ApiError error = ApiError.builder()
                .error("RATE_LIMITED")
                .message("Too many requests. Please try again later.")
                .timestamp(Instant.now())
                .build();
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(settings.getWindow().getSeconds()));
        objectMapper.writeValue(response.getOutputStream(), error);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!settings.isEnabled()) {
            return true;
        }
        String path = request.getRequestURI();
        if (!path.startsWith(PAYMENT_PATH_PREFIX)) {
            return true;
        }
        if (path.endsWith("/webhook") || path.endsWith("/health")) {
            return true;
        }
        String action = request.getParameter("action");
        return "webhook".equals(action) || "health".equals(action);
    }

    private Bucket newBucket() {
        Bandwidth limit = Bandwidth.classic(settings.getCapacity(),
                Refill.intervally(settings.getCapacity(), settings.getWindow()));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }
}
