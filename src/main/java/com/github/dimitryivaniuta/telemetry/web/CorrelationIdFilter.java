package com.github.dimitryivaniuta.telemetry.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every query log line of a request with one correlation id.
 *
 * <p>Taken from {@code X-Correlation-Id}, then {@code X-Request-Id}; a fresh UUID when neither
 * is usable. The id is echoed back so callers can match a 429 or an empty result to the
 * proxy's log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern USABLE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String correlationId = firstUsable(
                request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER),
                request.getHeader(RequestContextKeys.REQUEST_ID_HEADER)
        );

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, correlationId);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    static String firstUsable(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && USABLE_ID.matcher(candidate).matches()) {
                return candidate;
            }
        }
        return UUID.randomUUID().toString();
    }
}
