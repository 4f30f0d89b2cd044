package com.gatehouse.api.infrastructure.web;

import com.gatehouse.observability.CorrelationContext;
import com.gatehouse.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is reused; otherwise a new UUID is generated. The
 * ID is echoed on the response and bound to {@link CorrelationContextHolder}, together with a
 * fresh request ID, until the chain returns. The authenticated
 * user ID is added later by {@link CurrentUserArgumentResolver}.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the context is available to all later filters
 * and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        CorrelationContext context = new CorrelationContext(correlationId, UUID.randomUUID().toString(), null);
        try (CorrelationContextHolder.Binding ignored = CorrelationContextHolder.bind(context)) {
            filterChain.doFilter(request, response);
        }
    }
}
