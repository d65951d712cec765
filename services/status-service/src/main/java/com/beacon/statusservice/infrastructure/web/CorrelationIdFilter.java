package com.beacon.statusservice.infrastructure.web;

import com.beacon.observability.CorrelationContext;
import com.beacon.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a correlation ID to every HTTP request. An inbound {@code X-Correlation-ID} header is
 * reused, otherwise a fresh one is generated; either way it is echoed on the response and cleared
 * when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(CORRELATION_ID_HEADER);
        CorrelationContext context =
                header == null || header.isBlank()
                        ? CorrelationContext.generate()
                        : CorrelationContext.forRequest(header.trim());
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses worker threads.
            CorrelationContextHolder.clear();
        }
    }
}
