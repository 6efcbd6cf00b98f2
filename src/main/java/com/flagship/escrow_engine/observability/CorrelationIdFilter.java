package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.api.RequestContext;
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

/**
 * Binds a correlation ID to each API request and tags its log lines with the
 * calling actor. The ID is taken from the caller when present and echoed back,
 * so a client can match its request to the events the engine emits for it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String incoming = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        CorrelationContext.setCorrelationId(incoming);
        String correlationId = CorrelationContext.getCorrelationId();
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        String actor = describeActor(request);
        if (actor != null) {
            MDC.put(CorrelationContext.ACTOR_MDC_KEY, actor);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACTOR_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    private static String describeActor(HttpServletRequest request) {
        String actorId = request.getHeader(RequestContext.ACTOR_ID_HEADER);
        String role = request.getHeader(RequestContext.ACTOR_ROLE_HEADER);
        if (actorId == null && role == null) {
            return null;
        }
        return (role != null ? role : "USER") + ":" + (actorId != null ? actorId : "-");
    }
}
