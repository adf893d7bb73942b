package com.multiquery.web;

import com.multiquery.trace.CorrelationContext;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Starts a correlation context for every HTTP request.
 *
 * <p>The request joins the caller's {@code X-Correlation-Id} when present and always gets a fresh
 * request id; both are echoed as response headers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements Filter {

    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        String correlationId = null;
        if (request instanceof HttpServletRequest httpServletRequest) {
            correlationId = httpServletRequest.getHeader(CORRELATION_ID_HEADER);
        }

        try (CorrelationContext.Scope scope = CorrelationContext.begin(correlationId)) {
            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(CORRELATION_ID_HEADER, scope.getCorrelationId());
                httpServletResponse.setHeader(REQUEST_ID_HEADER, scope.getRequestId());
            }
            chain.doFilter(request, response);
        }
    }
}
