package com.demo.app;

import com.myorg.evbus.contracts.core.trace.TraceContext;
import com.myorg.evbus.contracts.core.trace.TraceContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Every request runs in a fresh trace whose correlation id comes from {@code X-Correlation-Id}
 * (or is generated); events published while handling it carry that id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Correlation-Id";
    public static final String ATTRIBUTE = "correlationId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String corr = request.getHeader(HEADER);
        if (!StringUtils.hasText(corr)) {
            corr = UUID.randomUUID().toString();
        }
        request.setAttribute(ATTRIBUTE, corr);
        response.setHeader(HEADER, corr);

        try (TraceContextHolder.Scope ignored = TraceContextHolder.open(TraceContext.newRoot(corr.trim()))) {
            chain.doFilter(request, response);
        }
    }
}
