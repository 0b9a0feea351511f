package com.demo.coffeeshop.web;

import com.myorg.cafe.observability.CafeMdc;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/** Puts the caller's correlation id (or a fresh one) in the MDC for the whole request. */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Correlation-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String corrId = request.getHeader(HEADER);
        if (!StringUtils.hasText(corrId)) corrId = UUID.randomUUID().toString();

        MDC.put(CafeMdc.CORRELATION_ID, corrId);
        response.setHeader(HEADER, corrId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(CafeMdc.CORRELATION_ID);
        }
    }

    public static String currentOrNew() {
        String corrId = MDC.get(CafeMdc.CORRELATION_ID);
        return StringUtils.hasText(corrId) ? corrId : UUID.randomUUID().toString();
    }
}
