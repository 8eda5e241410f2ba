package com.scoregate.filter;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
public class RequestResponseLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestResponseLoggingFilter.class);

    private final ClientAddressResolver clientAddressResolver;

    @Value("${logging.enabled:true}")
    private boolean isEnabled;

    @Autowired
    public RequestResponseLoggingFilter(ClientAddressResolver clientAddressResolver) {
        this.clientAddressResolver = clientAddressResolver;
    }

    @Override
    protected void doFilterInternal(@SuppressWarnings("null") HttpServletRequest request,
            @SuppressWarnings("null") HttpServletResponse response, @SuppressWarnings("null") FilterChain filterChain)
            throws ServletException, IOException {
        if (!isEnabled) {
            filterChain.doFilter(request, response);
            return;
        }
        long startTime = System.currentTimeMillis();
        // Bodies carry tickets and tokens and are never logged.
        String requestLine = String.format("Method=%s, URI=%s, ClientIP=%s, Proxy=%s", request.getMethod(),
                request.getRequestURI(), clientAddressResolver.resolve(request), request.getRemoteAddr());
        try {
            filterChain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            logger.info("{}, ResponseCode={}, Duration={}ms", requestLine, response.getStatus(), duration);
        }
    }
}
