package com.jreinhal.annotator.filter;

import com.jreinhal.annotator.controller.AnnotationController;
import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.navigation.AnnotationSessionRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts a correlation id and, for requests carrying a live annotation session, the annotator's
 * username into the MDC. The Logback pattern prints both.
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {
    public static final String HEADER_NAME = "X-Correlation-Id";
    public static final String MDC_KEY = "correlationId";
    public static final String MDC_USER_KEY = "annotator";
    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,64}$");

    private final AnnotationSessionRegistry sessionRegistry;

    public CorrelationIdFilter(AnnotationSessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        String correlationId = request.getHeader(HEADER_NAME);
        if (correlationId == null || !SAFE_CORRELATION_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, correlationId);
        sessionRegistry.lookup(request.getHeader(AnnotationController.SESSION_HEADER))
            .map(UserIdentity::username)
            .ifPresent(username -> MDC.put(MDC_USER_KEY, username));
        response.setHeader(HEADER_NAME, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_USER_KEY);
        }
    }
}
