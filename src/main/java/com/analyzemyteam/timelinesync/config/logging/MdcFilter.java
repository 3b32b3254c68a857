package com.analyzemyteam.timelinesync.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Puts request-scoped values into the Log4j2 ThreadContext so every log line of a request
 * can be correlated.
 *
 * <ul>
 *   <li>{@code requestId}: X-Request-ID header, or a generated UUID</li>
 *   <li>{@code clientId}: X-Client-ID header (timeline UI or player), when present</li>
 *   <li>{@code videoPosition}: the {@code ms} or {@code timestamp} parameter of playback and
 *       timeline calls, when present</li>
 *   <li>{@code method}, {@code uri}</li>
 * </ul>
 *
 * <p>The context is cleared after every request; servlet threads are pooled.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CLIENT_ID_HEADER = "X-Client-ID";
    static final List<String> POSITION_PARAMETERS = List.of("ms", "timestamp");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                populate(http);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static void populate(HttpServletRequest http) {
        String requestId = http.getHeader(REQUEST_ID_HEADER);
        ThreadContext.put("requestId", isBlank(requestId) ? UUID.randomUUID().toString() : requestId);

        String clientId = http.getHeader(CLIENT_ID_HEADER);
        if (!isBlank(clientId)) {
            ThreadContext.put("clientId", clientId);
        }

        for (String name : POSITION_PARAMETERS) {
            String value = http.getParameter(name);
            if (!isBlank(value)) {
                ThreadContext.put("videoPosition", value);
                break;
            }
        }

        ThreadContext.put("method", http.getMethod());
        ThreadContext.put("uri", http.getRequestURI());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
