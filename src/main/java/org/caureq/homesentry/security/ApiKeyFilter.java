package org.caureq.homesentry.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.caureq.homesentry.api.error.ErrorCode;
import org.caureq.homesentry.config.HomeSentryProps;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Probes pushing observations must present X-API-KEY. */
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    private final HomeSentryProps props;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        boolean needsKey = req.getRequestURI().startsWith("/api/observations")
                && "POST".equalsIgnoreCase(req.getMethod());

        if (needsKey) {
            String key = req.getHeader("X-API-KEY");
            String expected = props.apiKey();
            if (expected == null || expected.isBlank() || key == null || !key.equals(expected)) {
                ErrorResponses.write(req, res, HttpServletResponse.SC_UNAUTHORIZED,
                        ErrorCode.AUTH_REQUIRED, "Missing or invalid X-API-KEY");
                return;
            }
        }

        chain.doFilter(req, res);
    }
}
