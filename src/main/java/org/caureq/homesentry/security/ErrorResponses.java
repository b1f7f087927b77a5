package org.caureq.homesentry.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.caureq.homesentry.api.error.ApiError;
import org.caureq.homesentry.api.error.ErrorCode;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/** Filters run before Spring MVC, so they write the error envelope themselves. */
final class ErrorResponses {
    private static final ObjectMapper OM = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ErrorResponses() {}

    static void write(HttpServletRequest req, HttpServletResponse res, int status, ErrorCode code, String message)
            throws IOException {
        var body = new ApiError(Instant.now(), code, message, req.getHeader("X-Correlation-Id"), Map.of());
        res.setStatus(status);
        res.setContentType("application/json");
        res.setCharacterEncoding("UTF-8");
        OM.writeValue(res.getWriter(), body);
    }
}
