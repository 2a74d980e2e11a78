package com.example.purgejobs.http;

import com.example.purgejobs.access.UserAccess;
import com.example.purgejobs.config.JobsProperties;
import com.example.purgejobs.models.User;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each request with a request id and, for API routes, resolves the user named by the
 * upstream authentication header. Unknown or missing users are rejected before any handler runs.
 */
@Component
@Slf4j
public class RequestIdentityFilter extends OncePerRequestFilter {

    public static final String ACTING_USER_ATTRIBUTE = "purgejobs.actingUser";
    private static final String API_PREFIX = "/api/";

    private final UserAccess userAccess;
    private final JobsProperties properties;
    private final ObjectMapper objectMapper;

    public RequestIdentityFilter(UserAccess userAccess, JobsProperties properties, ObjectMapper objectMapper) {
        this.userAccess = userAccess;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        String rid = req.getHeader("X-Request-Id");
        if (rid == null || rid.isBlank()) {
            rid = UUID.randomUUID().toString();
        }
        MDC.put("requestId", rid);
        res.setHeader("X-Request-Id", rid);
        try {
            if (req.getRequestURI().startsWith(API_PREFIX)) {
                Optional<User> user = resolveUser(req.getHeader(properties.getActingUserHeader()));
                if (user.isEmpty()) {
                    reject(res);
                    return;
                }
                MDC.put("user", user.get().getUsername());
                req.setAttribute(ACTING_USER_ATTRIBUTE, user.get());
            }
            chain.doFilter(req, res);
        } finally {
            MDC.remove("user");
            MDC.remove("requestId");
        }
    }

    private Optional<User> resolveUser(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        Optional<User> user = userAccess.findByUsername(username.trim());
        if (user.isEmpty()) {
            log.info("Rejecting request from unknown user '{}'", username);
        }
        return user;
    }

    private void reject(HttpServletResponse res) throws IOException {
        res.setStatus(HttpStatus.UNAUTHORIZED.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(res.getOutputStream(), ApiResponse.error("Unauthorized, please log in."));
    }
}
