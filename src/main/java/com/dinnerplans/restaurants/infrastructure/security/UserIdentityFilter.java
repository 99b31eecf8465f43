package com.dinnerplans.restaurants.infrastructure.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Resolves the calling user for the restaurant endpoints.
 * The id is read from a header set by the upstream auth layer and exposed
 * to controllers as the {@value #USER_ID_ATTRIBUTE} request attribute.
 */
@Component
public class UserIdentityFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(UserIdentityFilter.class);

    public static final String USER_ID_ATTRIBUTE = "userId";
    private static final String PROTECTED_PREFIX = "/restaurants";

    private final String userHeader;
    private final ObjectMapper objectMapper;

    public UserIdentityFilter(
        @Value("${app.security.user-header:X-User-Id}") String userHeader,
        ObjectMapper objectMapper
    ) {
        this.userHeader = userHeader;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !(path.equals(PROTECTED_PREFIX) || path.startsWith(PROTECTED_PREFIX + "/"));
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String userId = request.getHeader(userHeader);

        if (userId == null || userId.isBlank()) {
            logger.warn("Rejected {} {}: missing {} header", request.getMethod(), request.getRequestURI(), userHeader);
            sendErrorResponse(response, HttpServletResponse.SC_UNAUTHORIZED,
                "UNAUTHORIZED", "Authentication required");
            return;
        }

        request.setAttribute(USER_ID_ATTRIBUTE, userId.trim());
        filterChain.doFilter(request, response);
    }

    private void sendErrorResponse(HttpServletResponse response, int status,
                                   String error, String message) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        Map<String, String> errorBody = Map.of(
            "error", error,
            "message", message
        );

        response.getWriter().write(objectMapper.writeValueAsString(errorBody));
    }
}
