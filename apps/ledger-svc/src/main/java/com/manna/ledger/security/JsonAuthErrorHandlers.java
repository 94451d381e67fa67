package com.manna.ledger.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.manna.ledger.controller.dto.ErrorResponseDto;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Renders 401 / 403 responses with the same error body the REST handlers use.
 */
@Component
public class JsonAuthErrorHandlers implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonAuthErrorHandlers.class);

    private final ObjectMapper objectMapper;

    public JsonAuthErrorHandlers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException) throws IOException {
        writeJson(response, 401, authException, request, "UNAUTHORIZED");
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException) throws IOException {
        writeJson(response, 403, accessDeniedException, request, "FORBIDDEN");
    }

    private void writeJson(HttpServletResponse response, int status, Exception ex, HttpServletRequest request, String code) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");

        Map<String, Object> details = new HashMap<>();
        details.put("path", request.getRequestURI());
        if (ex instanceof OAuth2AuthenticationException oauthEx && oauthEx.getError() != null) {
            details.put("oauth2ErrorCode", oauthEx.getError().getErrorCode());
            details.put("oauth2ErrorDescription", oauthEx.getError().getDescription());
        }
        String traceId = RequestContextHolder.currentTraceId();
        log.debug("auth_error status={} path={} reason={} traceId={}", status, request.getRequestURI(), ex.getMessage(), traceId);
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponseDto(code, ex.getMessage(), details, traceId));
    }
}
