package com.example.linkservice.security;

import com.example.linkservice.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * Service-to-Service Authentication Filter.
 *
 * Validates X-Service-Name and X-Service-Key headers for the internal API
 * (the dashboard's sync health query). Only applies to /internal/** endpoints.
 * With no key configured every internal call is rejected.
 *
 * The path is matched the way handler mapping sees it, so path parameters
 * ("/internal;x=1/...") and encoded segments cannot route around the check.
 */
@Component
@Slf4j
public class ServiceToServiceAuthFilter extends OncePerRequestFilter {

    static final String SERVICE_NAME_HEADER = "X-Service-Name";
    static final String SERVICE_KEY_HEADER = "X-Service-Key";
    static final String INTERNAL_PATH_PREFIX = "/internal/";

    private final String internalServiceKey;
    private final Set<String> allowedServices;
    private final ObjectMapper objectMapper;

    public ServiceToServiceAuthFilter(@Value("${security.internal-service-key:}") String internalServiceKey,
                                      @Value("${security.allowed-services:dashboard}") Set<String> allowedServices,
                                      ObjectMapper objectMapper) {
        this.internalServiceKey = internalServiceKey;
        this.allowedServices = allowedServices;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String lookupPath = UrlPathHelper.defaultInstance.getLookupPathForRequest(request);
        return !lookupPath.startsWith(INTERNAL_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String serviceName = request.getHeader(SERVICE_NAME_HEADER);
        String serviceKey = request.getHeader(SERVICE_KEY_HEADER);

        if (serviceName == null || !allowedServices.contains(serviceName)) {
            log.warn("Invalid service name: {}", serviceName);
            reject(response);
            return;
        }

        if (!StringUtils.hasText(internalServiceKey) || serviceKey == null
                || !MessageDigest.isEqual(serviceKey.getBytes(StandardCharsets.UTF_8),
                internalServiceKey.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Invalid service key for {}", serviceName);
            reject(response);
            return;
        }

        log.debug("Service-to-service auth validated for {}", serviceName);
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(
                ErrorResponse.of("UNAUTHORIZED", "Invalid service authentication")));
    }
}
