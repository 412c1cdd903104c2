package com.example.linkservice.security;

import com.example.linkservice.exception.CronSecretNotConfiguredException;
import com.example.linkservice.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secret presented by the external cron caller.
 *
 * The secret comes from "Authorization: Bearer &lt;secret&gt;" or, failing that, from the
 * "secret" query parameter. Comparison is constant-time.
 */
@Component
@Slf4j
public class CronSecretVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final String cronSecret;

    public CronSecretVerifier(@Value("${edge-sync.cron-secret:}") String cronSecret) {
        this.cronSecret = cronSecret;
    }

    /**
     * @throws CronSecretNotConfiguredException if no secret is configured server-side
     * @throws UnauthorizedException            if the presented secret is missing or wrong
     */
    public void verify(String authorizationHeader, String secretParam) {
        if (!StringUtils.hasText(cronSecret)) {
            throw new CronSecretNotConfiguredException();
        }

        String presented = authorizationHeader != null && authorizationHeader.startsWith(BEARER_PREFIX)
                ? authorizationHeader.substring(BEARER_PREFIX.length())
                : secretParam;

        if (presented == null || !MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                cronSecret.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Cron sync call with {} secret", presented == null ? "missing" : "invalid");
            throw new UnauthorizedException("Invalid cron secret");
        }
    }
}
