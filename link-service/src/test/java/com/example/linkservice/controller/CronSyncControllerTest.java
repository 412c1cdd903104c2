package com.example.linkservice.controller;

import com.example.linkservice.client.edge.EdgeStoreClient;
import com.example.linkservice.dto.SyncResultDto;
import com.example.linkservice.exception.GlobalExceptionHandler;
import com.example.linkservice.security.CronSecretVerifier;
import com.example.linkservice.service.EdgeSyncOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CronSyncControllerTest {

    private static final String SECRET = "cron-s3cret";

    @Mock
    private EdgeStoreClient edgeStoreClient;

    @Mock
    private EdgeSyncOrchestrator edgeSyncOrchestrator;

    private MockMvc mockMvc(String configuredSecret) {
        CronSyncController controller = new CronSyncController(
                new CronSecretVerifier(configuredSecret), edgeStoreClient, edgeSyncOrchestrator);
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("500 when no secret is configured server-side")
        void secretNotConfigured() throws Exception {
            mockMvc("").perform(post("/api/cron/sync-edge")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer anything"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error.code").value("CRON_SECRET_NOT_CONFIGURED"));

            verify(edgeSyncOrchestrator, never()).performSync();
        }

        @Test
        void wrongBearer() throws Exception {
            mockMvc(SECRET).perform(post("/api/cron/sync-edge")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));

            verify(edgeSyncOrchestrator, never()).performSync();
        }

        @Test
        void missingSecret() throws Exception {
            mockMvc(SECRET).perform(post("/api/cron/sync-edge"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        void querySecretAccepted() throws Exception {
            when(edgeStoreClient.isConfigured()).thenReturn(true);
            when(edgeSyncOrchestrator.performSync()).thenReturn(SyncResultDto.skippedClean());

            mockMvc(SECRET).perform(post("/api/cron/sync-edge").param("secret", SECRET))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("Bearer header wins over the query parameter")
        void headerTakesPrecedence() throws Exception {
            mockMvc(SECRET).perform(post("/api/cron/sync-edge")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer wrong")
                            .param("secret", SECRET))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Test
    @DisplayName("503 when the edge store is not configured")
    void edgeStoreNotConfigured() throws Exception {
        when(edgeStoreClient.isConfigured()).thenReturn(false);

        mockMvc(SECRET).perform(post("/api/cron/sync-edge")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("EDGE_STORE_NOT_CONFIGURED"));

        verify(edgeSyncOrchestrator, never()).performSync();
    }

    @Test
    void successfulSync() throws Exception {
        when(edgeStoreClient.isConfigured()).thenReturn(true);
        when(edgeSyncOrchestrator.performSync()).thenReturn(SyncResultDto.completed(2, 0, 41));

        mockMvc(SECRET).perform(post("/api/cron/sync-edge")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.synced").value(2))
                .andExpect(jsonPath("$.failed").value(0))
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.durationMs").value(41));
    }

    @Test
    @DisplayName("Partial write failure still answers 200 with the counts")
    void partialFailure() throws Exception {
        when(edgeStoreClient.isConfigured()).thenReturn(true);
        when(edgeSyncOrchestrator.performSync()).thenReturn(SyncResultDto.completed(4, 1, 90));

        mockMvc(SECRET).perform(post("/api/cron/sync-edge")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.total").value(5));
    }

    @Test
    void skippedSync() throws Exception {
        when(edgeStoreClient.isConfigured()).thenReturn(true);
        when(edgeSyncOrchestrator.performSync()).thenReturn(SyncResultDto.skippedClean());

        mockMvc(SECRET).perform(post("/api/cron/sync-edge")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0))
                .andExpect(jsonPath("$.durationMs").value(0));
    }

    @Test
    @DisplayName("Fetch failure maps to 500 SYNC_FAILED")
    void fetchFailure() throws Exception {
        when(edgeStoreClient.isConfigured()).thenReturn(true);
        when(edgeSyncOrchestrator.performSync())
                .thenReturn(SyncResultDto.fetchFailed("Failed to fetch records from source", 12));

        mockMvc(SECRET).perform(post("/api/cron/sync-edge")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("SYNC_FAILED"))
                .andExpect(jsonPath("$.error.message").value("Failed to fetch records from source"));
    }
}
