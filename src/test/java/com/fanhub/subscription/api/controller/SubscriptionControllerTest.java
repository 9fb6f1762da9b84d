package com.fanhub.subscription.api.controller;

import com.fanhub.subscription.api.exception.GlobalExceptionHandler;
import com.fanhub.subscription.config.SecurityConfig;
import com.fanhub.subscription.domain.model.PlayerSubscription;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.domain.model.TeamSubscription;
import com.fanhub.subscription.exception.ActiveSubscriptionConflictException;
import com.fanhub.subscription.exception.ResubscribeTooSoonException;
import com.fanhub.subscription.exception.StorageException;
import com.fanhub.subscription.exception.SubscriptionNotFoundException;
import com.fanhub.subscription.infrastructure.metrics.CloudWatchMetricsService;
import com.fanhub.subscription.security.HeaderAuthenticationFilter;
import com.fanhub.subscription.service.PlayerSubscriptionService;
import com.fanhub.subscription.service.SubscriptionOutcome;
import com.fanhub.subscription.service.TargetDirectory;
import com.fanhub.subscription.service.TeamSubscriptionService;
import com.fanhub.subscription.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for SubscriptionController using MockMvc.
 * The real security chain is loaded so header authentication and public endpoints are covered.
 */
@WebMvcTest(SubscriptionController.class)
@ContextConfiguration(classes = {SubscriptionController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("SubscriptionController Tests")
class SubscriptionControllerTest {

    private static final String USER_ID = "user-123";
    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlayerSubscriptionService playerSubscriptionService;

    @MockBean
    private TeamSubscriptionService teamSubscriptionService;

    @MockBean
    private TargetDirectory targetDirectory;

    @MockBean
    private CloudWatchMetricsService metricsService;

    // ========================================
    // POST /api/v1/subscriptions/{kind}/{targetId}
    // ========================================

    @Test
    @DisplayName("POST /player/42 - New subscription returns 201 Created")
    void subscribe_Created_Returns201() throws Exception {
        // Given
        PlayerSubscription subscription = TestDataBuilder.activePlayerSubscription(USER_ID, "42", NOW);
        when(targetDirectory.exists(TargetKind.PLAYER, "42")).thenReturn(true);
        when(playerSubscriptionService.subscribe(USER_ID, "42")).thenReturn(SubscriptionOutcome.created(subscription));

        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.subscriptionId").value(subscription.getSubscriptionId()))
                .andExpect(jsonPath("$.kind").value("player"))
                .andExpect(jsonPath("$.targetId").value("42"))
                .andExpect(jsonPath("$.state").value("ACTIVE"))
                .andExpect(jsonPath("$.result").value("CREATED"))
                .andExpect(jsonPath("$.created").value(true));
    }

    @Test
    @DisplayName("POST /player/42 - Restored subscription returns 201 with created=false")
    void subscribe_Restored_Returns201() throws Exception {
        PlayerSubscription subscription = TestDataBuilder.activePlayerSubscription(USER_ID, "42", NOW);
        when(targetDirectory.exists(TargetKind.PLAYER, "42")).thenReturn(true);
        when(playerSubscriptionService.subscribe(USER_ID, "42")).thenReturn(SubscriptionOutcome.restored(subscription));

        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result").value("RESTORED"))
                .andExpect(jsonPath("$.created").value(false));
    }

    @Test
    @DisplayName("POST /player/42 - Already subscribed returns 200 OK")
    void subscribe_AlreadyActive_Returns200() throws Exception {
        PlayerSubscription subscription = TestDataBuilder.activePlayerSubscription(USER_ID, "42", NOW);
        when(targetDirectory.exists(TargetKind.PLAYER, "42")).thenReturn(true);
        when(playerSubscriptionService.subscribe(USER_ID, "42")).thenReturn(SubscriptionOutcome.alreadyActive(subscription));

        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("ALREADY_ACTIVE"));
    }

    @Test
    @DisplayName("POST /player/999 - Unknown player returns 404")
    void subscribe_UnknownTarget_Returns404() throws Exception {
        when(targetDirectory.exists(TargetKind.PLAYER, "999")).thenReturn(false);

        mockMvc.perform(post("/api/v1/subscriptions/player/999")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Target Not Found"))
                .andExpect(jsonPath("$.details.targetId").value("999"));

        verify(playerSubscriptionService, never()).subscribe(any(), any());
        verify(metricsService).recordRejection(TargetKind.PLAYER, "TARGET_NOT_FOUND");
    }

    @Test
    @DisplayName("POST /player/42 - Within cooldown returns 400 with Retry-After")
    void subscribe_TooSoon_Returns400() throws Exception {
        when(targetDirectory.exists(TargetKind.PLAYER, "42")).thenReturn(true);
        when(playerSubscriptionService.subscribe(USER_ID, "42")).thenThrow(new ResubscribeTooSoonException(
                TargetKind.PLAYER, "42", Duration.ofHours(23), NOW.plus(Duration.ofHours(23))));

        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("Retry-After", "82800"))
                .andExpect(jsonPath("$.error").value("Resubscribe Too Soon"))
                .andExpect(jsonPath("$.details.retryAfterSeconds").value(82800));
    }

    @Test
    @DisplayName("POST /team/7 - Another team active returns 409")
    void subscribe_TeamConflict_Returns409() throws Exception {
        when(targetDirectory.exists(TargetKind.TEAM, "7")).thenReturn(true);
        when(teamSubscriptionService.subscribe(USER_ID, "7"))
                .thenThrow(new ActiveSubscriptionConflictException(TargetKind.TEAM, USER_ID, "3"));

        mockMvc.perform(post("/api/v1/subscriptions/team/7")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.activeTargetId").value("3"));
    }

    @Test
    @DisplayName("POST /player/42 - Storage failure returns 503")
    void subscribe_StorageFailure_Returns503() throws Exception {
        when(targetDirectory.exists(TargetKind.PLAYER, "42")).thenReturn(true);
        when(playerSubscriptionService.subscribe(USER_ID, "42"))
                .thenThrow(new StorageException("subscribe", "connection refused"));

        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.details.operation").value("subscribe"));
    }

    @Test
    @DisplayName("POST /coach/1 - Unknown kind returns 400")
    void subscribe_UnknownKind_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions/coach/1")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(targetDirectory);
    }

    @Test
    @DisplayName("POST /player/{65 chars} - Over-long target id returns 400")
    void subscribe_TargetIdTooLong_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions/player/" + "9".repeat(65))
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(playerSubscriptionService);
    }

    @Test
    @DisplayName("POST /player/42 - Missing X-User-Id returns 403")
    void subscribe_Unauthenticated_Returns403() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions/player/42"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(playerSubscriptionService, targetDirectory);
    }

    // ========================================
    // DELETE /api/v1/subscriptions/{kind}/{targetId}
    // ========================================

    @Test
    @DisplayName("DELETE /player/42 - Returns 204 No Content")
    void unsubscribe_Returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isNoContent());

        verify(playerSubscriptionService).unsubscribe(USER_ID, "42");
    }

    @Test
    @DisplayName("DELETE /player/42 - Not subscribed returns 404")
    void unsubscribe_NotSubscribed_Returns404() throws Exception {
        doThrow(new SubscriptionNotFoundException(TargetKind.PLAYER, USER_ID, "42"))
                .when(playerSubscriptionService).unsubscribe(USER_ID, "42");

        mockMvc.perform(delete("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Subscription Not Found"));
    }

    // ========================================
    // GET endpoints
    // ========================================

    @Test
    @DisplayName("GET /player/42/count - Public, returns the active subscriber count")
    void count_Public() throws Exception {
        when(playerSubscriptionService.count("42")).thenReturn(5L);

        mockMvc.perform(get("/api/v1/subscriptions/player/42/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("player"))
                .andExpect(jsonPath("$.targetId").value("42"))
                .andExpect(jsonPath("$.count").value(5));
    }

    @Test
    @DisplayName("GET /player/42/count - Read transaction cannot start: Returns 503")
    void count_TransactionUnavailable_Returns503() throws Exception {
        when(playerSubscriptionService.count("42"))
                .thenThrow(new CannotCreateTransactionException("pool exhausted"));

        mockMvc.perform(get("/api/v1/subscriptions/player/42/count"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Storage Unavailable"));
    }

    @Test
    @DisplayName("GET /player/me - Returns the user's active subscriptions")
    void mySubscriptions() throws Exception {
        when(playerSubscriptionService.listActive(USER_ID)).thenReturn(List.of(
                TestDataBuilder.activePlayerSubscription(USER_ID, "42", NOW),
                TestDataBuilder.activePlayerSubscription(USER_ID, "43", NOW)
        ));

        mockMvc.perform(get("/api/v1/subscriptions/player/me")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].targetId").value("42"))
                .andExpect(jsonPath("$[0].result").doesNotExist());
    }

    @Test
    @DisplayName("GET /team/current - Returns the user's active team")
    void currentTeam() throws Exception {
        TeamSubscription team = TestDataBuilder.activeTeamSubscription(USER_ID, "7", NOW);
        doReturn(Optional.of(team)).when(teamSubscriptionService).getCurrent(USER_ID);

        mockMvc.perform(get("/api/v1/subscriptions/team/current")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("team"))
                .andExpect(jsonPath("$.targetId").value("7"));
    }

    @Test
    @DisplayName("GET /team/current - No active team returns 204")
    void currentTeam_None_Returns204() throws Exception {
        doReturn(Optional.empty()).when(teamSubscriptionService).getCurrent(USER_ID);

        mockMvc.perform(get("/api/v1/subscriptions/team/current")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("GET /player/current - Multi-active kind returns 400")
    void currentPlayer_Returns400() throws Exception {
        when(playerSubscriptionService.getCurrent(USER_ID))
                .thenThrow(new IllegalStateException("player subscriptions allow several active targets per user"));

        mockMvc.perform(get("/api/v1/subscriptions/player/current")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, USER_ID))
                .andExpect(status().isBadRequest());
    }
}
