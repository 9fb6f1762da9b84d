package com.fanhub.subscription.api;

import com.fanhub.subscription.domain.model.PlayerSubscription;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.infrastructure.scheduler.RetentionSweepResult;
import com.fanhub.subscription.infrastructure.scheduler.SubscriptionRetentionScheduler;
import com.fanhub.subscription.repository.PlayerSubscriptionRepository;
import com.fanhub.subscription.repository.TeamSubscriptionRepository;
import com.fanhub.subscription.security.HeaderAuthenticationFilter;
import com.fanhub.subscription.service.PlayerSubscriptionService;
import com.fanhub.subscription.service.SubscriptionOutcome;
import com.fanhub.subscription.testutil.MutableClock;
import com.fanhub.subscription.testutil.TestDataBuilder;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import redis.embedded.RedisServer;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests of the subscription lifecycle against PostgreSQL (Testcontainers)
 * and embedded Redis, with a movable clock.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
@ActiveProfiles("test")
@DisplayName("Subscription Lifecycle Integration Tests")
class SubscriptionLifecycleIT {

    private static final int REDIS_PORT = 6371;
    private static final Instant START = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("fanhub_test")
            .withUsername("test")
            .withPassword("test");

    private static RedisServer redisServer;

    @BeforeAll
    static void startRedis() throws IOException {
        redisServer = new RedisServer(REDIS_PORT);
        redisServer.start();
    }

    @AfterAll
    static void stopRedis() throws IOException {
        if (redisServer != null) {
            redisServer.stop();
        }
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
        registry.add("spring.sql.init.mode", () -> "always");
        registry.add("spring.data.redis.host", () -> "localhost");
        registry.add("spring.data.redis.port", () -> REDIS_PORT);
    }

    @TestConfiguration
    static class ClockTestConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    @Autowired
    private PlayerSubscriptionService playerSubscriptionService;

    @Autowired
    private PlayerSubscriptionRepository playerRepository;

    @Autowired
    private TeamSubscriptionRepository teamRepository;

    @Autowired
    private SubscriptionRetentionScheduler retentionScheduler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @BeforeEach
    void setUp() {
        clock.setInstant(START);
        playerRepository.deleteAll();
        teamRepository.deleteAll();
        redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });

        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS player (id BIGINT PRIMARY KEY)");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS team (id BIGINT PRIMARY KEY)");
        jdbcTemplate.update("INSERT INTO player (id) VALUES (42) ON CONFLICT DO NOTHING");
        jdbcTemplate.update("INSERT INTO team (id) VALUES (3), (7) ON CONFLICT DO NOTHING");
    }

    @Test
    @DisplayName("Player scenario - subscribe, unsubscribe, rejected at +1h, restored at +25h")
    void playerScenario() throws Exception {
        // Subscribe
        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created").value(true));
        String subscriptionId = playerRepository.findActive("user-1", "42").orElseThrow().getSubscriptionId();

        mockMvc.perform(get("/api/v1/subscriptions/player/42/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));

        // Subscribe again is a no-op
        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscriptionId").value(subscriptionId));

        // Unsubscribe
        mockMvc.perform(delete("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/subscriptions/player/42/count"))
                .andExpect(jsonPath("$.count").value(0));

        // +1h: inside the cooldown
        clock.advance(Duration.ofHours(1));
        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.retryAfterSeconds").value(Duration.ofHours(23).toSeconds()));

        // +25h: restored in place
        clock.setInstant(START.plus(Duration.ofHours(25)));
        mockMvc.perform(post("/api/v1/subscriptions/player/42")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result").value("RESTORED"))
                .andExpect(jsonPath("$.subscriptionId").value(subscriptionId));

        mockMvc.perform(get("/api/v1/subscriptions/player/42/count"))
                .andExpect(jsonPath("$.count").value(1));
        assertThat(playerRepository.count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Unknown player returns 404 and creates nothing")
    void unknownPlayer_Returns404() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions/player/999")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isNotFound());

        assertThat(playerRepository.count()).isZero();
    }

    @Test
    @DisplayName("Team - second team is rejected while the first is active, allowed after unsubscribing")
    void teamSingleActive() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions/team/3")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/subscriptions/team/7")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/v1/subscriptions/team/current")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetId").value("3"));

        mockMvc.perform(delete("/api/v1/subscriptions/team/3")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/v1/subscriptions/team/7")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-1"))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("Concurrent subscribes for the same pair produce exactly one active row")
    void concurrentSubscribe_SingleRow() throws Exception {
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<SubscriptionOutcome>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    go.await();
                    return playerSubscriptionService.subscribe("user-race", "42");
                }));
            }
            ready.await(10, TimeUnit.SECONDS);
            go.countDown();

            List<SubscriptionOutcome> outcomes = new ArrayList<>();
            for (Future<SubscriptionOutcome> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(outcomes).filteredOn(SubscriptionOutcome::isCreated).hasSize(1);
            assertThat(outcomes).extracting(outcome -> outcome.getSubscription().getSubscriptionId()).containsOnly(
                    outcomes.get(0).getSubscription().getSubscriptionId());
            assertThat(playerRepository.countActive("42")).isEqualTo(1L);
            assertThat(playerRepository.count()).isEqualTo(1L);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Concurrent subscribes of one user to two teams leave exactly one active team")
    void concurrentTeamSubscribe_SingleActiveTeam() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();

        try {
            for (String teamId : List.of("3", "7")) {
                futures.add(executor.submit(() -> {
                    go.await();
                    return mockMvc.perform(post("/api/v1/subscriptions/team/" + teamId)
                                    .header(HeaderAuthenticationFilter.USER_ID_HEADER, "user-team-race"))
                            .andReturn().getResponse().getStatus();
                }));
            }
            go.countDown();

            List<Integer> statuses = new ArrayList<>();
            for (Future<Integer> future : futures) {
                statuses.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(statuses).containsExactlyInAnyOrder(201, 409);
            assertThat(teamRepository.findActiveByUserId("user-team-race")).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Retention sweep - removes a row deleted 4 days ago, keeps one deleted 2 days ago")
    void retentionSweep() throws Exception {
        // Given
        PlayerSubscription old = playerRepository.save(
                TestDataBuilder.deletedPlayerSubscription("user-1", "42", START.minus(Duration.ofDays(4))));
        PlayerSubscription recent = playerRepository.save(
                TestDataBuilder.deletedPlayerSubscription("user-2", "42", START.minus(Duration.ofDays(2))));

        // When
        RetentionSweepResult result = retentionScheduler.triggerSweepNow();

        // Then
        assertThat(result.isExecuted()).isTrue();
        assertThat(result.getPurged(TargetKind.PLAYER)).isEqualTo(1L);
        assertThat(playerRepository.findById(old.getSubscriptionId())).isEmpty();
        assertThat(playerRepository.findById(recent.getSubscriptionId())).isPresent();

        // Admin endpoint reports the (now empty) second run
        mockMvc.perform(post("/api/v1/admin/subscriptions/retention-sweep")
                        .header(HeaderAuthenticationFilter.USER_ID_HEADER, "ops-1")
                        .header(HeaderAuthenticationFilter.USER_ROLE_HEADER, "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPurged").value(0));
    }
}
