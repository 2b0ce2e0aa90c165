package tech.identitycore.server.grant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for InMemoryAuthorizationCodeRepository, including concurrent redemption.
 */
class InMemoryAuthorizationCodeRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private InMemoryAuthorizationCodeRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuthorizationCodeRepository();
    }

    private AuthorizationCode code(String value, Instant issuedAt, Duration ttl) {
        return new AuthorizationCode(value, "web", "1", Map.of("name", "Test User"),
            "https://localhost:5002/signin-oidc", Set.of("openid", "api1"), "challenge", "S256",
            "nonce-1", issuedAt, issuedAt, issuedAt.plus(ttl));
    }

    // ========================================================================
    // Redemption
    // ========================================================================

    @Test
    @DisplayName("redeem should return the code once and nothing on replay")
    void redeem_shouldSucceedOnce_whenRedeemedTwice() {
        // Arrange
        repository.persist(code("abc", NOW, Duration.ofMinutes(5)));

        // Act
        Optional<AuthorizationCode> first = repository.redeem("abc", NOW.plusSeconds(10));
        Optional<AuthorizationCode> second = repository.redeem("abc", NOW.plusSeconds(11));

        // Assert
        assertThat(first).isPresent();
        assertThat(first.get().clientId).isEqualTo("web");
        assertThat(first.get().isConsumed()).isTrue();
        assertThat(second).isEmpty();
    }

    @Test
    @DisplayName("redeem should return empty for unknown or null codes")
    void redeem_shouldReturnEmpty_whenCodeUnknown() {
        assertThat(repository.redeem("missing", NOW)).isEmpty();
        assertThat(repository.redeem(null, NOW)).isEmpty();
    }

    @Test
    @DisplayName("redeem should succeed exactly at expiry and fail one second later")
    void redeem_shouldRespectExpiryBoundary() {
        // Arrange
        repository.persist(code("at-expiry", NOW, Duration.ofMinutes(5)));
        repository.persist(code("after-expiry", NOW, Duration.ofMinutes(5)));

        // Act & Assert
        assertThat(repository.redeem("at-expiry", NOW.plus(Duration.ofMinutes(5)))).isPresent();
        assertThat(repository.redeem("after-expiry", NOW.plus(Duration.ofMinutes(5)).plusSeconds(1))).isEmpty();
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("persist should reject a duplicate code value")
    void persist_shouldThrow_whenCodeAlreadyStored() {
        repository.persist(code("dup", NOW, Duration.ofMinutes(5)));

        assertThatThrownBy(() -> repository.persist(code("dup", NOW, Duration.ofMinutes(5))))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("concurrent redemption should succeed for exactly one caller")
    void redeem_shouldSucceedForExactlyOneCaller_whenRacing() throws Exception {
        // Arrange
        int threads = 16;
        repository.persist(code("race", NOW, Duration.ofMinutes(5)));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return repository.redeem("race", NOW.plusSeconds(1)).isPresent();
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    successes++;
                }
            }

            // Assert
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    // ========================================================================
    // Purge
    // ========================================================================

    @Test
    @DisplayName("purgeExpired should remove consumed and expired codes and keep live ones")
    void purgeExpired_shouldRemoveConsumedAndExpired() {
        // Arrange
        repository.persist(code("live", NOW, Duration.ofMinutes(5)));
        repository.persist(code("old", NOW.minus(Duration.ofMinutes(10)), Duration.ofMinutes(5)));
        repository.persist(code("used", NOW, Duration.ofMinutes(5)));
        repository.redeem("used", NOW);

        // Act
        int removed = repository.purgeExpired(NOW);

        // Assert
        assertThat(removed).isEqualTo(2);
        assertThat(repository.size()).isEqualTo(1);
        assertThat(repository.redeem("live", NOW)).isPresent();
    }
}
