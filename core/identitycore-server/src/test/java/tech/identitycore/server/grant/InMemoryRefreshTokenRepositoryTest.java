package tech.identitycore.server.grant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRefreshTokenRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private InMemoryRefreshTokenRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRefreshTokenRepository();
    }

    private RefreshToken token(String value, String family, Instant expiresAt, boolean sliding) {
        return new RefreshToken(OpaqueTokens.hash(value), family, "web", "1", Map.of(),
            Set.of("openid", "offline_access"), NOW, NOW, expiresAt, sliding);
    }

    @Test
    @DisplayName("tokens should be found by hash, never by raw value")
    void findByTokenHash_shouldLookupByHash() {
        repository.persist(token("raw-value", "f1", NOW.plus(Duration.ofDays(1)), false));

        assertThat(repository.findByTokenHash(OpaqueTokens.hash("raw-value"))).isPresent();
        assertThat(repository.findByTokenHash("raw-value")).isEmpty();
        assertThat(repository.findByTokenHash(null)).isEmpty();
    }

    @Test
    @DisplayName("revokeFamily should revoke every token of the family only")
    void revokeFamily_shouldRevokeOnlyThatFamily() {
        // Arrange
        repository.persist(token("a", "f1", NOW.plus(Duration.ofDays(1)), false));
        repository.persist(token("b", "f1", NOW.plus(Duration.ofDays(1)), false));
        repository.persist(token("c", "f2", NOW.plus(Duration.ofDays(1)), false));

        // Act
        int revoked = repository.revokeFamily("f1");

        // Assert
        assertThat(revoked).isEqualTo(2);
        assertThat(repository.findByTokenHash(OpaqueTokens.hash("a")).orElseThrow().isRevoked()).isTrue();
        assertThat(repository.findByTokenHash(OpaqueTokens.hash("b")).orElseThrow().isUsable(NOW)).isFalse();
        assertThat(repository.findByTokenHash(OpaqueTokens.hash("c")).orElseThrow().isUsable(NOW)).isTrue();
        assertThat(repository.revokeFamily("f1")).isZero();
    }

    @Test
    @DisplayName("purgeExpired should drop expired and revoked tokens but keep consumed live ones")
    void purgeExpired_shouldKeepConsumedLiveTokens() {
        // Arrange
        repository.persist(token("expired", "f1", NOW.minusSeconds(1), false));
        repository.persist(token("revoked", "f2", NOW.plus(Duration.ofDays(1)), false));
        repository.persist(token("consumed", "f3", NOW.plus(Duration.ofDays(1)), false));
        repository.revokeFamily("f2");
        repository.findByTokenHash(OpaqueTokens.hash("consumed")).orElseThrow().tryConsume();

        // Act
        int removed = repository.purgeExpired(NOW);

        // Assert
        assertThat(removed).isEqualTo(2);
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("slide should only ever extend the expiry")
    void slide_shouldOnlyExtendExpiry() {
        RefreshToken token = token("s", "f1", NOW.plus(Duration.ofHours(2)), true);

        token.slide(NOW, Duration.ofHours(1));
        assertThat(token.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));

        token.slide(NOW.plus(Duration.ofHours(2)), Duration.ofHours(1));
        assertThat(token.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(3)));
    }

    @Test
    @DisplayName("tryConsume should succeed once")
    void tryConsume_shouldSucceedOnce() {
        RefreshToken token = token("once", "f1", NOW.plus(Duration.ofDays(1)), false);

        assertThat(token.tryConsume()).isTrue();
        assertThat(token.tryConsume()).isFalse();
        assertThat(token.isConsumed()).isTrue();
    }

    @Test
    @DisplayName("concurrent consumption of a one-time token should succeed for exactly one caller")
    void tryConsume_shouldSucceedOnce_whenRacing() throws Exception {
        // Arrange
        int threads = 16;
        repository.persist(token("race", "f1", NOW.plus(Duration.ofDays(1)), false));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return repository.findByTokenHash(OpaqueTokens.hash("race"))
                        .map(RefreshToken::tryConsume)
                        .orElse(false);
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

    @Test
    @DisplayName("delete should remove only the given token")
    void delete_shouldRemoveToken() {
        repository.persist(token("keep", "f1", NOW.plus(Duration.ofDays(1)), false));
        repository.persist(token("drop", "f1", NOW.plus(Duration.ofDays(1)), false));

        repository.delete(OpaqueTokens.hash("drop"));

        assertThat(repository.findByTokenHash(OpaqueTokens.hash("drop"))).isEmpty();
        assertThat(repository.findByTokenHash(OpaqueTokens.hash("keep"))).isPresent();
    }
}
