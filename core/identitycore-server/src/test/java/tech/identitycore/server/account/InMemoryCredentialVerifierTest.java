package tech.identitycore.server.account;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.identitycore.server.config.IdentityConfig;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the configuration-backed credential store.
 */
class InMemoryCredentialVerifierTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private InMemoryCredentialVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new InMemoryCredentialVerifier();
        verifier.config = mock(IdentityConfig.class);
        verifier.passwordService = spy(new PasswordService());
    }

    private static IdentityConfig.UserConfig user(Optional<String> password, Optional<String> passwordHash) {
        IdentityConfig.UserConfig user = mock(IdentityConfig.UserConfig.class);
        when(user.subjectId()).thenReturn("1");
        when(user.password()).thenReturn(password);
        when(user.passwordHash()).thenReturn(passwordHash);
        when(user.claims()).thenReturn(Map.of("name", "Test User"));
        return user;
    }

    @Test
    @DisplayName("verify should accept a plain configured password after hashing it with Argon2id")
    void verify_shouldAuthenticate_whenPlainPasswordConfigured() {
        // Arrange
        IdentityConfig.UserConfig user = user(Optional.of("password"), Optional.empty());
        when(verifier.config.users()).thenReturn(Map.of("testuser", user));
        verifier.init();

        // Act
        Optional<AuthenticatedSubject> subject = verifier.verify("testuser", "password", NOW);

        // Assert
        assertThat(subject).isPresent();
        assertThat(subject.get().subjectId()).isEqualTo("1");
        assertThat(subject.get().claims()).containsEntry("name", "Test User");
        assertThat(subject.get().authTime()).isEqualTo(NOW);
        verify(verifier.passwordService).hashPassword("password");
    }

    @Test
    @DisplayName("verify should accept a configured Argon2id hash as is")
    void verify_shouldAuthenticate_whenPasswordHashConfigured() {
        String hash = new PasswordService().hashPassword("s3cret-pass");
        IdentityConfig.UserConfig user = user(Optional.empty(), Optional.of(hash));
        when(verifier.config.users()).thenReturn(Map.of("alice", user));
        verifier.init();

        assertThat(verifier.verify("alice", "s3cret-pass", NOW)).isPresent();
        assertThat(verifier.verify("alice", "wrong", NOW)).isEmpty();
    }

    @Test
    @DisplayName("verify should reject unknown users, wrong passwords and missing input")
    void verify_shouldReturnEmpty_whenCredentialsInvalid() {
        IdentityConfig.UserConfig user = user(Optional.of("password"), Optional.empty());
        when(verifier.config.users()).thenReturn(Map.of("testuser", user));
        verifier.init();

        assertThat(verifier.verify("testuser", "nope", NOW)).isEmpty();
        assertThat(verifier.verify("nobody", "password", NOW)).isEmpty();
        assertThat(verifier.verify(null, "password", NOW)).isEmpty();
        assertThat(verifier.verify("testuser", null, NOW)).isEmpty();
    }

    @Test
    @DisplayName("init should fail for a user without password or password hash")
    void init_shouldThrow_whenNoPasswordConfigured() {
        IdentityConfig.UserConfig user = user(Optional.empty(), Optional.empty());
        when(verifier.config.users()).thenReturn(Map.of("ghost", user));

        assertThatThrownBy(() -> verifier.init())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ghost");
    }
}
