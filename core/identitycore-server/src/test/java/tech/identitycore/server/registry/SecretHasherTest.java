package tech.identitycore.server.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretHasherTest {

    @Test
    @DisplayName("hash should produce base64 SHA-256")
    void hash_shouldProduceBase64Sha256() {
        assertThat(SecretHasher.hash("secret")).isEqualTo("K7gNU3sdo+OL0wNhqoVWhr3g6s1xYv72ol/pe/Unols=");
    }

    @Test
    @DisplayName("matches should accept the original secret only")
    void matches_shouldAcceptOriginalSecretOnly() {
        String stored = SecretHasher.hash("m2m_secret");

        assertThat(SecretHasher.matches("m2m_secret", stored)).isTrue();
        assertThat(SecretHasher.matches("m2m_secreT", stored)).isFalse();
        assertThat(SecretHasher.matches("", stored)).isFalse();
    }

    @Test
    @DisplayName("matches should return false for missing or malformed values")
    void matches_shouldReturnFalse_whenMissingOrMalformed() {
        assertThat(SecretHasher.matches(null, SecretHasher.hash("x"))).isFalse();
        assertThat(SecretHasher.matches("x", null)).isFalse();
        assertThat(SecretHasher.matches("x", "not base64 !!")).isFalse();
    }

    @Test
    @DisplayName("hash should reject a null secret")
    void hash_shouldThrow_whenSecretIsNull() {
        assertThatThrownBy(() -> SecretHasher.hash(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
