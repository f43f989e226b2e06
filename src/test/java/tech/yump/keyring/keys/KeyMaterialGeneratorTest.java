package tech.yump.keyring.keys;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.keyring.config.KeyringProperties;
import tech.yump.keyring.support.TestProperties;

import java.security.ProviderException;
import java.security.SecureRandom;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyMaterialGeneratorTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("generate: Should produce an ES256 standby key for the P-256 curve")
    void generate_ecKey() {
        // Arrange
        KeyMaterialGenerator generator = new KeyMaterialGenerator(TestProperties.ecSigning(), clock, new SecureRandom());

        // Act
        KeyRecord key = generator.generate();

        // Assert
        assertThat(key.state()).isEqualTo(KeyState.STANDBY);
        assertThat(key.algorithm()).isEqualTo(KeyAlgorithm.ES256);
        assertThat(key.publicKey()).isInstanceOf(ECPublicKey.class);
        assertThat(key.privateKey()).isInstanceOf(ECPrivateKey.class);
        assertThat(key.createdAt()).isEqualTo(NOW);
        assertThat(key.activatedAt()).isNull();
        assertThat(key.keyId()).matches("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    @Test
    @DisplayName("generate: Should produce an RS256 key of the configured size")
    void generate_rsaKey() {
        KeyMaterialGenerator generator = new KeyMaterialGenerator(TestProperties.rsaSigning(), clock, new SecureRandom());

        KeyRecord key = generator.generate();

        assertThat(key.algorithm()).isEqualTo(KeyAlgorithm.RS256);
        assertThat(key.publicKey()).isInstanceOf(RSAPublicKey.class);
        assertThat(((RSAPublicKey) key.publicKey()).getModulus().bitLength()).isEqualTo(2048);
    }

    @Test
    @DisplayName("generate: Should never reuse a key id")
    void generate_uniqueKeyIds() {
        KeyMaterialGenerator generator = new KeyMaterialGenerator(TestProperties.ecSigning(), clock, new SecureRandom());
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 50; i++) {
            ids.add(generator.generate().keyId());
        }

        assertThat(ids).hasSize(50);
    }

    @Test
    @DisplayName("generate: Should wrap random source failures in KeyGenerationException")
    void generate_randomSourceFails() {
        // Arrange
        SecureRandom broken = new SecureRandom() {
            @Override
            public void nextBytes(byte[] bytes) {
                throw new ProviderException("entropy source unavailable");
            }
        };
        KeyMaterialGenerator generator = new KeyMaterialGenerator(TestProperties.ecSigning(), clock, broken);

        // Act & Assert
        assertThatThrownBy(generator::generate)
                .isInstanceOf(KeyGenerationException.class)
                .hasMessageContaining("EC")
                .hasCauseInstanceOf(ProviderException.class);
    }

    @Test
    @DisplayName("algorithm: Should map EC curves to their JWS algorithm")
    void algorithm_forCurves() {
        assertThat(KeyAlgorithm.forSigning(TestProperties.ecSigning())).isEqualTo(KeyAlgorithm.ES256);
        assertThat(KeyAlgorithm.forSigning(new KeyringProperties.SigningProperties(
                KeyringProperties.KeyType.EC, null, "P-384", "iss", Duration.ofMinutes(1))))
                .isEqualTo(KeyAlgorithm.ES384);
        assertThat(KeyAlgorithm.forSigning(TestProperties.rsaSigning())).isEqualTo(KeyAlgorithm.RS256);
    }
}
