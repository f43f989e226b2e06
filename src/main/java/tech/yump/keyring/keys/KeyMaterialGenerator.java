package tech.yump.keyring.keys;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tech.yump.keyring.config.KeyringProperties;

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.util.UUID;

/**
 * Produces fresh asymmetric key pairs in the shape configured under {@code keyring.signing}.
 * Both the key material and the key id come from a {@link SecureRandom} source.
 */
@Component
@Slf4j
public class KeyMaterialGenerator {

    private final KeyringProperties.SigningProperties signing;
    private final KeyAlgorithm algorithm;
    private final Clock clock;
    private final SecureRandom secureRandom;

    @Autowired
    public KeyMaterialGenerator(KeyringProperties properties, Clock clock) {
        this(properties.signing(), clock, new SecureRandom());
    }

    KeyMaterialGenerator(KeyringProperties.SigningProperties signing, Clock clock, SecureRandom secureRandom) {
        this.signing = signing;
        this.algorithm = KeyAlgorithm.forSigning(signing);
        this.clock = clock;
        this.secureRandom = secureRandom;
    }

    /**
     * Generates a new STANDBY key.
     *
     * @throws KeyGenerationException if the key pair cannot be produced.
     */
    public KeyRecord generate() {
        KeyPair keyPair = generateKeyPair();
        // UUID.randomUUID() draws from a SecureRandom as well.
        String keyId = UUID.randomUUID().toString();
        KeyRecord key = KeyRecord.standby(keyId, algorithm, keyPair.getPublic(), keyPair.getPrivate(), clock.instant());
        log.debug("Generated {} key pair with kid {}", algorithm, keyId);
        return key;
    }

    public KeyAlgorithm algorithm() {
        return algorithm;
    }

    private KeyPair generateKeyPair() {
        try {
            KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance(algorithm.keyType());
            switch (signing.keyType()) {
                case RSA -> keyPairGenerator.initialize(signing.keySize(), secureRandom);
                case EC -> {
                    String javaCurveName = switch (signing.curve()) {
                        case "P-256" -> "secp256r1";
                        case "P-384" -> "secp384r1";
                        case "P-521" -> "secp521r1";
                        default -> throw new InvalidAlgorithmParameterException("Unsupported or unknown curve name configured: " + signing.curve());
                    };
                    keyPairGenerator.initialize(new ECGenParameterSpec(javaCurveName), secureRandom);
                }
            }
            return keyPairGenerator.generateKeyPair();
        } catch (GeneralSecurityException | ProviderException e) {
            log.error("Failed to generate {} key pair: {}", signing.keyType(), e.getMessage(), e);
            throw new KeyGenerationException("Failed to generate " + signing.keyType() + " signing key pair", e);
        }
    }
}
