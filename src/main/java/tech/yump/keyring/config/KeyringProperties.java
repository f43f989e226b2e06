package tech.yump.keyring.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the keyring service under the 'keyring' prefix.
 */
@ConfigurationProperties(prefix = "keyring")
@Validated
public record KeyringProperties(

        @Valid
        @NotNull(message = "Storage configuration (keyring.storage) is required.")
        StorageProperties storage,

        @Valid
        AuthProperties auth,

        @Valid
        AuditProperties audit,

        @Valid
        @NotNull(message = "Signing configuration (keyring.signing) is required.")
        SigningProperties signing,

        @Valid
        @NotNull(message = "Rotation configuration (keyring.rotation) is required.")
        RotationProperties rotation
) {

    public enum StorageType {
        FILESYSTEM, MEMORY
    }

    @Validated
    public record StorageProperties(
            StorageType type,

            @Valid
            FileSystemProperties filesystem
    ) {
        public StorageProperties {
            if (type == null) {
                type = StorageType.FILESYSTEM;
            }
        }

        @AssertTrue(message = "Filesystem storage path (keyring.storage.filesystem.path) must be provided when keyring.storage.type=filesystem.")
        public boolean isFilesystemConfigValid() {
            return type != StorageType.FILESYSTEM
                    || (filesystem != null && StringUtils.hasText(filesystem.path()));
        }

        @Validated
        public record FileSystemProperties(
                String path
        ) {}
    }

    @Validated
    public record AuthProperties(
            @Valid
            StaticTokenAuthProperties staticTokens
    ) {

        @Validated
        public record StaticTokenPolicyMapping(
                @NotBlank(message = "Static token value cannot be blank")
                String token,

                @NotEmpty(message = "Token must be associated with at least one policy name")
                List<String> policyNames
        ) {
            @Override
            public String toString() {
                return "StaticTokenPolicyMapping[token=******, policyNames=" + policyNames + "]";
            }
        }

        @Validated
        public record StaticTokenAuthProperties(
                boolean enabled,

                @Valid
                List<StaticTokenPolicyMapping> mappings
        ) {
            public StaticTokenAuthProperties {
                if (mappings == null) {
                    mappings = Collections.emptyList();
                }
            }

            @AssertTrue(message = "Static token mappings (keyring.auth.static-tokens.mappings) cannot be empty when static token auth is enabled.")
            public boolean isMappingsValid() {
                return !this.enabled() || !this.mappings().isEmpty();
            }
        }
    }

    @Validated
    public record AuditProperties(
            String backend,

            @Valid
            FileAuditProperties file
    ) {
        @Validated
        public record FileAuditProperties(
                String path
        ) {
            public static final String PATH_PROPERTY = "keyring.audit.file.path";
        }
    }

    /**
     * Defines the type of the generated signing keys.
     */
    public enum KeyType {
        RSA, EC
    }

    /**
     * Shape of newly generated signing keys and the claims stamped on issued tokens.
     */
    @Validated
    public record SigningProperties(
            @NotNull(message = "Key type (keyring.signing.key-type: RSA or EC) must be specified.")
            KeyType keyType,

            @Min(value = 2048, message = "RSA key size must be at least 2048 bits.")
            Integer keySize,

            String curve,

            @NotBlank(message = "Token issuer (keyring.signing.issuer) must be provided.")
            String issuer,

            @NotNull(message = "Default token lifetime (keyring.signing.default-token-lifetime) must be provided.")
            Duration defaultTokenLifetime
    ) {
        private static final Set<String> ALLOWED_EC_CURVES = Set.of("P-256", "P-384", "P-521");

        @AssertTrue(message = "RSA keys must specify a 'key-size' (>= 2048) and must not specify a 'curve'.")
        public boolean isRsaConfigValid() {
            if (keyType == KeyType.RSA) {
                return keySize != null && keySize >= 2048 && !StringUtils.hasText(curve);
            }
            return true;
        }

        @AssertTrue(message = "EC keys must specify a valid 'curve' (P-256, P-384, P-521) and must not specify a 'key-size'.")
        public boolean isEcConfigValid() {
            if (keyType == KeyType.EC) {
                return StringUtils.hasText(curve) && ALLOWED_EC_CURVES.contains(curve) && keySize == null;
            }
            return true;
        }

        @AssertTrue(message = "Default token lifetime (keyring.signing.default-token-lifetime) must be positive.")
        public boolean isDefaultTokenLifetimePositive() {
            return defaultTokenLifetime == null || isPositive(defaultTokenLifetime);
        }
    }

    /**
     * Timing of the rotation schedule and of the overlap window granted to retiring keys.
     *
     * @param interval         how long a key stays active before the scheduler rotates it
     * @param overlap          how long a superseded key keeps validating tokens
     * @param validationGrace  clock-skew allowance added on top of the overlap
     * @param maxRetainedKeys  upper bound on keys held in the store, active and standby included
     * @param pregenerate      whether the next standby key is generated right after a rotation
     * @param maxPollInterval  longest time the scheduler sleeps before re-evaluating the deadline
     * @param schedulerEnabled whether the background scheduler runs at all
     */
    @Validated
    public record RotationProperties(
            @NotNull(message = "Rotation interval (keyring.rotation.interval) must be provided.")
            Duration interval,

            @NotNull(message = "Overlap duration (keyring.rotation.overlap) must be provided.")
            Duration overlap,

            @NotNull(message = "Validation grace period (keyring.rotation.validation-grace) must be provided.")
            Duration validationGrace,

            @Min(value = 2, message = "keyring.rotation.max-retained-keys must be at least 2 (active and standby).")
            int maxRetainedKeys,

            boolean pregenerate,

            @NotNull(message = "Scheduler poll interval (keyring.rotation.max-poll-interval) must be provided.")
            Duration maxPollInterval,

            boolean schedulerEnabled
    ) {
        @AssertTrue(message = "Rotation interval, overlap and max poll interval must be positive and the validation grace must not be negative.")
        public boolean isDurationsValid() {
            return (interval == null || isPositive(interval))
                    && (overlap == null || isPositive(overlap))
                    && (maxPollInterval == null || isPositive(maxPollInterval))
                    && (validationGrace == null || !validationGrace.isNegative());
        }

        @AssertTrue(message = "keyring.rotation.max-retained-keys must be at least 3 when keyring.rotation.pregenerate is true (active, standby and the key just retired).")
        public boolean isRetentionCompatibleWithPregeneration() {
            return !pregenerate || maxRetainedKeys >= 3;
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }
}
