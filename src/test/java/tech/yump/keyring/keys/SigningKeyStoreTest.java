package tech.yump.keyring.keys;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.yump.keyring.support.TestProperties;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SigningKeyStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Duration OVERLAP = Duration.ofDays(1);
    private static final Duration GRACE = Duration.ofMinutes(5);

    private static KeyPair keyPair;
    private int sequence;

    private SigningKeyStore store;

    @BeforeAll
    static void generateKeyPair() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        keyPair = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        store = new SigningKeyStore(TestProperties.rotation(5, true));
    }

    private KeyRecord newStandby(Instant createdAt) {
        return KeyRecord.standby("kid-" + (++sequence), KeyAlgorithm.ES256,
                keyPair.getPublic(), keyPair.getPrivate(), createdAt);
    }

    private KeyRecord rotateAt(SigningKeyStore target, Instant now) {
        target.insertStandby(newStandby(now));
        return target.promoteStandbyToActive(now).promoted();
    }

    @Nested
    @DisplayName("Before bootstrap")
    class BeforeBootstrap {

        @Test
        @DisplayName("getActive: Should throw NoActiveKeyException")
        void getActive_throws() {
            assertThat(store.isBootstrapped()).isFalse();
            assertThatThrownBy(store::getActive).isInstanceOf(NoActiveKeyException.class);
            assertThatThrownBy(() -> store.getEligibleForValidation(T0)).isInstanceOf(NoActiveKeyException.class);
        }

        @Test
        @DisplayName("promoteStandbyToActive: Should fail without standby and leave the ring untouched")
        void promote_withoutStandby() {
            KeyRing before = store.snapshot();

            assertThatThrownBy(() -> store.promoteStandbyToActive(T0)).isInstanceOf(NoStandbyKeyException.class);
            assertThat(store.snapshot()).isSameAs(before);
        }
    }

    @Nested
    @DisplayName("Promotion")
    class Promotions {

        @Test
        @DisplayName("promoteStandbyToActive: Should activate the first key with no previous key")
        void firstPromotion() {
            KeyRecord standby = newStandby(T0);
            store.insertStandby(standby);

            SigningKeyStore.Promotion promotion = store.promoteStandbyToActive(T0);

            assertThat(promotion.previous()).isNull();
            assertThat(promotion.promoted().keyId()).isEqualTo(standby.keyId());
            assertThat(store.getActive().state()).isEqualTo(KeyState.ACTIVE);
            assertThat(store.getActive().activatedAt()).isEqualTo(T0);
            assertThat(store.getStandby()).isEmpty();
        }

        @Test
        @DisplayName("promoteStandbyToActive: Should retire the previous key with expiresAt = now + overlap")
        void secondPromotion_retiresPrevious() {
            KeyRecord first = rotateAt(store, T0);
            Instant rotation = T0.plus(Duration.ofDays(7));

            store.insertStandby(newStandby(rotation));
            SigningKeyStore.Promotion promotion = store.promoteStandbyToActive(rotation);

            assertThat(promotion.previous()).isNotNull();
            assertThat(promotion.previous().keyId()).isEqualTo(first.keyId());
            assertThat(promotion.previous().state()).isEqualTo(KeyState.RETIRING);
            assertThat(promotion.previous().privateKey()).isNull();
            assertThat(promotion.previous().expiresAt()).isEqualTo(rotation.plus(OVERLAP));
            assertThat(store.snapshot().records())
                    .filteredOn(key -> key.state() == KeyState.ACTIVE)
                    .hasSize(1);
        }

        @Test
        @DisplayName("insertStandby: Should allow at most one standby key")
        void insertStandby_twice() {
            rotateAt(store, T0);
            store.insertStandby(newStandby(T0));

            assertThatThrownBy(() -> store.insertStandby(newStandby(T0)))
                    .isInstanceOf(StandbyAlreadyExistsException.class);
        }

        @Test
        @DisplayName("snapshot: Should stay unchanged after later mutations")
        void snapshot_isImmutable() {
            rotateAt(store, T0);
            KeyRing before = store.snapshot();

            rotateAt(store, T0.plus(Duration.ofDays(7)));

            assertThat(before.size()).isEqualTo(1);
            assertThat(before.active().orElseThrow().state()).isEqualTo(KeyState.ACTIVE);
            assertThat(store.snapshot().size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Validation eligibility")
    class Eligibility {

        @Test
        @DisplayName("getEligibleForValidation: Should list the active key first, then the most recently retired")
        void ordering() {
            KeyRecord first = rotateAt(store, T0);
            KeyRecord second = rotateAt(store, T0.plus(Duration.ofHours(1)));
            KeyRecord third = rotateAt(store, T0.plus(Duration.ofHours(2)));

            List<KeyRecord> eligible = store.getEligibleForValidation(T0.plus(Duration.ofHours(3)));

            assertThat(eligible).extracting(KeyRecord::keyId)
                    .containsExactly(third.keyId(), second.keyId(), first.keyId());
        }

        @Test
        @DisplayName("getEligibleForValidation: Should drop a retiring key once its overlap plus grace has passed")
        void windowCloses() {
            KeyRecord first = rotateAt(store, T0);
            Instant rotation = T0.plus(Duration.ofDays(7));
            KeyRecord second = rotateAt(store, rotation);
            Instant closesAt = rotation.plus(OVERLAP).plus(GRACE);

            assertThat(store.getEligibleForValidation(closesAt.minusSeconds(1)))
                    .extracting(KeyRecord::keyId).containsExactly(second.keyId(), first.keyId());
            assertThat(store.getEligibleForValidation(closesAt))
                    .extracting(KeyRecord::keyId).containsExactly(second.keyId());
        }

        @Test
        @DisplayName("getEligibleForValidation: Should never include the standby key")
        void standbyExcluded() {
            KeyRecord active = rotateAt(store, T0);
            store.insertStandby(newStandby(T0));

            assertThat(store.getEligibleForValidation(T0)).extracting(KeyRecord::keyId).containsExactly(active.keyId());
        }
    }

    @Nested
    @DisplayName("Garbage collection")
    class GarbageCollection {

        @Test
        @DisplayName("sweepExpired: Should remove only keys past expiresAt plus grace")
        void sweep() {
            KeyRecord first = rotateAt(store, T0);
            Instant rotation = T0.plus(Duration.ofDays(7));
            rotateAt(store, rotation);
            Instant closesAt = rotation.plus(OVERLAP).plus(GRACE);

            assertThat(store.sweepExpired(closesAt)).isEmpty();
            assertThat(store.sweepExpired(closesAt.plusSeconds(1))).containsExactly(first.keyId());
            assertThat(store.snapshot().keys()).doesNotContainKey(first.keyId());
        }

        @Test
        @DisplayName("insertStandby: Should drop the oldest retiring key when the retention bound is reached")
        void retentionBound() {
            SigningKeyStore bounded = new SigningKeyStore(TestProperties.rotation(3, true));
            KeyRecord first = rotateAt(bounded, T0);
            KeyRecord second = rotateAt(bounded, T0.plusSeconds(60));
            KeyRecord third = rotateAt(bounded, T0.plusSeconds(120));

            List<String> dropped = bounded.insertStandby(newStandby(T0.plusSeconds(180)));

            assertThat(dropped).containsExactly(first.keyId());
            assertThat(bounded.snapshot().size()).isEqualTo(3);
            assertThat(bounded.snapshot().keys()).containsKeys(second.keyId(), third.keyId());
            assertThat(bounded.getActive().keyId()).isEqualTo(third.keyId());
        }
    }

    @Nested
    @DisplayName("Restore")
    class Restore {

        @Test
        @DisplayName("restore: Should seed an empty store with retiring keys")
        void restore_intoEmptyStore() {
            KeyRecord retired = KeyRecord.retired("old", KeyAlgorithm.ES256, keyPair.getPublic(),
                    T0.minus(Duration.ofDays(8)), T0.minus(Duration.ofDays(8)), T0, T0.plus(OVERLAP));

            int restored = store.restore(List.of(retired));

            assertThat(restored).isEqualTo(1);
            assertThat(store.isBootstrapped()).isFalse();
            KeyRecord active = rotateAt(store, T0);
            assertThat(store.getEligibleForValidation(T0)).extracting(KeyRecord::keyId)
                    .containsExactly(active.keyId(), "old");
        }

        @Test
        @DisplayName("restore: Should refuse a store that already holds keys")
        void restore_nonEmptyStore() {
            rotateAt(store, T0);

            assertThatThrownBy(() -> store.restore(List.of())).isInstanceOf(IllegalStateException.class);
        }
    }
}
