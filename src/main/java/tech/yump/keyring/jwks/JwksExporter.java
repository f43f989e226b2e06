package tech.yump.keyring.jwks;

import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.keyring.keys.KeyRecord;
import tech.yump.keyring.keys.KeyringException;
import tech.yump.keyring.keys.SigningKeyStore;

import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders every key eligible for validation as a public JWK Set (RFC 7517), newest key first.
 * Members are emitted in a stable order: kty, use, alg, kid, then the key parameters sorted
 * by name. Private parameters are never present.
 */
@Service
@Slf4j
public class JwksExporter {

    private static final List<String> LEADING_MEMBERS = List.of("kty", "use", "alg", "kid");

    private final SigningKeyStore keyStore;
    private final Clock clock;

    public JwksExporter(SigningKeyStore keyStore, Clock clock) {
        this.keyStore = keyStore;
        this.clock = clock;
    }

    /**
     * @return {@code {"keys": [...]}}
     * @throws tech.yump.keyring.keys.NoActiveKeyException before bootstrap.
     */
    public Map<String, Object> export() {
        List<Map<String, Object>> jwks = keyStore.getEligibleForValidation(clock.instant()).stream()
                .sorted(Comparator.comparing(KeyRecord::createdAt).reversed())
                .map(key -> orderMembers(toPublicJwk(key).toJSONObject()))
                .toList();
        log.debug("Exporting JWKS with {} key(s).", jwks.size());

        Map<String, Object> jwkSet = new LinkedHashMap<>();
        jwkSet.put("keys", jwks);
        return jwkSet;
    }

    private JWK toPublicJwk(KeyRecord key) {
        PublicKey publicKey = key.publicKey();
        if (publicKey instanceof RSAPublicKey rsaPublicKey) {
            return new RSAKey.Builder(rsaPublicKey)
                    .keyUse(KeyUse.SIGNATURE)
                    .algorithm(key.algorithm().jwsAlgorithm())
                    .keyID(key.keyId())
                    .build()
                    .toPublicJWK();
        }
        if (publicKey instanceof ECPublicKey ecPublicKey) {
            Curve curve = Curve.forECParameterSpec(ecPublicKey.getParams());
            if (curve == null) {
                throw new KeyringException("Could not determine JWK curve for EC key " + key.keyId());
            }
            return new ECKey.Builder(curve, ecPublicKey)
                    .keyUse(KeyUse.SIGNATURE)
                    .algorithm(key.algorithm().jwsAlgorithm())
                    .keyID(key.keyId())
                    .build()
                    .toPublicJWK();
        }
        throw new KeyringException("Unsupported public key type for JWK conversion: " + publicKey.getAlgorithm());
    }

    private static Map<String, Object> orderMembers(Map<String, Object> jwk) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String member : LEADING_MEMBERS) {
            if (jwk.containsKey(member)) {
                ordered.put(member, jwk.get(member));
            }
        }
        new TreeMap<>(jwk).forEach(ordered::putIfAbsent);
        return ordered;
    }
}
