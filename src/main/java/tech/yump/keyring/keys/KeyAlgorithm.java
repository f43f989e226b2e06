package tech.yump.keyring.keys;

import com.nimbusds.jose.JWSAlgorithm;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SignatureAlgorithm;
import tech.yump.keyring.config.KeyringProperties;

/**
 * JWS algorithms a signing key can be bound to. The algorithm is fixed when the key is generated.
 */
public enum KeyAlgorithm {
    RS256("RSA", Jwts.SIG.RS256, JWSAlgorithm.RS256),
    RS384("RSA", Jwts.SIG.RS384, JWSAlgorithm.RS384),
    RS512("RSA", Jwts.SIG.RS512, JWSAlgorithm.RS512),
    ES256("EC", Jwts.SIG.ES256, JWSAlgorithm.ES256),
    ES384("EC", Jwts.SIG.ES384, JWSAlgorithm.ES384),
    ES512("EC", Jwts.SIG.ES512, JWSAlgorithm.ES512);

    private final String keyType;
    private final SignatureAlgorithm signatureAlgorithm;
    private final JWSAlgorithm jwsAlgorithm;

    KeyAlgorithm(String keyType, SignatureAlgorithm signatureAlgorithm, JWSAlgorithm jwsAlgorithm) {
        this.keyType = keyType;
        this.signatureAlgorithm = signatureAlgorithm;
        this.jwsAlgorithm = jwsAlgorithm;
    }

    /** JCA key algorithm name ("RSA" or "EC"). */
    public String keyType() {
        return keyType;
    }

    /** Algorithm handed to jjwt when signing. */
    public SignatureAlgorithm signatureAlgorithm() {
        return signatureAlgorithm;
    }

    /** Algorithm published as the JWK "alg" parameter. */
    public JWSAlgorithm jwsAlgorithm() {
        return jwsAlgorithm;
    }

    /**
     * Resolves the algorithm for newly generated keys from the signing configuration:
     * RS256 for RSA, and the ES variant matching the configured curve for EC.
     *
     * @throws IllegalArgumentException if the configured curve is unsupported.
     */
    public static KeyAlgorithm forSigning(KeyringProperties.SigningProperties signing) {
        return switch (signing.keyType()) {
            case RSA -> RS256;
            case EC -> switch (signing.curve()) {
                case "P-256" -> ES256;
                case "P-384" -> ES384;
                case "P-521" -> ES512;
                default -> throw new IllegalArgumentException("Unsupported EC curve for JWS: " + signing.curve());
            };
        };
    }
}
