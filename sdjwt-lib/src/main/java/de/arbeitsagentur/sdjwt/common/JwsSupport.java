/*
 * Copyright 2026 Bundesagentur für Arbeit
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.arbeitsagentur.sdjwt.common;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.SignedJWT;
import de.arbeitsagentur.sdjwt.common.error.SdJwtEncodingException;
import de.arbeitsagentur.sdjwt.common.error.SigningException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin layer over Nimbus JOSE for the signed objects of an SD-JWT.
 * Supports algorithm negotiation based on the signing key type:
 * - EC keys: ES256 (P-256), ES384 (P-384), ES512 (P-521)
 * - RSA keys: RS256
 */
public final class JwsSupport {

    private JwsSupport() {
    }

    /**
     * Signs {@code claims} with {@code signingKey} and returns the compact serialization.
     * The payload is serialized with Jackson so it carries exactly the JSON types of the claim tree.
     *
     * @param algorithmOverride algorithm to use instead of the one derived from the key, may be null
     * @param keyId             {@code kid} header value, may be null
     * @throws SigningException if the key cannot sign or the primitive fails
     */
    public static String sign(JWK signingKey,
                              JWSAlgorithm algorithmOverride,
                              JOSEObjectType type,
                              String keyId,
                              Map<String, Object> claims,
                              ObjectMapper mapper) {
        if (signingKey == null || !signingKey.isPrivate()) {
            throw new SigningException("Signing requires a private key");
        }
        try {
            JWSAlgorithm algorithm = resolveAlgorithm(signingKey, algorithmOverride);
            JWSSigner signer = createSigner(signingKey);
            JWSHeader.Builder header = new JWSHeader.Builder(algorithm).type(type);
            if (keyId != null) {
                header.keyID(keyId);
            }
            JWSObject jws = new JWSObject(header.build(), new Payload(mapper.writeValueAsString(claims)));
            jws.sign(signer);
            return jws.serialize();
        } catch (JOSEException e) {
            throw new SigningException("Failed to sign JWT", e);
        } catch (JacksonException e) {
            throw new SigningException("Failed to serialize JWT payload", e);
        }
    }

    public static JWSAlgorithm resolveAlgorithm(JWK signingKey, JWSAlgorithm algorithmOverride) {
        if (algorithmOverride != null) {
            return algorithmOverride;
        }
        if (signingKey instanceof ECKey ecKey) {
            Curve curve = ecKey.getCurve();
            if (Curve.P_384.equals(curve)) {
                return JWSAlgorithm.ES384;
            } else if (Curve.P_521.equals(curve)) {
                return JWSAlgorithm.ES512;
            }
            return JWSAlgorithm.ES256;
        }
        if (signingKey instanceof RSAKey) {
            return JWSAlgorithm.RS256;
        }
        return JWSAlgorithm.ES256;
    }

    private static JWSSigner createSigner(JWK signingKey) throws JOSEException {
        if (signingKey instanceof ECKey ecKey) {
            return new ECDSASigner(ecKey);
        }
        if (signingKey instanceof RSAKey rsaKey) {
            return new RSASSASigner(rsaKey);
        }
        throw new JOSEException("Unsupported key type: " + signingKey.getKeyType());
    }

    /**
     * Verifies a JWS against an EC or RSA public key. Any failure counts as "not verified".
     */
    public static boolean verifyWithKey(SignedJWT jwt, PublicKey key) {
        try {
            JWSVerifier verifier = null;
            if (key instanceof RSAPublicKey rsa) {
                verifier = new RSASSAVerifier(rsa);
            } else if (key instanceof ECPublicKey ec) {
                verifier = new ECDSAVerifier(ec);
            }
            return verifier != null && jwt.verify(verifier);
        } catch (JOSEException | IllegalStateException e) {
            return false;
        }
    }

    /**
     * @throws SdJwtEncodingException if the value is not a compact JWS
     */
    public static SignedJWT parse(String compact) {
        try {
            return SignedJWT.parse(compact);
        } catch (ParseException e) {
            throw new SdJwtEncodingException("Not a compact JWS", e);
        }
    }

    /**
     * Decodes the payload with Jackson so numbers, maps and lists get the same types as in disclosures.
     */
    public static Map<String, Object> payload(SignedJWT jwt, ObjectMapper mapper) {
        try {
            Map<String, Object> payload = mapper.readValue(jwt.getPayload().toString(),
                    new TypeReference<LinkedHashMap<String, Object>>() {});
            if (payload == null) {
                throw new SdJwtEncodingException("JWT payload is not a JSON object");
            }
            return payload;
        } catch (JacksonException e) {
            throw new SdJwtEncodingException("JWT payload is not a JSON object", e);
        }
    }

    /**
     * Converts a public EC or RSA JWK given as JSON object into a {@link PublicKey}.
     *
     * @return the key, or null if the object is not a supported public JWK
     */
    public static PublicKey toPublicKey(Object jwkObject) {
        if (!(jwkObject instanceof Map<?, ?> map)) {
            return null;
        }
        try {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() != null) {
                    normalized.put(entry.getKey().toString(), entry.getValue());
                }
            }
            return toPublicKey(JWK.parse(normalized));
        } catch (ParseException e) {
            return null;
        }
    }

    public static PublicKey toPublicKey(JWK jwk) {
        try {
            if (jwk instanceof ECKey ecKey) {
                return ecKey.toECPublicKey();
            }
            if (jwk instanceof RSAKey rsaKey) {
                return rsaKey.toRSAPublicKey();
            }
            return null;
        } catch (JOSEException e) {
            return null;
        }
    }
}
