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
package de.arbeitsagentur.sdjwt.holder;

import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWK;
import de.arbeitsagentur.sdjwt.common.JwsSupport;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder for key binding JWTs ({@code kb+jwt}).
 * <p>
 * Signs {@code nonce}, {@code aud}, {@code iat} and {@code sd_hash} with the holder key, proving that the
 * presenter controls the key the issuer bound the credential to.
 */
public final class KeyBindingJwtBuilder {
    /** JWT type of key binding JWTs */
    public static final String TYPE_KB_JWT = "kb+jwt";

    private final JWK signingKey;
    private String audience;
    private String nonce;
    private String sdHash;
    private Instant issuedAt;
    private JWSAlgorithm algorithm;

    private KeyBindingJwtBuilder(JWK signingKey) {
        this.signingKey = signingKey;
    }

    /**
     * Creates a new builder with the given holder key.
     *
     * @param signingKey the private EC or RSA key to sign with
     * @return a new builder instance
     */
    public static KeyBindingJwtBuilder withKey(JWK signingKey) {
        return new KeyBindingJwtBuilder(signingKey);
    }

    /**
     * Sets the audience (verifier identifier).
     */
    public KeyBindingJwtBuilder audience(String audience) {
        this.audience = audience;
        return this;
    }

    /**
     * Sets the nonce received from the verifier.
     */
    public KeyBindingJwtBuilder nonce(String nonce) {
        this.nonce = nonce;
        return this;
    }

    /**
     * Sets the digest over the presented SD-JWT and disclosures.
     */
    public KeyBindingJwtBuilder sdHash(String sdHash) {
        this.sdHash = sdHash;
        return this;
    }

    public KeyBindingJwtBuilder issuedAt(Instant issuedAt) {
        this.issuedAt = issuedAt;
        return this;
    }

    /**
     * Overrides the algorithm derived from the key.
     */
    public KeyBindingJwtBuilder algorithm(JWSAlgorithm algorithm) {
        this.algorithm = algorithm;
        return this;
    }

    public Map<String, Object> claims() {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("nonce", nonce);
        claims.put("aud", audience);
        claims.put("iat", (issuedAt != null ? issuedAt : Instant.now()).getEpochSecond());
        if (sdHash != null) {
            claims.put("sd_hash", sdHash);
        }
        return claims;
    }

    /**
     * Builds and signs the key binding JWT.
     *
     * @return the serialized JWT
     * @throws de.arbeitsagentur.sdjwt.common.error.SigningException if signing fails
     */
    public String build(ObjectMapper objectMapper) {
        return JwsSupport.sign(signingKey, algorithm, new JOSEObjectType(TYPE_KB_JWT), null, claims(), objectMapper);
    }
}
