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
package de.arbeitsagentur.sdjwt.testcases;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Contents of {@code settings.yml}, shared by all test cases in a directory.
 *
 * @param identifiers        issuer and verifier identifiers
 * @param iat                issuance time of every credential, also the generator's clock
 * @param exp                expiry of every credential
 * @param holderBindingNonce nonce the verifier expects in key binding JWTs
 * @param randomSeed         seed for salts and decoys
 * @param keySettings        issuer and holder keys as JWK objects, generated when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratorSettings(
        Identifiers identifiers,
        Long iat,
        Long exp,
        @JsonProperty("holder_binding_nonce") String holderBindingNonce,
        @JsonProperty("random_seed") Long randomSeed,
        @JsonProperty("key_settings") KeySettings keySettings
) {

    /**
     * @throws IllegalStateException if a mandatory setting is missing
     */
    public GeneratorSettings validate() {
        if (identifiers == null || isBlank(identifiers.issuer()) || isBlank(identifiers.verifier())) {
            throw new IllegalStateException("settings.yml must define identifiers.issuer and identifiers.verifier");
        }
        if (iat == null || exp == null) {
            throw new IllegalStateException("settings.yml must define iat and exp");
        }
        if (isBlank(holderBindingNonce)) {
            throw new IllegalStateException("settings.yml must define holder_binding_nonce");
        }
        return this;
    }

    public long seed() {
        return randomSeed != null ? randomSeed : 0L;
    }

    public KeySettings keySettings() {
        return keySettings != null ? keySettings : new KeySettings(null, null);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Identifiers(String issuer, String verifier) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KeySettings(
            @JsonProperty("issuer_key") Map<String, Object> issuerKey,
            @JsonProperty("holder_key") Map<String, Object> holderKey
    ) {
    }
}
