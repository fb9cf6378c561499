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

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.text.ParseException;
import java.util.Map;

/**
 * Issuer and holder keys of a fixture run.
 */
public record DemoKeys(JWK issuerKey, JWK holderKey) {

    /**
     * Parses the configured keys. Missing keys are generated from {@code seed}, so reruns sign with the
     * same keys.
     */
    public static DemoKeys from(GeneratorSettings.KeySettings settings, long seed) {
        SecureRandom random = seededRandom(seed);
        JWK issuerKey = settings.issuerKey() != null
                ? parse(settings.issuerKey(), "issuer_key")
                : generate("issuer-key", random);
        JWK holderKey = settings.holderKey() != null
                ? parse(settings.holderKey(), "holder_key")
                : generate("holder-key", random);
        if (!issuerKey.isPrivate() || !holderKey.isPrivate()) {
            throw new IllegalStateException("key_settings must contain private keys");
        }
        return new DemoKeys(issuerKey, holderKey);
    }

    private static JWK parse(Map<String, Object> jwk, String name) {
        try {
            return JWK.parse(jwk);
        } catch (ParseException e) {
            throw new IllegalStateException("Invalid JWK in key_settings." + name, e);
        }
    }

    private static JWK generate(String keyId, SecureRandom random) {
        try {
            return new ECKeyGenerator(Curve.P_256)
                    .keyID(keyId)
                    .secureRandom(random)
                    .generate();
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to generate " + keyId, e);
        }
    }

    private static SecureRandom seededRandom(long seed) {
        try {
            SecureRandom random = SecureRandom.getInstance("SHA1PRNG");
            random.setSeed(seed);
            return random;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA1PRNG not available", e);
        }
    }
}
