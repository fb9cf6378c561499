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
package de.arbeitsagentur.sdjwt.verifier;

import de.arbeitsagentur.sdjwt.common.error.UnknownIssuerException;

import java.security.PublicKey;
import java.util.Map;

/**
 * Looks up the public key an issuer signs its SD-JWTs with.
 */
@FunctionalInterface
public interface IssuerKeyResolver {

    /**
     * @throws UnknownIssuerException if the issuer is not trusted
     */
    PublicKey resolve(String issuer);

    static IssuerKeyResolver fromKeys(Map<String, PublicKey> keys) {
        Map<String, PublicKey> trusted = Map.copyOf(keys);
        return issuer -> {
            PublicKey key = issuer == null ? null : trusted.get(issuer);
            if (key == null) {
                throw new UnknownIssuerException("Unknown issuer: " + issuer);
            }
            return key;
        };
    }
}
