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

import com.nimbusds.jose.jwk.JWK;

/**
 * Verifier-supplied inputs for the key binding JWT, plus the holder's private key.
 */
public record KeyBindingRequest(String nonce, String audience, JWK holderKey) {

    public KeyBindingRequest {
        if (nonce == null || nonce.isBlank()) {
            throw new IllegalArgumentException("Key binding requires a nonce");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("Key binding requires an audience");
        }
    }
}
