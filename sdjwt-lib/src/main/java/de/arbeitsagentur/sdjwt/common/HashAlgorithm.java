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

import de.arbeitsagentur.sdjwt.common.error.SdJwtEncodingException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;

/**
 * Digest algorithms usable for {@code _sd_alg}, named by their IANA hash identifiers.
 */
public enum HashAlgorithm {
    SHA_256("sha-256", "SHA-256"),
    SHA_384("sha-384", "SHA-384"),
    SHA_512("sha-512", "SHA-512");

    /** Algorithm assumed when a payload carries no {@code _sd_alg} claim */
    public static final HashAlgorithm DEFAULT = SHA_256;

    private final String identifier;
    private final String messageDigestName;

    HashAlgorithm(String identifier, String messageDigestName) {
        this.identifier = identifier;
        this.messageDigestName = messageDigestName;
    }

    public String identifier() {
        return identifier;
    }

    /**
     * Resolves an {@code _sd_alg} value. Accepts the identifiers with or without the dash.
     *
     * @throws SdJwtEncodingException if the identifier is not supported
     */
    public static HashAlgorithm fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return DEFAULT;
        }
        return switch (identifier.toLowerCase(Locale.ROOT)) {
            case "sha-256", "sha256" -> SHA_256;
            case "sha-384", "sha384" -> SHA_384;
            case "sha-512", "sha512" -> SHA_512;
            default -> throw new SdJwtEncodingException("Unsupported _sd_alg: " + identifier);
        };
    }

    /**
     * Reads {@code _sd_alg} from a decoded SD-JWT payload.
     */
    public static HashAlgorithm fromPayload(Map<String, Object> payload) {
        Object alg = payload.get("_sd_alg");
        if (alg != null && !(alg instanceof String)) {
            throw new SdJwtEncodingException("_sd_alg must be a string");
        }
        return fromIdentifier((String) alg);
    }

    /**
     * Hashes the ASCII bytes of {@code value} and returns the base64url digest without padding.
     */
    public String digest(String value) {
        byte[] hashed = newMessageDigest().digest(value.getBytes(StandardCharsets.US_ASCII));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(hashed);
    }

    private MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(messageDigestName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(messageDigestName + " not available", e);
        }
    }
}
