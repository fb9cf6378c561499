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

import com.authlete.sd.Disclosure;
import com.authlete.sd.SDJWT;
import de.arbeitsagentur.sdjwt.common.error.SdJwtEncodingException;

import java.util.List;

/**
 * The segments of a combined artifact: {@code <jwt>~<disclosure>~...~[<kb-jwt>]}.
 * <p>
 * An artifact ending in {@code ~} carries no key binding JWT. That is the normal shape of an issuance.
 */
public record SdJwtParts(String signedJwt, List<String> disclosures, String keyBindingJwt) {
    private static final String EMPTY_SEGMENT = "" + TokenFormatUtils.SDJWT_SEPARATOR + TokenFormatUtils.SDJWT_SEPARATOR;

    public SdJwtParts {
        disclosures = disclosures == null ? List.of() : List.copyOf(disclosures);
    }

    /**
     * Splits a combined artifact.
     *
     * @throws SdJwtEncodingException if the artifact does not follow the grammar
     */
    public static SdJwtParts split(String token) {
        if (token == null || token.isBlank()) {
            throw new SdJwtEncodingException("Empty SD-JWT");
        }
        if (!TokenFormatUtils.isSdJwt(token)) {
            throw new SdJwtEncodingException("SD-JWT must contain at least one '~' separator");
        }
        if (token.contains(EMPTY_SEGMENT)) {
            throw new SdJwtEncodingException("SD-JWT contains an empty disclosure segment");
        }
        if (!TokenFormatUtils.isJwt(token.substring(0, token.indexOf(TokenFormatUtils.SDJWT_SEPARATOR)))) {
            throw new SdJwtEncodingException("First segment of the SD-JWT is not a compact JWS");
        }
        SDJWT parsed;
        try {
            parsed = SDJWT.parse(token);
        } catch (RuntimeException e) {
            throw new SdJwtEncodingException("Malformed SD-JWT: " + e.getMessage(), e);
        }
        String keyBindingJwt = parsed.getBindingJwt();
        if (keyBindingJwt != null && !TokenFormatUtils.isJwt(keyBindingJwt)) {
            throw new SdJwtEncodingException("SD-JWT must end with '~' or a key binding JWT");
        }
        List<String> disclosures = parsed.getDisclosures().stream()
                .map(Disclosure::getDisclosure)
                .toList();
        return new SdJwtParts(parsed.getCredentialJwt(), disclosures, keyBindingJwt);
    }

    /**
     * @return the parts serialized back into the combined format
     */
    public String serialize() {
        StringBuilder sb = new StringBuilder(withoutKeyBinding());
        if (keyBindingJwt != null) {
            sb.append(keyBindingJwt);
        }
        return sb.toString();
    }

    /**
     * @return {@code <jwt>~<d1>~...~<dn>~}, the string a key binding JWT's {@code sd_hash} covers
     */
    public String withoutKeyBinding() {
        StringBuilder sb = new StringBuilder(signedJwt).append(TokenFormatUtils.SDJWT_SEPARATOR);
        for (String disclosure : disclosures) {
            sb.append(disclosure).append(TokenFormatUtils.SDJWT_SEPARATOR);
        }
        return sb.toString();
    }

    /**
     * Computes the {@code sd_hash} over the presented SD-JWT and its disclosures.
     */
    public String sdHash(HashAlgorithm algorithm) {
        return algorithm.digest(withoutKeyBinding());
    }

    public SdJwtParts withKeyBinding(String keyBinding) {
        return new SdJwtParts(signedJwt, disclosures, keyBinding);
    }
}
