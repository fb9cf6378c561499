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
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One selectively disclosable claim: {@code [salt, claimName, claimValue]} for object properties,
 * {@code [salt, claimValue]} for array elements.
 * <p>
 * Encoding, parsing and digesting go through authlete's {@link com.authlete.sd.Disclosure}, which keeps the
 * encoded form exactly as created or received. Digests are always computed over it, never over a
 * re-serialization, so a parsed disclosure hashes to the same value the issuer committed to.
 */
public final class Disclosure {
    /** Key of the digest list in objects */
    public static final String SD_CLAIM = "_sd";
    /** Key of an array element placeholder */
    public static final String ARRAY_ELEMENT_KEY = "...";
    private static final Set<String> RESERVED_NAMES = Set.of(SD_CLAIM, ARRAY_ELEMENT_KEY);

    private final com.authlete.sd.Disclosure delegate;
    private final Object claimValue;

    private Disclosure(com.authlete.sd.Disclosure delegate, Object claimValue) {
        this.delegate = delegate;
        this.claimValue = claimValue;
    }

    /**
     * Creates a disclosure. Pass a {@code null} claim name for an array element.
     */
    public static Disclosure create(String salt, String claimName, Object claimValue, ObjectMapper mapper) {
        if (salt == null || salt.isBlank()) {
            throw new IllegalArgumentException("Disclosure salt must not be empty");
        }
        if (claimName != null && RESERVED_NAMES.contains(claimName)) {
            throw new IllegalArgumentException("Reserved claim name: " + claimName);
        }
        return new Disclosure(new com.authlete.sd.Disclosure(salt, claimName, claimValue), claimValue);
    }

    /**
     * Parses a base64url encoded disclosure.
     * <p>
     * The claim value is read back through {@code mapper}, so numbers and objects come out as the same
     * types as in the JWT payload.
     *
     * @throws SdJwtEncodingException if the value is not a well-formed disclosure
     */
    public static Disclosure parse(String encoded, ObjectMapper mapper) {
        if (!TokenFormatUtils.isBase64Url(encoded)) {
            throw new SdJwtEncodingException("Disclosure is not base64url encoded");
        }
        com.authlete.sd.Disclosure parsed;
        try {
            parsed = com.authlete.sd.Disclosure.parse(encoded);
        } catch (RuntimeException e) {
            throw new SdJwtEncodingException("Disclosure is malformed: " + e.getMessage(), e);
        }
        if (parsed.getSalt().isBlank()) {
            throw new SdJwtEncodingException("Disclosure salt must not be empty");
        }
        if (parsed.getClaimName() != null && RESERVED_NAMES.contains(parsed.getClaimName())) {
            throw new SdJwtEncodingException("Disclosure uses reserved claim name " + parsed.getClaimName());
        }
        List<Object> array;
        try {
            array = mapper.readValue(parsed.getJson(), new TypeReference<List<Object>>() {});
        } catch (JacksonException e) {
            throw new SdJwtEncodingException("Disclosure is not strict JSON", e);
        }
        return new Disclosure(parsed, array.get(array.size() - 1));
    }

    public String digest(HashAlgorithm algorithm) {
        return delegate.digest(algorithm.identifier());
    }

    /**
     * @return the {@code {"...": digest}} placeholder standing for this array element
     */
    public Map<String, Object> toArrayElement(HashAlgorithm algorithm) {
        return delegate.toArrayElement(algorithm.identifier());
    }

    public String getSalt() {
        return delegate.getSalt();
    }

    /**
     * @return the claim name, or {@code null} for an array element disclosure
     */
    public String getClaimName() {
        return delegate.getClaimName();
    }

    public Object getClaimValue() {
        return claimValue;
    }

    public String getEncoded() {
        return delegate.getDisclosure();
    }

    public boolean isArrayElement() {
        return delegate.getClaimName() == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Disclosure other)) {
            return false;
        }
        return getEncoded().equals(other.getEncoded());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getEncoded());
    }

    @Override
    public String toString() {
        return isArrayElement() ? "Disclosure[array element]" : "Disclosure[" + getClaimName() + "]";
    }
}
