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

import de.arbeitsagentur.sdjwt.common.error.DuplicateDigestException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps digests to the disclosures they were computed from.
 * <p>
 * Built once per issuance, presentation or verification and discarded afterwards. Tree walks record
 * which digests they consumed, so the caller can find disclosures that nothing in the payload refers to.
 */
public final class DigestIndex {
    private final HashAlgorithm algorithm;
    private final Map<String, Disclosure> byDigest;
    private final Set<String> resolved = new HashSet<>();

    private DigestIndex(HashAlgorithm algorithm, Map<String, Disclosure> byDigest) {
        this.algorithm = algorithm;
        this.byDigest = byDigest;
    }

    /**
     * Indexes the disclosures by their digest, preserving input order.
     *
     * @throws DuplicateDigestException if two disclosures hash to the same digest
     */
    public static DigestIndex build(Collection<Disclosure> disclosures, HashAlgorithm algorithm) {
        Map<String, Disclosure> byDigest = new LinkedHashMap<>();
        if (disclosures != null) {
            int position = 0;
            for (Disclosure disclosure : disclosures) {
                String digest = disclosure.digest(algorithm);
                if (byDigest.putIfAbsent(digest, disclosure) != null) {
                    throw new DuplicateDigestException("Disclosure at position " + position
                            + " has the same digest as an earlier disclosure");
                }
                position++;
            }
        }
        return new DigestIndex(algorithm, byDigest);
    }

    public HashAlgorithm algorithm() {
        return algorithm;
    }

    public Disclosure get(String digest) {
        return digest == null ? null : byDigest.get(digest);
    }

    public boolean contains(String digest) {
        return digest != null && byDigest.containsKey(digest);
    }

    public int size() {
        return byDigest.size();
    }

    public Set<String> digests() {
        return Collections.unmodifiableSet(byDigest.keySet());
    }

    /**
     * Records that a tree walk replaced the placeholder for {@code digest}.
     *
     * @throws IllegalArgumentException if no disclosure with this digest is indexed
     * @throws DuplicateDigestException if the digest was already consumed earlier in the walk
     */
    public void resolve(String digest) {
        if (!byDigest.containsKey(digest)) {
            throw new IllegalArgumentException("Digest is not indexed: " + digest);
        }
        if (!resolved.add(digest)) {
            throw new DuplicateDigestException("Disclosure consumed more than once in the SD-JWT");
        }
    }

    /**
     * @return disclosures not consumed by any tree walk yet, in input order
     */
    public List<Disclosure> unresolved() {
        return byDigest.entrySet().stream()
                .filter(entry -> !resolved.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
    }
}
