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
import de.arbeitsagentur.sdjwt.common.error.SdJwtEncodingException;
import de.arbeitsagentur.sdjwt.common.error.UnresolvedDigestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the claim tree of an SD-JWT payload from the disclosures at hand.
 * <p>
 * {@code _sd} entries and {@code {"...": digest}} array elements whose digest has a disclosure are replaced
 * by the disclosed value, recursively. Digests without a disclosure (withheld claims and decoys) are dropped.
 * Every disclosure must be consumed by the walk; a disclosure that no digest in the payload or in another
 * disclosed value refers to fails the reconstruction.
 */
public final class ClaimReconstructor {
    private static final Logger LOG = LoggerFactory.getLogger(ClaimReconstructor.class);
    private static final String SD_ALG_CLAIM = "_sd_alg";

    private final DigestIndex index;
    private final Set<String> seenDigests = new HashSet<>();
    private final List<DisclosedClaim> disclosed = new ArrayList<>();

    private ClaimReconstructor(DigestIndex index) {
        this.index = index;
    }

    /**
     * @throws UnresolvedDigestException if a disclosure is not referenced by the payload
     * @throws DuplicateDigestException  if a digest occurs more than once
     * @throws SdJwtEncodingException    if placeholders or disclosures are structurally invalid
     */
    public static Reconstruction reconstruct(Map<String, Object> payload, DigestIndex index) {
        ClaimReconstructor reconstructor = new ClaimReconstructor(index);
        Map<String, Object> claims = reconstructor.resolveObject(payload, ClaimPath.root());
        List<Disclosure> unresolved = index.unresolved();
        if (!unresolved.isEmpty()) {
            LOG.debug("{} of {} disclosures are not referenced by the payload", unresolved.size(), index.size());
            throw new UnresolvedDigestException(unresolved.size()
                    + " disclosure(s) do not match any digest in the SD-JWT");
        }
        return new Reconstruction(claims, List.copyOf(reconstructor.disclosed));
    }

    private Object resolve(Object node, ClaimPath path) {
        if (node instanceof Map<?, ?> map) {
            return resolveObject(map, path);
        }
        if (node instanceof List<?> list) {
            return resolveArray(list, path);
        }
        return node;
    }

    private Map<String, Object> resolveObject(Map<?, ?> object, ClaimPath path) {
        Map<String, Object> out = new LinkedHashMap<>();
        Object digests = null;
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (Disclosure.SD_CLAIM.equals(name)) {
                digests = entry.getValue();
                continue;
            }
            if (path.isRoot() && SD_ALG_CLAIM.equals(name)) {
                continue;
            }
            if (Disclosure.ARRAY_ELEMENT_KEY.equals(name)) {
                throw new SdJwtEncodingException("Array element placeholder outside of an array at " + path);
            }
            out.put(name, resolve(entry.getValue(), path.child(name)));
        }
        if (digests == null) {
            return out;
        }
        if (!(digests instanceof List<?> list)) {
            throw new SdJwtEncodingException("_sd must be an array at " + path);
        }
        for (Object item : list) {
            if (!(item instanceof String digest)) {
                throw new SdJwtEncodingException("_sd must contain only strings at " + path);
            }
            Disclosure disclosure = claim(digest);
            if (disclosure == null) {
                continue;
            }
            if (disclosure.isArrayElement()) {
                throw new SdJwtEncodingException("Array element disclosure referenced from _sd at " + path);
            }
            String name = disclosure.getClaimName();
            if (out.containsKey(name)) {
                throw new SdJwtEncodingException("Disclosed claim " + name + " already present at " + path);
            }
            ClaimPath childPath = path.child(name);
            disclosed.add(new DisclosedClaim(childPath, disclosure));
            out.put(name, resolve(disclosure.getClaimValue(), childPath));
        }
        return out;
    }

    private List<Object> resolveArray(List<?> array, ClaimPath path) {
        List<Object> out = new ArrayList<>(array.size());
        for (Object element : array) {
            if (isElementPlaceholder(element)) {
                Object value = ((Map<?, ?>) element).get(Disclosure.ARRAY_ELEMENT_KEY);
                if (!(value instanceof String digest)) {
                    throw new SdJwtEncodingException("Array element digest must be a string at " + path);
                }
                Disclosure disclosure = claim(digest);
                if (disclosure == null) {
                    continue;
                }
                if (!disclosure.isArrayElement()) {
                    throw new SdJwtEncodingException("Object property disclosure referenced from an array at " + path);
                }
                ClaimPath childPath = path.index(out.size());
                disclosed.add(new DisclosedClaim(childPath, disclosure));
                out.add(resolve(disclosure.getClaimValue(), childPath));
            } else {
                out.add(resolve(element, path.index(out.size())));
            }
        }
        return out;
    }

    /**
     * Registers a digest occurrence and returns its disclosure, or null for withheld claims and decoys.
     */
    private Disclosure claim(String digest) {
        if (!seenDigests.add(digest)) {
            throw new DuplicateDigestException("Digest referenced more than once in the SD-JWT");
        }
        Disclosure disclosure = index.get(digest);
        if (disclosure != null) {
            index.resolve(digest);
        }
        return disclosure;
    }

    private static boolean isElementPlaceholder(Object element) {
        return element instanceof Map<?, ?> map
                && map.size() == 1
                && map.containsKey(Disclosure.ARRAY_ELEMENT_KEY);
    }

    /**
     * @param claims    the reconstructed claims, without {@code _sd} and {@code _sd_alg}
     * @param disclosed every consumed disclosure with its location, in walk order
     */
    public record Reconstruction(Map<String, Object> claims, List<DisclosedClaim> disclosed) {
    }
}
