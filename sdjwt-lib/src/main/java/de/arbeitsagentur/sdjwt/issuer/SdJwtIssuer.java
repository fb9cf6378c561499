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
package de.arbeitsagentur.sdjwt.issuer;

import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWK;
import de.arbeitsagentur.sdjwt.common.ClaimPath;
import de.arbeitsagentur.sdjwt.common.Disclosure;
import de.arbeitsagentur.sdjwt.common.HashAlgorithm;
import de.arbeitsagentur.sdjwt.common.JwsSupport;
import de.arbeitsagentur.sdjwt.common.RandomSource;
import de.arbeitsagentur.sdjwt.common.SdJwtParts;
import de.arbeitsagentur.sdjwt.common.error.PolicyException;
import de.arbeitsagentur.sdjwt.common.error.SigningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Issues SD-JWTs: replaces the claims selected by the {@link DisclosurePolicy} with digests, adds decoys,
 * signs the payload and combines it with the disclosures.
 * <p>
 * Instances hold only configuration and may be shared between threads.
 */
public class SdJwtIssuer {
    private static final Logger LOG = LoggerFactory.getLogger(SdJwtIssuer.class);
    /** Top-level claims that are never replaced by digests */
    public static final Set<String> REGISTERED_CLAIMS = Set.of("iss", "iat", "exp", "nbf", "cnf");
    public static final String SD_ALG_CLAIM = "_sd_alg";
    public static final String CNF_CLAIM = "cnf";

    private final ObjectMapper objectMapper;
    private final JWK signingKey;
    private final IssuerConfig config;

    public SdJwtIssuer(ObjectMapper objectMapper, JWK signingKey) {
        this(objectMapper, signingKey, IssuerConfig.defaults());
    }

    public SdJwtIssuer(ObjectMapper objectMapper, JWK signingKey, IssuerConfig config) {
        this.objectMapper = objectMapper;
        this.signingKey = signingKey;
        this.config = config != null ? config : IssuerConfig.defaults();
    }

    public IssuerConfig config() {
        return config;
    }

    public SdJwtIssuance issue(Map<String, Object> claims) {
        return issue(claims, null);
    }

    /**
     * Issues a credential.
     *
     * @param claims    the user claims, optionally with {@code iss}, {@code iat}, {@code exp}
     * @param holderKey holder public key to bind the credential to ({@code cnf}), may be null
     * @throws PolicyException  if the claims or the disclosure policy are unusable
     * @throws SigningException if signing fails
     */
    public SdJwtIssuance issue(Map<String, Object> claims, JWK holderKey) {
        if (signingKey == null) {
            throw new SigningException("No issuer signing key configured");
        }
        if (claims == null) {
            throw new PolicyException("Claims must not be null");
        }
        if (claims.containsKey(SD_ALG_CLAIM)) {
            throw new PolicyException("Claims must not contain the reserved claim " + SD_ALG_CLAIM);
        }
        if (holderKey != null && claims.containsKey(CNF_CLAIM)) {
            throw new PolicyException("Claims already contain cnf but a holder key was supplied");
        }
        DisclosurePolicy policy = config.disclosurePolicy();
        policy.validate(claims);

        HashAlgorithm algorithm = config.digestAlgorithm();
        Encoding encoding = new Encoding(objectMapper, policy, config.decoyPolicy(),
                config.randomSource(), algorithm);
        Map<String, Object> payload = encoding.encodeObject(claims, ClaimPath.root());
        addRegisteredClaims(payload);
        payload.put(SD_ALG_CLAIM, algorithm.identifier());
        if (holderKey != null) {
            payload.put(CNF_CLAIM, Map.of("jwk", holderKey.toPublicJWK().toJSONObject()));
        }

        JWSAlgorithm jwsAlgorithm = JwsSupport.resolveAlgorithm(signingKey, config.signatureAlgorithm());
        String keyId = Optional.ofNullable(signingKey.getKeyID())
                .orElse("issuer-" + jwsAlgorithm.getName().toLowerCase());
        String signedJwt = JwsSupport.sign(signingKey, jwsAlgorithm, new JOSEObjectType(config.type()),
                keyId, payload, objectMapper);

        List<String> encoded = encoding.disclosures.stream().map(Disclosure::getEncoded).toList();
        String combined = new SdJwtParts(signedJwt, encoded, null).serialize();
        LOG.debug("Issued SD-JWT for iss={} with {} disclosures and {} decoys (alg={}, _sd_alg={})",
                payload.get("iss"), encoding.disclosures.size(), encoding.decoys.size(),
                jwsAlgorithm, algorithm.identifier());
        return new SdJwtIssuance(combined,
                signedJwt,
                Collections.unmodifiableMap(payload),
                List.copyOf(encoding.disclosures),
                List.copyOf(encoding.decoys));
    }

    private void addRegisteredClaims(Map<String, Object> payload) {
        if (!payload.containsKey("iss")) {
            if (config.issuer() == null || config.issuer().isBlank()) {
                throw new PolicyException("Claims carry no iss and no issuer is configured");
            }
            payload.put("iss", config.issuer());
        }
        Instant now = config.clock().instant();
        if (config.includeIssuedAt() && !payload.containsKey("iat")) {
            payload.put("iat", now.getEpochSecond());
        }
        if (config.credentialTtl() != null && !payload.containsKey("exp")) {
            payload.put("exp", now.plus(config.credentialTtl()).getEpochSecond());
        }
    }

    /**
     * State of a single issuance: the disclosures and decoys generated so far.
     */
    private static final class Encoding {
        private final DisclosurePolicy policy;
        private final DecoyPolicy decoyPolicy;
        private final RandomSource random;
        private final HashAlgorithm algorithm;
        private final List<Disclosure> disclosures = new ArrayList<>();
        private final List<String> decoys = new ArrayList<>();
        private final ObjectMapper mapper;

        private Encoding(ObjectMapper mapper, DisclosurePolicy policy, DecoyPolicy decoyPolicy,
                         RandomSource random, HashAlgorithm algorithm) {
            this.mapper = mapper;
            this.policy = policy;
            this.decoyPolicy = decoyPolicy;
            this.random = random;
            this.algorithm = algorithm;
        }

        private Object encodeValue(Object value, ClaimPath path) {
            if (value instanceof Map<?, ?> map) {
                return encodeObject(map, path);
            }
            if (value instanceof List<?> list) {
                return encodeArray(list, path);
            }
            return value;
        }

        private Map<String, Object> encodeObject(Map<?, ?> object, ClaimPath path) {
            Map<String, Object> out = new LinkedHashMap<>();
            List<String> digests = new ArrayList<>();
            for (Map.Entry<?, ?> entry : object.entrySet()) {
                String name = String.valueOf(entry.getKey());
                if (Disclosure.SD_CLAIM.equals(name) || Disclosure.ARRAY_ELEMENT_KEY.equals(name)) {
                    throw new PolicyException("Claims must not use the reserved name " + name + " (at " + path + ")");
                }
                if (path.isRoot() && REGISTERED_CLAIMS.contains(name)) {
                    out.put(name, entry.getValue());
                    continue;
                }
                ClaimPath childPath = path.child(name);
                Object encoded = encodeValue(entry.getValue(), childPath);
                if (policy.isSelectivelyDisclosable(childPath)) {
                    digests.add(disclose(name, encoded).digest(algorithm));
                } else {
                    out.put(name, encoded);
                }
            }
            int decoyCount = decoyPolicy.objectDecoys(path, digests.size(), random);
            for (int i = 0; i < decoyCount; i++) {
                digests.add(decoy());
            }
            if (!digests.isEmpty()) {
                // sorted so the digest order reveals nothing about the claim order
                Collections.sort(digests);
                out.put(Disclosure.SD_CLAIM, digests);
            }
            return out;
        }

        private List<Object> encodeArray(List<?> array, ClaimPath path) {
            List<Object> out = new ArrayList<>(array.size());
            int real = 0;
            for (int i = 0; i < array.size(); i++) {
                ClaimPath childPath = path.index(i);
                Object encoded = encodeValue(array.get(i), childPath);
                if (policy.isSelectivelyDisclosable(childPath)) {
                    out.add(disclose(null, encoded).toArrayElement(algorithm));
                    real++;
                } else {
                    out.add(encoded);
                }
            }
            int decoyCount = decoyPolicy.arrayDecoys(path, real, random);
            for (int i = 0; i < decoyCount; i++) {
                out.add(random.nextInt(out.size() + 1), placeholder(decoy()));
            }
            return out;
        }

        private Disclosure disclose(String name, Object value) {
            Disclosure disclosure = Disclosure.create(random.newSalt(), name, value, mapper);
            disclosures.add(disclosure);
            return disclosure;
        }

        /**
         * Digest of a fresh salt. Drawn from the configured random source so seeded runs repeat their decoys.
         */
        private String decoy() {
            String digest = algorithm.digest(random.newSalt());
            decoys.add(digest);
            return digest;
        }

        private static Map<String, Object> placeholder(String digest) {
            return Map.of(Disclosure.ARRAY_ELEMENT_KEY, digest);
        }
    }
}
