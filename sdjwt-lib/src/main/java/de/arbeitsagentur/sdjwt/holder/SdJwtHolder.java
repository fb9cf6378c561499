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

import com.nimbusds.jwt.SignedJWT;
import de.arbeitsagentur.sdjwt.common.ClaimPath;
import de.arbeitsagentur.sdjwt.common.ClaimReconstructor;
import de.arbeitsagentur.sdjwt.common.DigestIndex;
import de.arbeitsagentur.sdjwt.common.DisclosedClaim;
import de.arbeitsagentur.sdjwt.common.Disclosure;
import de.arbeitsagentur.sdjwt.common.HashAlgorithm;
import de.arbeitsagentur.sdjwt.common.JwsSupport;
import de.arbeitsagentur.sdjwt.common.SdJwtParts;
import de.arbeitsagentur.sdjwt.common.error.HolderBindingException;
import de.arbeitsagentur.sdjwt.common.error.MissingBindingKeyException;
import de.arbeitsagentur.sdjwt.common.error.SdJwtEncodingException;
import de.arbeitsagentur.sdjwt.common.error.UnknownClaimSelectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;

import java.security.PublicKey;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holder side of SD-JWT: parses issued credentials, keeps only the disclosures the holder agrees to reveal
 * and, for key-bound credentials, appends a key binding JWT.
 */
public class SdJwtHolder {
    private static final Logger LOG = LoggerFactory.getLogger(SdJwtHolder.class);

    private final ObjectMapper objectMapper;
    private final HolderConfig config;

    public SdJwtHolder(ObjectMapper objectMapper, HolderConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    /**
     * Parses a combined issuance without checking the issuer signature.
     *
     * @throws SdJwtEncodingException if the artifact is malformed or already carries a key binding JWT
     * @throws de.arbeitsagentur.sdjwt.common.error.UnresolvedDigestException if a disclosure does not belong
     *                                                                         to the credential
     */
    public SdJwtCredential parse(String combinedIssuance) {
        SdJwtParts parts = SdJwtParts.split(combinedIssuance);
        if (parts.keyBindingJwt() != null) {
            throw new SdJwtEncodingException("Issued SD-JWT must not carry a key binding JWT");
        }
        SignedJWT jwt = JwsSupport.parse(parts.signedJwt());
        Map<String, Object> payload = JwsSupport.payload(jwt, objectMapper);
        HashAlgorithm algorithm = HashAlgorithm.fromPayload(payload);
        List<Disclosure> disclosures = parts.disclosures().stream()
                .map(encoded -> Disclosure.parse(encoded, objectMapper))
                .toList();
        DigestIndex index = DigestIndex.build(disclosures, algorithm);
        ClaimReconstructor.Reconstruction reconstruction = ClaimReconstructor.reconstruct(payload, index);

        Map<Disclosure, ClaimPath> paths = new HashMap<>();
        for (DisclosedClaim claim : reconstruction.disclosed()) {
            paths.put(claim.disclosure(), claim.path());
        }
        List<DisclosedClaim> ordered = disclosures.stream()
                .map(disclosure -> new DisclosedClaim(paths.get(disclosure), disclosure))
                .toList();
        return new SdJwtCredential(parts, payload, reconstruction.claims(), ordered, algorithm);
    }

    /**
     * Presents every disclosure.
     */
    public SdJwtPresentation presentAll(String combinedIssuance, KeyBindingRequest keyBinding) {
        SdJwtCredential credential = parse(combinedIssuance);
        return buildPresentation(credential, credential.disclosures(), keyBinding);
    }

    public SdJwtPresentation present(String combinedIssuance, Collection<ClaimPath> selection) {
        return present(combinedIssuance, selection, null);
    }

    public SdJwtPresentation present(String combinedIssuance,
                                     Collection<ClaimPath> selection,
                                     KeyBindingRequest keyBinding) {
        return present(parse(combinedIssuance), selection, keyBinding);
    }

    /**
     * Builds a presentation revealing the selected claims.
     * <p>
     * Selecting a path reveals the disclosures on the way to it and every disclosure below it.
     *
     * @param keyBinding key binding inputs, required if the credential is bound to a holder key
     * @throws UnknownClaimSelectedException if a path is not part of the credential, or matches no disclosure,
     *                                       and the config says FAIL
     * @throws MissingBindingKeyException    if the credential is key-bound and no key binding input is given
     * @throws HolderBindingException        if the key does not match the credential
     */
    public SdJwtPresentation present(SdJwtCredential credential,
                                     Collection<ClaimPath> selection,
                                     KeyBindingRequest keyBinding) {
        return buildPresentation(credential, select(credential, selection), keyBinding);
    }

    private List<DisclosedClaim> select(SdJwtCredential credential, Collection<ClaimPath> selection) {
        Set<Disclosure> chosen = new LinkedHashSet<>();
        if (selection != null) {
            for (ClaimPath path : selection) {
                if (!path.existsIn(credential.claims())) {
                    unmatched(path, "not part of the credential");
                    continue;
                }
                int matches = 0;
                for (DisclosedClaim claim : credential.disclosures()) {
                    if (claim.path().isPrefixOf(path) || path.isPrefixOf(claim.path())) {
                        chosen.add(claim.disclosure());
                        matches++;
                    }
                }
                if (matches == 0) {
                    unmatched(path, "always visible, no disclosure to reveal");
                }
            }
        }
        return credential.disclosures().stream()
                .filter(claim -> chosen.contains(claim.disclosure()))
                .toList();
    }

    private void unmatched(ClaimPath path, String reason) {
        if (config.unmatchedSelection() == HolderConfig.UnmatchedSelection.FAIL) {
            throw new UnknownClaimSelectedException("Selected claim " + path + " is " + reason);
        }
        LOG.warn("Ignoring selected claim {}: {}", path, reason);
    }

    private SdJwtPresentation buildPresentation(SdJwtCredential credential,
                                                List<DisclosedClaim> selected,
                                                KeyBindingRequest keyBinding) {
        List<Disclosure> disclosures = selected.stream().map(DisclosedClaim::disclosure).toList();
        SdJwtParts presented = new SdJwtParts(credential.parts().signedJwt(),
                disclosures.stream().map(Disclosure::getEncoded).toList(),
                null);
        if (keyBinding == null) {
            if (credential.isHolderBound()) {
                throw new MissingBindingKeyException("Credential is bound to a holder key; key binding input required");
            }
            LOG.debug("Presenting {} of {} disclosures without key binding",
                    disclosures.size(), credential.disclosures().size());
            return new SdJwtPresentation(presented.serialize(), disclosures, null, null);
        }

        checkHolderKey(credential, keyBinding);
        KeyBindingJwtBuilder builder = KeyBindingJwtBuilder.withKey(keyBinding.holderKey())
                .nonce(keyBinding.nonce())
                .audience(keyBinding.audience())
                .issuedAt(config.clock().instant())
                .sdHash(presented.sdHash(credential.algorithm()));
        Map<String, Object> keyBindingPayload = builder.claims();
        String keyBindingJwt = builder.build(objectMapper);
        LOG.debug("Presenting {} of {} disclosures with key binding for aud={}",
                disclosures.size(), credential.disclosures().size(), keyBinding.audience());
        return new SdJwtPresentation(presented.withKeyBinding(keyBindingJwt).serialize(),
                disclosures,
                keyBindingJwt,
                keyBindingPayload);
    }

    private void checkHolderKey(SdJwtCredential credential, KeyBindingRequest keyBinding) {
        if (keyBinding.holderKey() == null || !keyBinding.holderKey().isPrivate()) {
            throw new MissingBindingKeyException("Key binding requires the holder's private key");
        }
        if (!credential.isHolderBound()) {
            throw new HolderBindingException("Credential is not bound to a holder key");
        }
        PublicKey bound = JwsSupport.toPublicKey(credential.holderJwk());
        PublicKey supplied = JwsSupport.toPublicKey(keyBinding.holderKey().toPublicJWK());
        if (bound == null || supplied == null || !Arrays.equals(bound.getEncoded(), supplied.getEncoded())) {
            throw new HolderBindingException("Holder key does not match the key the credential is bound to");
        }
    }
}
