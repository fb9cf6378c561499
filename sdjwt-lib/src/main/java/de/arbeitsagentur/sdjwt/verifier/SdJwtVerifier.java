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

import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jwt.SignedJWT;
import de.arbeitsagentur.sdjwt.common.ClaimReconstructor;
import de.arbeitsagentur.sdjwt.common.DigestIndex;
import de.arbeitsagentur.sdjwt.common.Disclosure;
import de.arbeitsagentur.sdjwt.common.HashAlgorithm;
import de.arbeitsagentur.sdjwt.common.JwsSupport;
import de.arbeitsagentur.sdjwt.common.SdJwtParts;
import de.arbeitsagentur.sdjwt.common.error.ExpiredCredentialException;
import de.arbeitsagentur.sdjwt.common.error.HolderBindingException;
import de.arbeitsagentur.sdjwt.common.error.InvalidSignatureException;
import de.arbeitsagentur.sdjwt.common.error.MissingBindingException;
import de.arbeitsagentur.sdjwt.common.error.NotYetValidException;
import de.arbeitsagentur.sdjwt.common.error.SdJwtEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.PublicKey;
import java.util.List;
import java.util.Map;

/**
 * Verifies SD-JWT presentations including issuer signature, disclosures and optional holder binding.
 * Returns the disclosed claims only if every check passes.
 */
public class SdJwtVerifier {
    private static final Logger LOG = LoggerFactory.getLogger(SdJwtVerifier.class);
    private static final String SPEC_LINK = "https://datatracker.ietf.org/doc/draft-ietf-oauth-selective-disclosure-jwt/";
    private static final String KB_JWT_TYPE = "kb+jwt";

    private final ObjectMapper objectMapper;
    private final IssuerKeyResolver issuerKeyResolver;
    private final VerifierConfig config;

    public SdJwtVerifier(ObjectMapper objectMapper, IssuerKeyResolver issuerKeyResolver) {
        this(objectMapper, issuerKeyResolver, VerifierConfig.defaults());
    }

    public SdJwtVerifier(ObjectMapper objectMapper, IssuerKeyResolver issuerKeyResolver, VerifierConfig config) {
        this.objectMapper = objectMapper;
        this.issuerKeyResolver = issuerKeyResolver;
        this.config = config != null ? config : VerifierConfig.defaults();
    }

    public Map<String, Object> verify(String presentation, String expectedAudience, String expectedNonce) {
        return verify(presentation, expectedAudience, expectedNonce, VerificationStepSink.NONE);
    }

    /**
     * @param expectedAudience audience the key binding JWT must name, required when one is present.
     *                         A non-null value also demands a key binding JWT.
     * @param expectedNonce    nonce the key binding JWT must carry, required when one is present.
     *                         A non-null value also demands a key binding JWT.
     * @return the disclosed claims, without {@code _sd_alg}
     */
    public Map<String, Object> verify(String presentation,
                                      String expectedAudience,
                                      String expectedNonce,
                                      VerificationStepSink steps) {
        VerificationStepSink sink = steps != null ? steps : VerificationStepSink.NONE;
        LOG.debug("verify() called with: expectedAudience={}, expectedNonce={}", expectedAudience, expectedNonce);

        SdJwtParts parts = SdJwtParts.split(presentation);
        SignedJWT jwt = JwsSupport.parse(parts.signedJwt());
        validateSdJwtType(jwt);
        Map<String, Object> payload = JwsSupport.payload(jwt, objectMapper);
        List<Disclosure> disclosures = parts.disclosures().stream()
                .map(encoded -> Disclosure.parse(encoded, objectMapper))
                .toList();
        sink.add("Parsed SD-JWT presentation",
                "Split the presentation and decoded " + disclosures.size() + " disclosure(s).",
                SPEC_LINK);

        verifyIssuerSignature(jwt, payload);
        sink.add("Signature verified",
                "Checked the SD-JWT signature against the key of the issuer named in iss.",
                SPEC_LINK);

        validateTimestamps(payload);
        sink.add("Validity period checked");

        HashAlgorithm algorithm = HashAlgorithm.fromPayload(payload);
        DigestIndex index = DigestIndex.build(disclosures, algorithm);
        Map<String, Object> claims = ClaimReconstructor.reconstruct(payload, index).claims();
        sink.add("Disclosures validated",
                "Validated selective disclosure digests against presented disclosures.",
                SPEC_LINK);

        if (parts.keyBindingJwt() != null) {
            verifyHolderBinding(parts, payload, algorithm, expectedAudience, expectedNonce);
            sink.add("Validated holder binding",
                    "Validated KB-JWT holder binding: cnf key matches credential and signature verified.",
                    SPEC_LINK);
        } else if (config.holderBindingRequired()) {
            throw new MissingBindingException("Holder binding required but presentation carries no key binding JWT");
        } else if (expectedAudience != null || expectedNonce != null) {
            throw new MissingBindingException("Audience or nonce expected but presentation carries no key binding JWT");
        }
        LOG.debug("Verified SD-JWT with {} disclosure(s)", disclosures.size());
        return claims;
    }

    private void validateSdJwtType(SignedJWT jwt) {
        JOSEObjectType type = jwt.getHeader().getType();
        if (type == null || type.toString().isBlank()) {
            throw new SdJwtEncodingException("SD-JWT missing typ header");
        }
        if (!config.acceptedTypes().contains(type.toString())) {
            throw new SdJwtEncodingException("Invalid SD-JWT typ: " + type);
        }
    }

    private void verifyIssuerSignature(SignedJWT jwt, Map<String, Object> payload) {
        Object iss = payload.get("iss");
        if (!(iss instanceof String issuer) || issuer.isBlank()) {
            throw new InvalidSignatureException("SD-JWT does not name its issuer");
        }
        PublicKey key = issuerKeyResolver.resolve(issuer);
        if (key == null) {
            throw new InvalidSignatureException("No key available for issuer " + issuer);
        }
        if (!JwsSupport.verifyWithKey(jwt, key)) {
            LOG.debug("Signature verification failed for issuer {}", issuer);
            throw new InvalidSignatureException("Credential signature not trusted");
        }
    }

    private void validateTimestamps(Map<String, Object> payload) {
        long now = config.clock().instant().getEpochSecond();
        long skew = config.clockSkew().toSeconds();
        Long exp = epochSecondsClaim(payload, "exp");
        if (exp != null && exp < plusSeconds(now, -skew)) {
            throw new ExpiredCredentialException("Credential expired at " + exp);
        }
        Long nbf = epochSecondsClaim(payload, "nbf");
        if (nbf != null && nbf > plusSeconds(now, skew)) {
            throw new NotYetValidException("Credential not valid before " + nbf);
        }
        Long iat = epochSecondsClaim(payload, "iat");
        if (iat != null && iat > plusSeconds(now, skew)) {
            throw new NotYetValidException("Credential issued in the future: " + iat);
        }
    }

    private void verifyHolderBinding(SdJwtParts parts,
                                     Map<String, Object> payload,
                                     HashAlgorithm algorithm,
                                     String expectedAudience,
                                     String expectedNonce) {
        SignedJWT holderBinding;
        try {
            holderBinding = JwsSupport.parse(parts.keyBindingJwt());
        } catch (SdJwtEncodingException e) {
            throw new HolderBindingException("Key binding JWT is not a compact JWS", e);
        }
        validateKeyBindingType(holderBinding);

        Object cnf = payload.get("cnf");
        PublicKey holderKey = cnf instanceof Map<?, ?> map ? JwsSupport.toPublicKey(map.get("jwk")) : null;
        if (holderKey == null) {
            throw new HolderBindingException("SD-JWT does not contain a holder binding key (cnf)");
        }
        if (!JwsSupport.verifyWithKey(holderBinding, holderKey)) {
            throw new HolderBindingException("Holder binding signature invalid");
        }

        Map<String, Object> claims;
        try {
            claims = JwsSupport.payload(holderBinding, objectMapper);
        } catch (SdJwtEncodingException e) {
            throw new HolderBindingException("Key binding JWT payload is not a JSON object", e);
        }
        validateKeyBindingTimestamp(claims);
        validateKeyBindingAudienceAndNonce(claims, expectedAudience, expectedNonce);
        validateSdHash(claims, parts, algorithm);
    }

    private void validateKeyBindingType(SignedJWT jwt) {
        JOSEObjectType type = jwt.getHeader().getType();
        if (type == null || !KB_JWT_TYPE.equals(type.toString())) {
            throw new HolderBindingException("Invalid key binding JWT typ: " + type);
        }
    }

    private void validateKeyBindingTimestamp(Map<String, Object> claims) {
        if (!(claims.get("iat") instanceof Number iat)) {
            throw new HolderBindingException("Presentation missing iat");
        }
        long issuedAt = epochSeconds(iat);
        long now = config.clock().instant().getEpochSecond();
        if (issuedAt > plusSeconds(now, config.clockSkew().toSeconds())) {
            throw new HolderBindingException("Presentation iat is in the future");
        }
        if (issuedAt < plusSeconds(now, -config.keyBindingMaxAge().toSeconds())) {
            throw new HolderBindingException("Presentation too old (iat exceeds max age of "
                    + config.keyBindingMaxAge().toSeconds() + "s)");
        }
    }

    private void validateKeyBindingAudienceAndNonce(Map<String, Object> claims,
                                                    String expectedAudience,
                                                    String expectedNonce) {
        if (expectedAudience == null || expectedAudience.isBlank()) {
            throw new HolderBindingException("Expected audience missing");
        }
        Object aud = claims.get("aud");
        boolean audienceMatches = aud instanceof List<?> list
                ? list.contains(expectedAudience)
                : expectedAudience.equals(aud);
        if (!audienceMatches) {
            LOG.debug("Audience mismatch: expected='{}', actual='{}'", expectedAudience, aud);
            throw new HolderBindingException("Audience mismatch in presentation");
        }

        if (expectedNonce == null || expectedNonce.isBlank()) {
            throw new HolderBindingException("Expected nonce missing");
        }
        if (!(claims.get("nonce") instanceof String nonce) || nonce.isBlank()) {
            throw new HolderBindingException("Presentation missing nonce");
        }
        if (!expectedNonce.equals(nonce)) {
            throw new HolderBindingException("Nonce mismatch in presentation");
        }
    }

    private void validateSdHash(Map<String, Object> claims, SdJwtParts parts, HashAlgorithm algorithm) {
        if (!(claims.get("sd_hash") instanceof String sdHash) || sdHash.isBlank()) {
            throw new HolderBindingException("Presentation missing sd_hash");
        }
        if (!parts.sdHash(algorithm).equals(sdHash)) {
            throw new HolderBindingException("sd_hash mismatch in presentation");
        }
    }

    private static Long epochSecondsClaim(Map<String, Object> payload, String name) {
        Object value = payload.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new SdJwtEncodingException(name + " must be a numeric date");
        }
        return epochSeconds(number);
    }

    /**
     * Whole seconds of a NumericDate, saturated to the {@code long} range.
     */
    private static long epochSeconds(Number number) {
        if (number instanceof BigDecimal decimal) {
            return epochSeconds(decimal.toBigInteger());
        }
        if (number instanceof BigInteger integer) {
            if (integer.bitLength() < Long.SIZE) {
                return integer.longValue();
            }
            return integer.signum() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        // double and float narrowing already saturates
        return number.longValue();
    }

    private static long plusSeconds(long base, long seconds) {
        long sum = base + seconds;
        if (((base ^ sum) & (seconds ^ sum)) < 0) {
            return seconds > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return sum;
    }
}
