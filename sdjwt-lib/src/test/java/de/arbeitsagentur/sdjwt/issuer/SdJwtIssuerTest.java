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

import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jwt.SignedJWT;
import de.arbeitsagentur.sdjwt.common.ClaimPath;
import de.arbeitsagentur.sdjwt.common.Disclosure;
import de.arbeitsagentur.sdjwt.common.HashAlgorithm;
import de.arbeitsagentur.sdjwt.common.JwsSupport;
import de.arbeitsagentur.sdjwt.common.RandomSource;
import de.arbeitsagentur.sdjwt.common.error.PolicyException;
import de.arbeitsagentur.sdjwt.common.error.SigningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SdJwtIssuerTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ECKey issuerKey;

    @BeforeEach
    void setUp() throws Exception {
        issuerKey = new ECKeyGenerator(Curve.P_256)
                .keyUse(KeyUse.SIGNATURE)
                .keyID("issuer-key")
                .generate();
    }

    private SdJwtIssuer issuer(IssuerConfig.Builder config) {
        return new SdJwtIssuer(objectMapper, issuerKey, config.clock(Clock.fixed(NOW, ZoneOffset.UTC)).build());
    }

    private Map<String, Object> payloadOf(SdJwtIssuance issuance) {
        return JwsSupport.payload(JwsSupport.parse(issuance.signedJwt()), objectMapper);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> personClaims() {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", "https://issuer.example");
        claims.put("sub", "u1");
        claims.put("given_name", "Alice");
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("locality", "Berlin");
        address.put("country", "DE");
        claims.put("address", address);
        claims.put("nationalities", List.of("DE", "FR"));
        return claims;
    }

    @Test
    void topLevelPolicyReplacesUserClaimsWithSortedDigests() throws Exception {
        SdJwtIssuance issuance = issuer(IssuerConfig.builder()).issue(personClaims());

        Map<String, Object> payload = payloadOf(issuance);
        assertThat(payload).containsEntry("iss", "https://issuer.example")
                .containsEntry("_sd_alg", "sha-256")
                .doesNotContainKeys("sub", "given_name", "address", "nationalities", "cnf", "exp");
        assertThat(((Number) payload.get("iat")).longValue()).isEqualTo(NOW.getEpochSecond());

        @SuppressWarnings("unchecked")
        List<String> digests = (List<String>) payload.get("_sd");
        assertThat(digests).hasSize(4).isSorted();
        assertThat(issuance.disclosures()).extracting(Disclosure::getClaimName)
                .containsExactly("sub", "given_name", "address", "nationalities");
        assertThat(issuance.disclosures()).extracting(d -> d.digest(HashAlgorithm.SHA_256))
                .containsExactlyInAnyOrderElementsOf(digests);
        assertThat(issuance.decoyDigests()).isEmpty();
        assertThat(issuance.payload()).containsOnlyKeys(payload.keySet());
    }

    @Test
    void signsWithTypeAndKeyIdAndCombinesDisclosures() throws Exception {
        SdJwtIssuance issuance = issuer(IssuerConfig.builder()).issue(personClaims());

        SignedJWT jwt = SignedJWT.parse(issuance.signedJwt());
        assertThat(jwt.getHeader().getType().toString()).isEqualTo("dc+sd-jwt");
        assertThat(jwt.getHeader().getKeyID()).isEqualTo("issuer-key");
        assertThat(jwt.getHeader().getAlgorithm().getName()).isEqualTo("ES256");
        assertThat(JwsSupport.verifyWithKey(jwt, issuerKey.toECPublicKey())).isTrue();
        assertThat(issuance.combined())
                .isEqualTo(issuance.signedJwt() + "~" + String.join("~", issuance.encodedDisclosures()) + "~");
    }

    @Test
    void pathPolicyDisclosesNestedClaimsOnly() {
        SdJwtIssuance issuance = issuer(IssuerConfig.builder()
                .disclosurePolicy(DisclosurePolicy.paths(ClaimPath.parse("address.locality"),
                        ClaimPath.parse("nationalities[1]"))))
                .issue(personClaims());

        Map<String, Object> payload = payloadOf(issuance);
        assertThat(payload).containsEntry("sub", "u1").containsEntry("given_name", "Alice").doesNotContainKey("_sd");
        @SuppressWarnings("unchecked")
        Map<String, Object> address = (Map<String, Object>) payload.get("address");
        assertThat(address).containsEntry("country", "DE").doesNotContainKey("locality").containsKey("_sd");
        @SuppressWarnings("unchecked")
        List<Object> nationalities = (List<Object>) payload.get("nationalities");
        assertThat(nationalities).hasSize(2);
        assertThat(nationalities.get(0)).isEqualTo("DE");
        assertThat(nationalities.get(1)).isInstanceOf(Map.class);
        assertThat(map(nationalities.get(1))).containsOnlyKeys("...");
        assertThat(issuance.disclosures()).hasSize(2);
        assertThat(issuance.disclosures().get(1).isArrayElement()).isTrue();
    }

    @Test
    void recursivePolicyDisclosesInnerClaimsBeforeOuter() {
        SdJwtIssuance issuance = issuer(IssuerConfig.builder().disclosurePolicy(DisclosurePolicy.recursive()))
                .issue(personClaims());

        List<Disclosure> disclosures = issuance.disclosures();
        List<String> names = new ArrayList<>();
        for (Disclosure disclosure : disclosures) {
            names.add(disclosure.isArrayElement() ? "[" + disclosure.getClaimValue() + "]" : disclosure.getClaimName());
        }
        assertThat(names).containsExactly("sub", "given_name", "locality", "country", "address",
                "[DE]", "[FR]", "nationalities");
        @SuppressWarnings("unchecked")
        Map<String, Object> addressValue = (Map<String, Object>) disclosures.get(4).getClaimValue();
        assertThat(addressValue).containsOnlyKeys("_sd");
    }

    @Test
    void addsDecoysOnlyWhereRealDigestsExist() {
        SdJwtIssuance issuance = issuer(IssuerConfig.builder()
                .disclosurePolicy(DisclosurePolicy.paths(ClaimPath.of("given_name"),
                        ClaimPath.parse("nationalities[0]")))
                .decoyPolicy(DecoyPolicy.fixed(3, 2)))
                .issue(personClaims());

        Map<String, Object> payload = payloadOf(issuance);
        assertThat((List<?>) payload.get("_sd")).hasSize(4);
        assertThat((List<?>) payload.get("nationalities")).hasSize(4);
        assertThat(map(payload.get("address"))).doesNotContainKey("_sd");
        assertThat(issuance.decoyDigests()).hasSize(5);
        assertThat(issuance.disclosures()).hasSize(2);
    }

    @Test
    void randomDecoyRangeStaysWithinBounds() {
        SdJwtIssuance issuance = issuer(IssuerConfig.builder().decoyPolicy(DecoyPolicy.randomRange()))
                .issue(personClaims());

        assertThat(issuance.decoyDigests()).hasSizeBetween(DecoyPolicy.DEFAULT_MIN_DECOYS, DecoyPolicy.DEFAULT_MAX_DECOYS);
        assertThat((List<?>) payloadOf(issuance).get("_sd")).hasSize(4 + issuance.decoyDigests().size());
    }

    @Test
    void bindsHolderPublicKey() throws Exception {
        ECKey holderKey = new ECKeyGenerator(Curve.P_256).keyID("holder").generate();

        SdJwtIssuance issuance = issuer(IssuerConfig.builder()).issue(personClaims(), holderKey);

        @SuppressWarnings("unchecked")
        Map<String, Object> cnf = (Map<String, Object>) payloadOf(issuance).get("cnf");
        @SuppressWarnings("unchecked")
        Map<String, Object> jwk = (Map<String, Object>) cnf.get("jwk");
        assertThat(jwk).containsEntry("x", holderKey.getX().toString())
                .containsEntry("crv", "P-256")
                .doesNotContainKey("d");
    }

    @Test
    void addsConfiguredIssuerAndExpiry() {
        Map<String, Object> claims = new LinkedHashMap<>(personClaims());
        claims.remove("iss");

        SdJwtIssuance issuance = issuer(IssuerConfig.builder()
                .issuer("https://configured.example")
                .credentialTtl(Duration.ofDays(1)))
                .issue(claims);

        Map<String, Object> payload = payloadOf(issuance);
        assertThat(payload).containsEntry("iss", "https://configured.example");
        assertThat(((Number) payload.get("exp")).longValue()).isEqualTo(NOW.plus(Duration.ofDays(1)).getEpochSecond());
    }

    @Test
    void keepsIssuedAtFromClaims() {
        Map<String, Object> claims = new LinkedHashMap<>(personClaims());
        claims.put("iat", 1_600_000_000L);

        Map<String, Object> payload = payloadOf(issuer(IssuerConfig.builder()).issue(claims));

        assertThat(((Number) payload.get("iat")).longValue()).isEqualTo(1_600_000_000L);
    }

    @Test
    void usesConfiguredDigestAlgorithm() {
        SdJwtIssuance issuance = issuer(IssuerConfig.builder().digestAlgorithm(HashAlgorithm.SHA_384))
                .issue(personClaims());

        Map<String, Object> payload = payloadOf(issuance);
        @SuppressWarnings("unchecked")
        List<Object> digests = (List<Object>) payload.get("_sd");
        assertThat(payload).containsEntry("_sd_alg", "sha-384");
        assertThat(digests).contains(issuance.disclosures().get(0).digest(HashAlgorithm.SHA_384));
    }

    @Test
    void seededRandomnessIsReproducible() {
        IssuerConfig.Builder first = IssuerConfig.builder().randomSource(RandomSource.seeded(42));
        IssuerConfig.Builder second = IssuerConfig.builder().randomSource(RandomSource.seeded(42));

        assertThat(issuer(first).issue(personClaims()).encodedDisclosures())
                .isEqualTo(issuer(second).issue(personClaims()).encodedDisclosures());
    }

    @Test
    void rejectsUnusablePolicies() {
        assertThatThrownBy(() -> issuer(IssuerConfig.builder()
                .disclosurePolicy(DisclosurePolicy.paths(ClaimPath.of("iss"))))
                .issue(personClaims()))
                .isInstanceOf(PolicyException.class);
        assertThatThrownBy(() -> issuer(IssuerConfig.builder()
                .disclosurePolicy(DisclosurePolicy.paths(ClaimPath.of("birthdate"))))
                .issue(personClaims()))
                .isInstanceOf(PolicyException.class);
    }

    @Test
    void rejectsReservedClaimNames() {
        SdJwtIssuer issuer = issuer(IssuerConfig.builder());

        assertThatThrownBy(() -> issuer.issue(Map.of("iss", "i", "_sd", List.of())))
                .isInstanceOf(PolicyException.class);
        assertThatThrownBy(() -> issuer.issue(Map.of("iss", "i", "_sd_alg", "sha-256")))
                .isInstanceOf(PolicyException.class);
        assertThatThrownBy(() -> issuer.issue(Map.of("iss", "i", "nested", Map.of("...", "x"))))
                .isInstanceOf(PolicyException.class);
    }

    @Test
    void rejectsMissingIssuer() {
        assertThatThrownBy(() -> issuer(IssuerConfig.builder()).issue(Map.of("sub", "u1")))
                .isInstanceOf(PolicyException.class);
    }

    @Test
    void rejectsKeysThatCannotSign() {
        IssuerConfig config = IssuerConfig.builder().build();

        assertThatThrownBy(() -> new SdJwtIssuer(objectMapper, null, config).issue(personClaims()))
                .isInstanceOf(SigningException.class);
        assertThatThrownBy(() -> new SdJwtIssuer(objectMapper, issuerKey.toPublicJWK(), config).issue(personClaims()))
                .isInstanceOf(SigningException.class);
    }
}
