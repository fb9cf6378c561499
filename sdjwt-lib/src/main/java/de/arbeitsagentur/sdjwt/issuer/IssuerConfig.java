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

import com.nimbusds.jose.JWSAlgorithm;
import de.arbeitsagentur.sdjwt.common.HashAlgorithm;
import de.arbeitsagentur.sdjwt.common.RandomSource;

import java.time.Clock;
import java.time.Duration;

/**
 * Issuer settings. Unset values fall back to the defaults noted on each accessor.
 *
 * @param digestAlgorithm    {@code _sd_alg}, defaults to sha-256
 * @param signatureAlgorithm JWS algorithm, null derives it from the signing key
 * @param type               {@code typ} header, defaults to {@value #DEFAULT_TYPE}
 * @param issuer             {@code iss} used when the claims carry none
 * @param credentialTtl      lifetime added as {@code exp}, null adds no {@code exp}
 * @param includeIssuedAt    add {@code iat} unless the claims carry one
 * @param disclosurePolicy   which claims become selectively disclosable, defaults to top-level claims
 * @param decoyPolicy        how many decoy digests to add, defaults to none
 * @param randomSource       salts and decoy positions, defaults to {@link RandomSource#secure()}
 * @param clock              time source for {@code iat} and {@code exp}
 */
public record IssuerConfig(
        HashAlgorithm digestAlgorithm,
        JWSAlgorithm signatureAlgorithm,
        String type,
        String issuer,
        Duration credentialTtl,
        boolean includeIssuedAt,
        DisclosurePolicy disclosurePolicy,
        DecoyPolicy decoyPolicy,
        RandomSource randomSource,
        Clock clock
) {
    public static final String DEFAULT_TYPE = "dc+sd-jwt";

    public static Builder builder() {
        return new Builder();
    }

    public static IssuerConfig defaults() {
        return builder().build();
    }

    public HashAlgorithm digestAlgorithm() {
        return digestAlgorithm != null ? digestAlgorithm : HashAlgorithm.DEFAULT;
    }

    public String type() {
        return type != null && !type.isBlank() ? type : DEFAULT_TYPE;
    }

    public DisclosurePolicy disclosurePolicy() {
        return disclosurePolicy != null ? disclosurePolicy : DisclosurePolicy.topLevel();
    }

    public DecoyPolicy decoyPolicy() {
        return decoyPolicy != null ? decoyPolicy : DecoyPolicy.none();
    }

    public RandomSource randomSource() {
        return randomSource != null ? randomSource : DefaultRandom.INSTANCE;
    }

    public Clock clock() {
        return clock != null ? clock : Clock.systemUTC();
    }

    public static final class Builder {
        private HashAlgorithm digestAlgorithm = HashAlgorithm.DEFAULT;
        private JWSAlgorithm signatureAlgorithm;
        private String type = DEFAULT_TYPE;
        private String issuer;
        private Duration credentialTtl;
        private boolean includeIssuedAt = true;
        private DisclosurePolicy disclosurePolicy = DisclosurePolicy.topLevel();
        private DecoyPolicy decoyPolicy = DecoyPolicy.none();
        private RandomSource randomSource;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder digestAlgorithm(HashAlgorithm digestAlgorithm) {
            this.digestAlgorithm = digestAlgorithm;
            return this;
        }

        public Builder signatureAlgorithm(JWSAlgorithm signatureAlgorithm) {
            this.signatureAlgorithm = signatureAlgorithm;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder credentialTtl(Duration credentialTtl) {
            this.credentialTtl = credentialTtl;
            return this;
        }

        public Builder includeIssuedAt(boolean includeIssuedAt) {
            this.includeIssuedAt = includeIssuedAt;
            return this;
        }

        public Builder disclosurePolicy(DisclosurePolicy disclosurePolicy) {
            this.disclosurePolicy = disclosurePolicy;
            return this;
        }

        public Builder decoyPolicy(DecoyPolicy decoyPolicy) {
            this.decoyPolicy = decoyPolicy;
            return this;
        }

        public Builder randomSource(RandomSource randomSource) {
            this.randomSource = randomSource;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public IssuerConfig build() {
            return new IssuerConfig(digestAlgorithm, signatureAlgorithm, type, issuer, credentialTtl,
                    includeIssuedAt, disclosurePolicy, decoyPolicy, randomSource, clock);
        }
    }

    private static final class DefaultRandom {
        private static final RandomSource INSTANCE = RandomSource.secure();
    }
}
