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

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

/**
 * Verifier settings.
 *
 * @param holderBindingRequired reject presentations without a key binding JWT
 * @param clockSkew             tolerance for {@code exp}, {@code nbf} and {@code iat}, defaults to 60 seconds
 * @param keyBindingMaxAge      maximum age of the key binding JWT's {@code iat}, defaults to 5 minutes
 * @param acceptedTypes         accepted {@code typ} header values of the issuer-signed JWT
 * @param clock                 time source for all temporal checks
 */
public record VerifierConfig(
        boolean holderBindingRequired,
        Duration clockSkew,
        Duration keyBindingMaxAge,
        Set<String> acceptedTypes,
        Clock clock
) {
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(60);
    /** Default maximum age for KB-JWT iat claim to prevent replay attacks (5 minutes) */
    public static final Duration DEFAULT_KB_JWT_MAX_AGE = Duration.ofMinutes(5);
    public static final Set<String> DEFAULT_ACCEPTED_TYPES = Set.of("dc+sd-jwt", "vc+sd-jwt", "example+sd-jwt", "JWT");

    public VerifierConfig {
        acceptedTypes = acceptedTypes == null ? null : Set.copyOf(acceptedTypes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static VerifierConfig defaults() {
        return builder().build();
    }

    public Duration clockSkew() {
        return clockSkew != null ? clockSkew : DEFAULT_CLOCK_SKEW;
    }

    public Duration keyBindingMaxAge() {
        return keyBindingMaxAge != null ? keyBindingMaxAge : DEFAULT_KB_JWT_MAX_AGE;
    }

    public Set<String> acceptedTypes() {
        return acceptedTypes != null && !acceptedTypes.isEmpty() ? acceptedTypes : DEFAULT_ACCEPTED_TYPES;
    }

    public Clock clock() {
        return clock != null ? clock : Clock.systemUTC();
    }

    public static final class Builder {
        private boolean holderBindingRequired;
        private Duration clockSkew = DEFAULT_CLOCK_SKEW;
        private Duration keyBindingMaxAge = DEFAULT_KB_JWT_MAX_AGE;
        private Set<String> acceptedTypes = DEFAULT_ACCEPTED_TYPES;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder holderBindingRequired(boolean holderBindingRequired) {
            this.holderBindingRequired = holderBindingRequired;
            return this;
        }

        public Builder clockSkew(Duration clockSkew) {
            this.clockSkew = clockSkew;
            return this;
        }

        public Builder keyBindingMaxAge(Duration keyBindingMaxAge) {
            this.keyBindingMaxAge = keyBindingMaxAge;
            return this;
        }

        public Builder acceptedTypes(Set<String> acceptedTypes) {
            this.acceptedTypes = acceptedTypes;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public VerifierConfig build() {
            return new VerifierConfig(holderBindingRequired, clockSkew, keyBindingMaxAge, acceptedTypes, clock);
        }
    }
}
