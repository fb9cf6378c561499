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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Random;

/**
 * Supplies salts and random positions to the issuer. Implementations must be safe for concurrent use.
 */
public interface RandomSource {
    /** Salt length in bytes (128 bits) */
    int SALT_BYTES = 16;

    /**
     * @return a fresh base64url salt of {@link #SALT_BYTES} random bytes
     */
    String newSalt();

    /**
     * @return a value in {@code [0, bound)}
     */
    int nextInt(int bound);

    static RandomSource secure() {
        return new Jdk(new SecureRandom());
    }

    /**
     * Reproducible randomness for generating fixtures. Never use it for real credentials.
     */
    static RandomSource seeded(long seed) {
        Jdk.LOG.warn("Using seeded randomness; salts and decoys are predictable");
        return new Jdk(new Random(seed));
    }

    /**
     * Backed by a JDK generator. {@link Random} and {@link SecureRandom} are both thread safe.
     */
    final class Jdk implements RandomSource {
        private static final Logger LOG = LoggerFactory.getLogger(RandomSource.class);

        private final Random random;

        Jdk(Random random) {
            this.random = random;
        }

        @Override
        public String newSalt() {
            byte[] bytes = new byte[SALT_BYTES];
            random.nextBytes(bytes);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        }

        @Override
        public int nextInt(int bound) {
            return random.nextInt(bound);
        }
    }
}
