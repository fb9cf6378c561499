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

import de.arbeitsagentur.sdjwt.common.ClaimPath;
import de.arbeitsagentur.sdjwt.common.RandomSource;

/**
 * Decides how many decoy digests the issuer mixes into each {@code _sd} list and each array.
 * Decoys are only added to containers that already hold at least one real digest.
 */
public interface DecoyPolicy {
    /** Bounds used by the reference tooling when decoys are switched on */
    int DEFAULT_MIN_DECOYS = 2;
    int DEFAULT_MAX_DECOYS = 5;

    /**
     * @param path        location of the object in the input claims
     * @param realDigests number of real digests in the object's {@code _sd} list
     */
    int objectDecoys(ClaimPath path, int realDigests, RandomSource random);

    /**
     * @param path        location of the array in the input claims
     * @param realDigests number of selectively disclosable elements in the array
     */
    int arrayDecoys(ClaimPath path, int realDigests, RandomSource random);

    static DecoyPolicy none() {
        return new Fixed(0, 0);
    }

    static DecoyPolicy fixed(int perObject, int perArray) {
        return new Fixed(perObject, perArray);
    }

    static DecoyPolicy randomRange(int min, int max) {
        return new RandomRange(min, max);
    }

    static DecoyPolicy randomRange() {
        return new RandomRange(DEFAULT_MIN_DECOYS, DEFAULT_MAX_DECOYS);
    }

    record Fixed(int perObject, int perArray) implements DecoyPolicy {
        public Fixed {
            if (perObject < 0 || perArray < 0) {
                throw new IllegalArgumentException("Decoy counts must not be negative");
            }
        }

        @Override
        public int objectDecoys(ClaimPath path, int realDigests, RandomSource random) {
            return realDigests > 0 ? perObject : 0;
        }

        @Override
        public int arrayDecoys(ClaimPath path, int realDigests, RandomSource random) {
            return realDigests > 0 ? perArray : 0;
        }
    }

    record RandomRange(int min, int max) implements DecoyPolicy {
        public RandomRange {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("Invalid decoy range [" + min + ", " + max + "]");
            }
        }

        @Override
        public int objectDecoys(ClaimPath path, int realDigests, RandomSource random) {
            return realDigests > 0 ? draw(random) : 0;
        }

        @Override
        public int arrayDecoys(ClaimPath path, int realDigests, RandomSource random) {
            return realDigests > 0 ? draw(random) : 0;
        }

        private int draw(RandomSource random) {
            return min + random.nextInt(max - min + 1);
        }
    }
}
