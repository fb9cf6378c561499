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

import java.time.Clock;

/**
 * Holder settings.
 *
 * @param unmatchedSelection what to do with a selected path the credential does not contain
 * @param clock              time source for the key binding JWT's {@code iat}
 */
public record HolderConfig(UnmatchedSelection unmatchedSelection, Clock clock) {

    public HolderConfig {
        if (unmatchedSelection == null) {
            throw new IllegalArgumentException("unmatchedSelection must be chosen explicitly");
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
    }

    /** Unmatched selections fail the presentation. */
    public static HolderConfig strict() {
        return new HolderConfig(UnmatchedSelection.FAIL, Clock.systemUTC());
    }

    /** Unmatched selections are logged and skipped. */
    public static HolderConfig lenient() {
        return new HolderConfig(UnmatchedSelection.IGNORE, Clock.systemUTC());
    }

    public HolderConfig withClock(Clock clock) {
        return new HolderConfig(unmatchedSelection, clock);
    }

    public enum UnmatchedSelection {
        /** Throw {@link de.arbeitsagentur.sdjwt.common.error.UnknownClaimSelectedException}. */
        FAIL,
        /** Log a warning and continue with the remaining selections. */
        IGNORE
    }
}
