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

/**
 * Optional sink for collecting verification steps during SD-JWT verification.
 */
public interface VerificationStepSink {
    VerificationStepSink NONE = new VerificationStepSink() {
    };

    default void add(String title) {
        add(title, title, null);
    }

    default void add(String title, String description, String specLink) {
        // no-op by default
    }
}
