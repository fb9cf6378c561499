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
package de.arbeitsagentur.sdjwt.common.error;

/**
 * Base type for every failure raised by the SD-JWT engines.
 * <p>
 * Each subclass names one failure kind so callers can tell them apart without
 * parsing messages. Messages never contain salts, keys or signatures.
 */
public class SdJwtException extends RuntimeException {

    public SdJwtException(String message) {
        super(message);
    }

    public SdJwtException(String message, Throwable cause) {
        super(message, cause);
    }
}
