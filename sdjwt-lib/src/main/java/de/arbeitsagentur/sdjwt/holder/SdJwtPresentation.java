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

import de.arbeitsagentur.sdjwt.common.Disclosure;

import java.util.List;
import java.util.Map;

/**
 * A presentation ready to be sent to a verifier.
 *
 * @param combined          {@code <jwt>~<selected disclosures>~[<kb-jwt>]}
 * @param disclosures       the selected disclosures, in issuance order
 * @param keyBindingJwt     the key binding JWT, or null for an unbound presentation
 * @param keyBindingPayload the key binding JWT's claims, or null
 */
public record SdJwtPresentation(String combined,
                                List<Disclosure> disclosures,
                                String keyBindingJwt,
                                Map<String, Object> keyBindingPayload) {
}
