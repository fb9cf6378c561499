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

import de.arbeitsagentur.sdjwt.common.Disclosure;

import java.util.List;
import java.util.Map;

/**
 * Everything the issuer produced for one credential.
 *
 * @param combined     {@code <jwt>~<d1>~...~<dn>~}, handed to the holder
 * @param signedJwt    the issuer-signed JWT alone
 * @param payload      the signed payload, with digests in place of disclosable claims
 * @param disclosures  disclosures in generation order
 * @param decoyDigests digests with no disclosure behind them
 */
public record SdJwtIssuance(String combined,
                            String signedJwt,
                            Map<String, Object> payload,
                            List<Disclosure> disclosures,
                            List<String> decoyDigests) {

    public List<String> encodedDisclosures() {
        return disclosures.stream().map(Disclosure::getEncoded).toList();
    }
}
