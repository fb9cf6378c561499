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

import de.arbeitsagentur.sdjwt.common.DisclosedClaim;
import de.arbeitsagentur.sdjwt.common.HashAlgorithm;
import de.arbeitsagentur.sdjwt.common.SdJwtParts;

import java.util.List;
import java.util.Map;

/**
 * An issued SD-JWT as the holder sees it: the signed payload, the complete claim tree and every disclosure
 * with the location of the claim it reveals. The issuer signature is not checked here.
 *
 * @param parts       the split issuance
 * @param payload     the signed payload, still containing digests
 * @param claims      all claims, with every disclosure applied
 * @param disclosures the disclosures in issuance order
 * @param algorithm   the payload's {@code _sd_alg}
 */
public record SdJwtCredential(SdJwtParts parts,
                              Map<String, Object> payload,
                              Map<String, Object> claims,
                              List<DisclosedClaim> disclosures,
                              HashAlgorithm algorithm) {

    /**
     * @return the {@code cnf.jwk} object, or null if the credential is not bound to a holder key
     */
    public Object holderJwk() {
        if (payload.get("cnf") instanceof Map<?, ?> cnf) {
            return cnf.get("jwk");
        }
        return null;
    }

    public boolean isHolderBound() {
        return payload.containsKey("cnf");
    }
}
