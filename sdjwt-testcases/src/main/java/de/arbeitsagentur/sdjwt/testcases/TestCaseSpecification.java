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
package de.arbeitsagentur.sdjwt.testcases;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.arbeitsagentur.sdjwt.common.ClaimPath;

import java.util.List;
import java.util.Map;

/**
 * Contents of a test case's {@code specification.yml}.
 *
 * @param userClaims            claims of the credential subject
 * @param sdClaims              claim paths to make selectively disclosable, empty for all top-level claims
 * @param holderDisclosedClaims claim paths the holder reveals
 * @param holderBinding         bind the credential to the holder key and present with a key binding JWT
 * @param addDecoyClaims        add decoy digests
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestCaseSpecification(
        @JsonProperty("user_claims") Map<String, Object> userClaims,
        @JsonProperty("sd_claims") List<String> sdClaims,
        @JsonProperty("holder_disclosed_claims") List<String> holderDisclosedClaims,
        @JsonProperty("holder_binding") Boolean holderBinding,
        @JsonProperty("add_decoy_claims") Boolean addDecoyClaims
) {

    public Map<String, Object> userClaims() {
        return userClaims != null ? userClaims : Map.of();
    }

    public List<ClaimPath> sdClaimPaths() {
        return sdClaims == null ? List.of() : sdClaims.stream().map(ClaimPath::parse).toList();
    }

    public List<ClaimPath> holderDisclosedClaimPaths() {
        return holderDisclosedClaims == null
                ? List.of()
                : holderDisclosedClaims.stream().map(ClaimPath::parse).toList();
    }

    public boolean isHolderBinding() {
        return Boolean.TRUE.equals(holderBinding);
    }

    public boolean isAddDecoyClaims() {
        return Boolean.TRUE.equals(addDecoyClaims);
    }
}
