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
import de.arbeitsagentur.sdjwt.common.error.PolicyException;

import java.util.List;
import java.util.Map;

/**
 * Policy listing the selectively disclosable claims explicitly. Every listed path must exist in the claims.
 */
public final class ClaimPathPolicy implements DisclosurePolicy {
    private final List<ClaimPath> paths;

    public ClaimPathPolicy(List<ClaimPath> paths) {
        this.paths = List.copyOf(paths);
    }

    public List<ClaimPath> paths() {
        return paths;
    }

    @Override
    public boolean isSelectivelyDisclosable(ClaimPath path) {
        for (ClaimPath candidate : paths) {
            if (candidate.matches(path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void validate(Map<String, Object> claims) {
        for (ClaimPath path : paths) {
            if (path.isRoot()) {
                throw new PolicyException("The claim set itself cannot be selectively disclosable");
            }
            ClaimPath.Segment first = path.segments().get(0);
            if (first.isName() && SdJwtIssuer.REGISTERED_CLAIMS.contains(first.name())) {
                throw new PolicyException("Registered claim cannot be selectively disclosable: " + path);
            }
            if (!path.existsIn(claims)) {
                throw new PolicyException("Claim path does not exist in the claims: " + path);
            }
        }
    }
}
