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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Decides which claims of an input claim set the issuer replaces by digests.
 * <p>
 * Paths are evaluated against the input tree. Registered claims ({@code iss}, {@code iat}, {@code exp},
 * {@code nbf}, {@code cnf}) at the top level always stay in the clear, whatever the policy answers.
 */
public interface DisclosurePolicy {

    boolean isSelectivelyDisclosable(ClaimPath path);

    /**
     * Checks the policy against the claims before anything is issued.
     *
     * @throws de.arbeitsagentur.sdjwt.common.error.PolicyException if the policy cannot be applied
     */
    default void validate(Map<String, Object> claims) {
    }

    /** Nothing is selectively disclosable. */
    static DisclosurePolicy none() {
        return path -> false;
    }

    /** Every top-level claim, nested structures stay inside the disclosed value. */
    static DisclosurePolicy topLevel() {
        return path -> path.depth() == 1;
    }

    /** Every object property and array element at every depth. */
    static DisclosurePolicy recursive() {
        return path -> true;
    }

    static DisclosurePolicy paths(ClaimPath... paths) {
        return new ClaimPathPolicy(Arrays.asList(paths));
    }

    static DisclosurePolicy paths(Collection<ClaimPath> paths) {
        return new ClaimPathPolicy(List.copyOf(paths));
    }
}
