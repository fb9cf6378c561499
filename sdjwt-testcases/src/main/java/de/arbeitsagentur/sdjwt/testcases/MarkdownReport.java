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

import de.arbeitsagentur.sdjwt.common.DisclosedClaim;
import de.arbeitsagentur.sdjwt.common.Disclosure;
import de.arbeitsagentur.sdjwt.common.HashAlgorithm;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Markdown tables describing disclosures and decoys, for example output.
 */
final class MarkdownReport {

    private MarkdownReport() {
    }

    static String disclosures(List<DisclosedClaim> disclosures, HashAlgorithm algorithm, ObjectMapper objectMapper) {
        String hashName = algorithm.identifier().toUpperCase(Locale.ROOT);
        StringBuilder table = new StringBuilder()
                .append("| Claim | ").append(hashName).append(" Hash | Contents |\n")
                .append("|---|---|---|\n");
        StringBuilder encoded = new StringBuilder();
        for (DisclosedClaim claim : disclosures) {
            Disclosure disclosure = claim.disclosure();
            String label = disclosure.isArrayElement()
                    ? "array entry `" + claim.path() + "`"
                    : "`" + claim.path() + "`";
            List<Object> contents = new ArrayList<>();
            contents.add(disclosure.getSalt());
            if (!disclosure.isArrayElement()) {
                contents.add(disclosure.getClaimName());
            }
            contents.add(disclosure.getClaimValue());
            table.append("| ").append(label)
                    .append(" | `").append(disclosure.digest(algorithm))
                    .append("` | `").append(escapeCell(objectMapper.writeValueAsString(contents)))
                    .append("` |\n");
            encoded.append("__Disclosure for ").append(label).append(":__\n\n```\n")
                    .append(OutputType.wrap(disclosure.getEncoded(), OutputType.EXAMPLE_WIDTH))
                    .append("\n```\n\n");
        }
        return table.append('\n').append(encoded).toString();
    }

    static String decoyDigests(List<String> decoyDigests) {
        StringBuilder table = new StringBuilder("| # | Decoy Digest |\n|---|---|\n");
        for (int i = 0; i < decoyDigests.size(); i++) {
            table.append("| ").append(i + 1).append(" | `").append(decoyDigests.get(i)).append("` |\n");
        }
        return table.toString();
    }

    private static String escapeCell(String value) {
        return value.replace("|", "\\|");
    }
}
