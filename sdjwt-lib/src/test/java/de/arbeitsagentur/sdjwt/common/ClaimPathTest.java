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
package de.arbeitsagentur.sdjwt.common;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClaimPathTest {

    @Test
    void parsesDottedAndIndexedPaths() {
        ClaimPath path = ClaimPath.parse("$.address.countries[1]");

        assertThat(path.depth()).isEqualTo(3);
        assertThat(path).isEqualTo(ClaimPath.of("address", "countries").index(1));
        assertThat(path.toString()).isEqualTo("address.countries[1]");
        assertThat(path.last().index()).isEqualTo(1);
    }

    @Test
    void parsesWildcards() {
        ClaimPath path = ClaimPath.parse("nationalities[*]");

        assertThat(path.last().isAnyIndex()).isTrue();
        assertThat(path.toString()).isEqualTo("nationalities[*]");
        assertThat(path.matches(ClaimPath.of("nationalities").index(4))).isTrue();
        assertThat(ClaimPath.of("nationalities").index(4).matches(path)).isTrue();
        assertThat(path.matches(ClaimPath.of("nationalities"))).isFalse();
    }

    @Test
    void prefixRelation() {
        ClaimPath address = ClaimPath.of("address");
        ClaimPath street = ClaimPath.of("address", "street_address");

        assertThat(address.isPrefixOf(street)).isTrue();
        assertThat(address.isPrefixOf(address)).isTrue();
        assertThat(street.isPrefixOf(address)).isFalse();
        assertThat(ClaimPath.root().isPrefixOf(street)).isTrue();
        assertThat(ClaimPath.of("addresses").isPrefixOf(street)).isFalse();
    }

    @Test
    void existsInClaimTree() {
        Map<String, Object> claims = Map.of(
                "address", Map.of("locality", "Berlin"),
                "nationalities", List.of("DE", "FR"));

        assertThat(ClaimPath.parse("address.locality").existsIn(claims)).isTrue();
        assertThat(ClaimPath.parse("nationalities[1]").existsIn(claims)).isTrue();
        assertThat(ClaimPath.parse("nationalities[*]").existsIn(claims)).isTrue();
        assertThat(ClaimPath.parse("nationalities[2]").existsIn(claims)).isFalse();
        assertThat(ClaimPath.parse("address.postal_code").existsIn(claims)).isFalse();
        assertThat(ClaimPath.parse("address[0]").existsIn(claims)).isFalse();
        assertThat(ClaimPath.root().existsIn(claims)).isTrue();
    }

    @Test
    void rejectsMalformedPaths() {
        assertThatThrownBy(() -> ClaimPath.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClaimPath.parse("$")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClaimPath.parse("a[1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClaimPath.parse("a[x]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClaimPath.parse("a[-1]")).isInstanceOf(IllegalArgumentException.class);
    }
}
