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

import de.arbeitsagentur.sdjwt.common.error.DuplicateDigestException;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigestIndexTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void indexesDisclosuresByDigestInInputOrder() {
        Disclosure first = Disclosure.create("c2FsdDE", "given_name", "Alice", mapper);
        Disclosure second = Disclosure.create("c2FsdDI", "family_name", "Doe", mapper);

        DigestIndex index = DigestIndex.build(List.of(first, second), HashAlgorithm.SHA_256);

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.algorithm()).isEqualTo(HashAlgorithm.SHA_256);
        assertThat(index.get(first.digest(HashAlgorithm.SHA_256))).isEqualTo(first);
        assertThat(index.contains(second.digest(HashAlgorithm.SHA_256))).isTrue();
        assertThat(index.contains("unknown")).isFalse();
        assertThat(index.get(null)).isNull();
        assertThat(index.digests()).containsExactly(
                first.digest(HashAlgorithm.SHA_256), second.digest(HashAlgorithm.SHA_256));
    }

    @Test
    void identicalDisclosuresCollide() {
        Disclosure disclosure = Disclosure.create("c2FsdA", "given_name", "Alice", mapper);
        Disclosure identical = Disclosure.create("c2FsdA", "given_name", "Alice", mapper);

        assertThatThrownBy(() -> DigestIndex.build(List.of(disclosure, identical), HashAlgorithm.SHA_256))
                .isInstanceOf(DuplicateDigestException.class)
                .hasMessageContaining("position 1");
    }

    @Test
    void tracksResolvedDigests() {
        Disclosure first = Disclosure.create("c2FsdDE", "given_name", "Alice", mapper);
        Disclosure second = Disclosure.create("c2FsdDI", "family_name", "Doe", mapper);
        DigestIndex index = DigestIndex.build(List.of(first, second), HashAlgorithm.SHA_384);

        assertThat(index.unresolved()).containsExactly(first, second);
        index.resolve(second.digest(HashAlgorithm.SHA_384));
        assertThat(index.unresolved()).containsExactly(first);
        assertThatThrownBy(() -> index.resolve(second.digest(HashAlgorithm.SHA_384)))
                .isInstanceOf(DuplicateDigestException.class);
    }

    @Test
    void refusesToResolveDigestsItNeverIndexed() {
        Disclosure indexed = Disclosure.create("c2FsdDE", "given_name", "Alice", mapper);
        Disclosure other = Disclosure.create("c2FsdDI", "family_name", "Doe", mapper);
        DigestIndex index = DigestIndex.build(List.of(indexed), HashAlgorithm.SHA_256);

        assertThatThrownBy(() -> index.resolve(other.digest(HashAlgorithm.SHA_256)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(index.unresolved()).containsExactly(indexed);
    }

    @Test
    void emptyInputGivesEmptyIndex() {
        DigestIndex index = DigestIndex.build(null, HashAlgorithm.DEFAULT);

        assertThat(index.size()).isZero();
        assertThat(index.unresolved()).isEmpty();
    }
}
