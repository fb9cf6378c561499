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

import de.arbeitsagentur.sdjwt.common.error.SdJwtEncodingException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SdJwtPartsTest {

    private static final String JWT = "eyJhbGciOiJFUzI1NiJ9.eyJpc3MiOiJpc3N1ZXIxIn0.c2ln";
    private static final String KB_JWT = "eyJ0eXAiOiJrYitqd3QifQ.eyJub25jZSI6Im4ifQ.c2ln";

    @Test
    void splitsIssuanceWithoutKeyBinding() {
        SdJwtParts parts = SdJwtParts.split(JWT + "~WyJhIiwiYiJd~WyJjIiwiZCJd~");

        assertThat(parts.signedJwt()).isEqualTo(JWT);
        assertThat(parts.disclosures()).containsExactly("WyJhIiwiYiJd", "WyJjIiwiZCJd");
        assertThat(parts.keyBindingJwt()).isNull();
    }

    @Test
    void splitsPresentationWithKeyBinding() {
        SdJwtParts parts = SdJwtParts.split(JWT + "~WyJhIiwiYiJd~" + KB_JWT);

        assertThat(parts.disclosures()).containsExactly("WyJhIiwiYiJd");
        assertThat(parts.keyBindingJwt()).isEqualTo(KB_JWT);
        assertThat(parts.withoutKeyBinding()).isEqualTo(JWT + "~WyJhIiwiYiJd~");
        assertThat(parts.serialize()).isEqualTo(JWT + "~WyJhIiwiYiJd~" + KB_JWT);
    }

    @Test
    void splitsBareJwtWithSeparator() {
        SdJwtParts parts = SdJwtParts.split(JWT + "~");

        assertThat(parts.disclosures()).isEmpty();
        assertThat(parts.serialize()).isEqualTo(JWT + "~");
    }

    @Test
    void splitsTokenSerializedByAuthlete() {
        com.authlete.sd.Disclosure name = new com.authlete.sd.Disclosure("given_name", "Alice");
        com.authlete.sd.Disclosure element = new com.authlete.sd.Disclosure("DE");
        com.authlete.sd.SDJWT sdJwt = new com.authlete.sd.SDJWT(JWT, List.of(name, element), KB_JWT);

        SdJwtParts parts = SdJwtParts.split(sdJwt.toString());

        assertThat(parts.signedJwt()).isEqualTo(JWT);
        assertThat(parts.disclosures()).containsExactly(name.getDisclosure(), element.getDisclosure());
        assertThat(parts.keyBindingJwt()).isEqualTo(KB_JWT);
        assertThat(parts.sdHash(HashAlgorithm.SHA_256)).isEqualTo(sdJwt.getSDHash());
    }

    @Test
    void sdHashCoversEverythingButKeyBinding() {
        SdJwtParts parts = new SdJwtParts(JWT, List.of("WyJhIiwiYiJd"), KB_JWT);

        assertThat(parts.sdHash(HashAlgorithm.SHA_256))
                .isEqualTo(HashAlgorithm.SHA_256.digest(JWT + "~WyJhIiwiYiJd~"));
    }

    @Test
    void rejectsMalformedArtifacts() {
        assertThatThrownBy(() -> SdJwtParts.split("")).isInstanceOf(SdJwtEncodingException.class);
        assertThatThrownBy(() -> SdJwtParts.split(JWT)).isInstanceOf(SdJwtEncodingException.class);
        assertThatThrownBy(() -> SdJwtParts.split("abc~WyJhIiwiYiJd~")).isInstanceOf(SdJwtEncodingException.class);
        assertThatThrownBy(() -> SdJwtParts.split(JWT + "~WyJhIiwiYiJd~~")).isInstanceOf(SdJwtEncodingException.class);
        assertThatThrownBy(() -> SdJwtParts.split(JWT + "~WyJhIiwiYiJd")).isInstanceOf(SdJwtEncodingException.class);
    }
}
