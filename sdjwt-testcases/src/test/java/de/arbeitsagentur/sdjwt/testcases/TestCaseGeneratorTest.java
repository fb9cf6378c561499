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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TestCaseGeneratorTest {

    private static final String SETTINGS = """
            identifiers:
              issuer: https://issuer.example.com
              verifier: https://verifier.example.org
            iat: 1683000000
            exp: 1883000000
            holder_binding_nonce: XZOUco1u_gEPknxS78sWWg
            random_seed: 42
            """;

    private static final String SELECTIVE_CASE = """
            user_claims:
              sub: user_42
              given_name: John
              family_name: Doe
              address:
                street_address: 123 Main St
                locality: Anytown
                country: US
            sd_claims:
              - given_name
              - family_name
              - address.locality
            holder_disclosed_claims:
              - given_name
              - address.locality
            """;

    private static final String BOUND_CASE = """
            user_claims:
              sub: user_42
              nationalities:
                - US
                - DE
            sd_claims:
              - nationalities[*]
            holder_disclosed_claims:
              - nationalities[1]
            holder_binding: true
            add_decoy_claims: true
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path baseDir;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(baseDir.resolve(TestCaseGenerator.SETTINGS_FILE), SETTINGS, StandardCharsets.UTF_8);
        writeCase("selective", SELECTIVE_CASE);
        writeCase("bound", BOUND_CASE);
    }

    private void writeCase(String name, String specification) throws IOException {
        Path dir = Files.createDirectory(baseDir.resolve(name));
        Files.writeString(dir.resolve(TestCaseGenerator.SPECIFICATION_FILE), specification, StandardCharsets.UTF_8);
    }

    private Map<String, Object> readJson(Path file) {
        return objectMapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {});
    }

    @Test
    void generatesArtifactsForEveryCase() {
        assertThat(TestCaseGenerator.run(baseDir, new String[]{"testcase"})).isZero();

        assertThat(baseDir.resolve("selective")).isDirectoryContaining("glob:**/combined_presentation.txt");
        assertThat(baseDir.resolve("selective/hb_jwt_payload.json")).doesNotExist();
        assertThat(baseDir.resolve("selective/decoy_digests.json")).doesNotExist();
        for (String file : List.of("user_claims.json", "sd_jwt_payload.json", "sd_jwt_serialized.txt",
                "combined_issuance.txt", "hb_jwt_payload.json", "hb_jwt_serialized.txt",
                "combined_presentation.txt", "verified_contents.json", "decoy_digests.json")) {
            assertThat(baseDir.resolve("bound").resolve(file)).isRegularFile();
        }
        assertThat(baseDir.resolve("bound/disclosures.md")).doesNotExist();
    }

    @Test
    void verifiedContentsHoldOnlyDisclosedClaims() {
        TestCaseGenerator.run(baseDir, new String[]{"testcase", "selective"});

        Map<String, Object> verified = readJson(baseDir.resolve("selective/verified_contents.json"));

        assertThat(verified).containsEntry("iss", "https://issuer.example.com")
                .containsEntry("sub", "user_42")
                .containsEntry("given_name", "John")
                .containsEntry("address", Map.of("street_address", "123 Main St", "locality", "Anytown",
                        "country", "US"))
                .doesNotContainKeys("family_name", "_sd", "_sd_alg");
        assertThat(((Number) verified.get("iat")).longValue()).isEqualTo(1683000000L);
        assertThat(((Number) verified.get("exp")).longValue()).isEqualTo(1883000000L);
        assertThat(baseDir.resolve("bound/verified_contents.json")).doesNotExist();
    }

    @Test
    void keyBindingArtifactsDescribeThePresentation() throws IOException {
        assertThat(TestCaseGenerator.run(baseDir, new String[]{"testcase", "bound"})).isZero();

        Map<String, Object> keyBinding = readJson(baseDir.resolve("bound/hb_jwt_payload.json"));
        String presentation = Files.readString(baseDir.resolve("bound/combined_presentation.txt"));
        String keyBindingJwt = Files.readString(baseDir.resolve("bound/hb_jwt_serialized.txt"));

        assertThat(keyBinding).containsEntry("nonce", "XZOUco1u_gEPknxS78sWWg")
                .containsEntry("aud", "https://verifier.example.org")
                .containsKey("sd_hash");
        assertThat(presentation).endsWith("~" + keyBindingJwt);
        assertThat(readJson(baseDir.resolve("bound/verified_contents.json")))
                .containsEntry("nationalities", List.of("DE"))
                .containsKey("cnf");
        assertThat(readJson(baseDir.resolve("bound/sd_jwt_payload.json"))).containsKey("cnf");
    }

    @Test
    void exampleOutputIsWrappedAndDocumented() throws IOException {
        assertThat(TestCaseGenerator.run(baseDir, new String[]{"example"})).isZero();

        assertThat(Files.readAllLines(baseDir.resolve("bound/combined_issuance.txt")))
                .hasSizeGreaterThan(1)
                .allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(OutputType.EXAMPLE_WIDTH));
        assertThat(Files.readString(baseDir.resolve("selective/disclosures.md")))
                .contains("| Claim | SHA-256 Hash | Contents |")
                .contains("`given_name`")
                .contains("`address.locality`");
        assertThat(Files.readString(baseDir.resolve("bound/decoy_digests.md"))).startsWith("| # | Decoy Digest |");
    }

    @Test
    void sameSeedGivesSameSaltsAndDigests() throws IOException {
        GeneratorSettings settings = new YAMLMapper().readValue(SETTINGS, GeneratorSettings.class);
        TestCaseSpecification testCase = new YAMLMapper().readValue(SELECTIVE_CASE, TestCaseSpecification.class);

        Map<String, String> first = new TestCaseGenerator(settings, objectMapper).generate(testCase,
                OutputType.TESTCASE);
        Map<String, String> second = new TestCaseGenerator(settings, objectMapper).generate(testCase,
                OutputType.TESTCASE);

        assertThat(first.get("sd_jwt_payload.json")).isEqualTo(second.get("sd_jwt_payload.json"));
        assertThat(first.get("verified_contents.json")).isEqualTo(second.get("verified_contents.json"));
        assertThat(first).containsOnlyKeys(second.keySet());
    }

    @Test
    void reportsUsageErrors() throws IOException {
        assertThat(TestCaseGenerator.run(baseDir, new String[]{})).isEqualTo(2);
        assertThat(TestCaseGenerator.run(baseDir, new String[]{"fixtures"})).isEqualTo(2);
        assertThat(TestCaseGenerator.run(baseDir, new String[]{"testcase", "missing"})).isEqualTo(1);

        Files.delete(baseDir.resolve(TestCaseGenerator.SETTINGS_FILE));
        assertThat(TestCaseGenerator.run(baseDir, new String[]{"testcase"})).isEqualTo(1);
    }

    @Test
    void rejectsIncompleteSettings() throws IOException {
        Files.writeString(baseDir.resolve(TestCaseGenerator.SETTINGS_FILE),
                SETTINGS.replace("holder_binding_nonce: XZOUco1u_gEPknxS78sWWg\n", ""), StandardCharsets.UTF_8);

        assertThat(TestCaseGenerator.run(baseDir, new String[]{"testcase"})).isEqualTo(1);
        assertThat(baseDir.resolve("selective/combined_issuance.txt")).doesNotExist();
    }
}
