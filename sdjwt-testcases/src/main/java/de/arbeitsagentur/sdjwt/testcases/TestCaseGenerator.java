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

import de.arbeitsagentur.sdjwt.common.ClaimPath;
import de.arbeitsagentur.sdjwt.common.JwsSupport;
import de.arbeitsagentur.sdjwt.common.RandomSource;
import de.arbeitsagentur.sdjwt.common.error.SdJwtException;
import de.arbeitsagentur.sdjwt.holder.HolderConfig;
import de.arbeitsagentur.sdjwt.holder.KeyBindingRequest;
import de.arbeitsagentur.sdjwt.holder.SdJwtCredential;
import de.arbeitsagentur.sdjwt.holder.SdJwtHolder;
import de.arbeitsagentur.sdjwt.holder.SdJwtPresentation;
import de.arbeitsagentur.sdjwt.issuer.DecoyPolicy;
import de.arbeitsagentur.sdjwt.issuer.DisclosurePolicy;
import de.arbeitsagentur.sdjwt.issuer.IssuerConfig;
import de.arbeitsagentur.sdjwt.issuer.SdJwtIssuance;
import de.arbeitsagentur.sdjwt.issuer.SdJwtIssuer;
import de.arbeitsagentur.sdjwt.verifier.IssuerKeyResolver;
import de.arbeitsagentur.sdjwt.verifier.SdJwtVerifier;
import de.arbeitsagentur.sdjwt.verifier.VerifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Regenerates the static SD-JWT test vectors.
 * <p>
 * Usage: {@code TestCaseGenerator <testcase|example> [directory ...]}, run in a directory containing
 * {@code settings.yml}. Every named directory (or every subdirectory with a {@code specification.yml}) is
 * run through issuer, holder and verifier, and the intermediate artifacts are written next to the
 * specification.
 */
public class TestCaseGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(TestCaseGenerator.class);
    public static final String SETTINGS_FILE = "settings.yml";
    public static final String SPECIFICATION_FILE = "specification.yml";

    private final GeneratorSettings settings;
    private final DemoKeys keys;
    private final ObjectMapper objectMapper;

    public TestCaseGenerator(GeneratorSettings settings, ObjectMapper objectMapper) {
        this.settings = settings.validate();
        this.keys = DemoKeys.from(settings.keySettings(), settings.seed());
        this.objectMapper = objectMapper;
    }

    public static void main(String[] args) {
        System.exit(run(Path.of("").toAbsolutePath(), args));
    }

    /**
     * @return the process exit code
     */
    public static int run(Path baseDir, String[] args) {
        if (args.length == 0) {
            LOG.error("Usage: TestCaseGenerator <testcase|example> [directory ...]");
            return 2;
        }
        OutputType type;
        try {
            type = OutputType.fromArgument(args[0]);
        } catch (IllegalArgumentException e) {
            LOG.error("{}; expected 'testcase' or 'example'", e.getMessage());
            return 2;
        }
        Path settingsFile = baseDir.resolve(SETTINGS_FILE);
        if (!Files.isRegularFile(settingsFile)) {
            LOG.error("Settings file '{}' does not exist.", settingsFile);
            return 1;
        }
        YAMLMapper yamlMapper = new YAMLMapper();
        try {
            GeneratorSettings settings = yamlMapper.readValue(settingsFile.toFile(), GeneratorSettings.class);
            TestCaseGenerator generator = new TestCaseGenerator(settings, new ObjectMapper());
            for (Path specification : specifications(baseDir, Arrays.asList(args).subList(1, args.length))) {
                Path outputDir = specification.getParent();
                if (!Files.isDirectory(outputDir)) {
                    LOG.error("Output directory '{}' does not exist.", outputDir);
                    return 1;
                }
                LOG.info("Generating data for '{}'", specification);
                TestCaseSpecification testCase = yamlMapper.readValue(specification.toFile(),
                        TestCaseSpecification.class);
                generator.write(generator.generate(testCase, type), outputDir);
            }
            return 0;
        } catch (IOException | JacksonException | IllegalArgumentException | IllegalStateException | SdJwtException e) {
            LOG.error("Test case generation failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private static List<Path> specifications(Path baseDir, List<String> directories) throws IOException {
        if (!directories.isEmpty()) {
            return directories.stream().map(dir -> baseDir.resolve(dir).resolve(SPECIFICATION_FILE)).toList();
        }
        try (Stream<Path> children = Files.list(baseDir)) {
            return children
                    .map(dir -> dir.resolve(SPECIFICATION_FILE))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        }
    }

    /**
     * Runs one test case through issuer, holder and verifier.
     *
     * @return file name to rendered content, in writing order
     */
    public Map<String, String> generate(TestCaseSpecification testCase, OutputType type) {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(settings.iat()), ZoneOffset.UTC);
        boolean holderBinding = testCase.isHolderBinding();
        String audience = settings.identifiers().verifier();
        String nonce = settings.holderBindingNonce();

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", settings.identifiers().issuer());
        claims.put("iat", settings.iat());
        claims.put("exp", settings.exp());
        claims.putAll(testCase.userClaims());

        List<ClaimPath> sdClaims = testCase.sdClaimPaths();
        IssuerConfig issuerConfig = IssuerConfig.builder()
                .disclosurePolicy(sdClaims.isEmpty() ? DisclosurePolicy.topLevel() : DisclosurePolicy.paths(sdClaims))
                .decoyPolicy(testCase.isAddDecoyClaims() ? DecoyPolicy.randomRange() : DecoyPolicy.none())
                .randomSource(RandomSource.seeded(settings.seed()))
                .clock(clock)
                .build();
        SdJwtIssuance issuance = new SdJwtIssuer(objectMapper, keys.issuerKey(), issuerConfig)
                .issue(claims, holderBinding ? keys.holderKey() : null);

        SdJwtHolder holder = new SdJwtHolder(objectMapper, HolderConfig.strict().withClock(clock));
        SdJwtCredential credential = holder.parse(issuance.combined());
        SdJwtPresentation presentation = holder.present(credential,
                testCase.holderDisclosedClaimPaths(),
                holderBinding ? new KeyBindingRequest(nonce, audience, keys.holderKey()) : null);

        String issuer = String.valueOf(issuance.payload().get("iss"));
        IssuerKeyResolver resolver = IssuerKeyResolver.fromKeys(
                Map.of(issuer, JwsSupport.toPublicKey(keys.issuerKey().toPublicJWK())));
        SdJwtVerifier verifier = new SdJwtVerifier(objectMapper, resolver,
                VerifierConfig.builder().clock(clock).build());
        Map<String, Object> verified = verifier.verify(presentation.combined(),
                holderBinding ? audience : null,
                holderBinding ? nonce : null);

        List<Artifact> artifacts = new ArrayList<>();
        artifacts.add(new Artifact("user_claims", testCase.userClaims(), "json"));
        artifacts.add(new Artifact("sd_jwt_payload", issuance.payload(), "json"));
        artifacts.add(new Artifact("sd_jwt_serialized", issuance.signedJwt(), "txt"));
        artifacts.add(new Artifact("combined_issuance", issuance.combined(), "txt"));
        if (holderBinding) {
            artifacts.add(new Artifact("hb_jwt_payload", presentation.keyBindingPayload(), "json"));
            artifacts.add(new Artifact("hb_jwt_serialized", presentation.keyBindingJwt(), "txt"));
        }
        artifacts.add(new Artifact("combined_presentation", presentation.combined(), "txt"));
        artifacts.add(new Artifact("verified_contents", verified, "json"));
        if (type == OutputType.EXAMPLE) {
            artifacts.add(new Artifact("disclosures",
                    MarkdownReport.disclosures(credential.disclosures(), credential.algorithm(), objectMapper),
                    "md"));
        }
        if (testCase.isAddDecoyClaims()) {
            artifacts.add(type == OutputType.EXAMPLE
                    ? new Artifact("decoy_digests", MarkdownReport.decoyDigests(issuance.decoyDigests()), "md")
                    : new Artifact("decoy_digests", issuance.decoyDigests(), "json"));
        }

        Map<String, String> files = new LinkedHashMap<>();
        for (Artifact artifact : artifacts) {
            files.put(artifact.fileName(), type.format(artifact.data(), artifact.fileType(), objectMapper));
        }
        return files;
    }

    public void write(Map<String, String> files, Path outputDir) throws IOException {
        LOG.info("Writing test case data to '{}'.", outputDir);
        for (Map.Entry<String, String> file : files.entrySet()) {
            Files.writeString(outputDir.resolve(file.getKey()), file.getValue(), StandardCharsets.UTF_8);
        }
    }

    private record Artifact(String name, Object data, String fileType) {
        String fileName() {
            return name + "." + fileType;
        }
    }
}
