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

import tools.jackson.databind.ObjectMapper;

import java.util.Locale;

/**
 * How artifacts are rendered: plain files for other libraries' test suites, or wrapped text and Markdown for
 * inclusion in documentation.
 */
public enum OutputType {
    TESTCASE,
    EXAMPLE;

    /** Line width of example output */
    public static final int EXAMPLE_WIDTH = 70;

    public static OutputType fromArgument(String argument) {
        return switch (argument == null ? "" : argument.toLowerCase(Locale.ROOT)) {
            case "testcase" -> TESTCASE;
            case "example" -> EXAMPLE;
            default -> throw new IllegalArgumentException("Unknown output type: " + argument);
        };
    }

    /**
     * Renders an artifact.
     *
     * @param fileType {@code json}, {@code txt} or {@code md}
     */
    public String format(Object data, String fileType, ObjectMapper objectMapper) {
        String text = "json".equals(fileType)
                ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data)
                : String.valueOf(data);
        if (this == TESTCASE || "md".equals(fileType)) {
            return text;
        }
        return wrap(text, EXAMPLE_WIDTH);
    }

    /**
     * Breaks every line longer than {@code width} into chunks of at most {@code width} characters.
     */
    static String wrap(String text, int width) {
        StringBuilder out = new StringBuilder(text.length() + text.length() / width + 1);
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int start = 0;
            while (line.length() - start > width) {
                out.append(line, start, start + width).append('\n');
                start += width;
            }
            out.append(line, start, line.length());
            if (i < lines.length - 1) {
                out.append('\n');
            }
        }
        return out.toString();
    }
}
