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

import java.util.regex.Pattern;

/**
 * Lexical checks for the segments of a combined SD-JWT artifact.
 */
public final class TokenFormatUtils {
    /** SD-JWT disclosure separator */
    public static final char SDJWT_SEPARATOR = '~';
    /** JWT segment separator */
    public static final char JWT_SEPARATOR = '.';
    /** Pattern for base64url encoded strings (allows padding) */
    private static final Pattern BASE64URL_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+=*$");

    private TokenFormatUtils() {
    }

    /**
     * Checks if the value appears to be base64url encoded.
     * Excludes values that look like JWTs or SD-JWTs (containing '.' or '~').
     *
     * @param value the value to check
     * @return true if the value matches base64url pattern and is not a JWT
     */
    public static boolean isBase64Url(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        if (value.indexOf(JWT_SEPARATOR) >= 0 || value.indexOf(SDJWT_SEPARATOR) >= 0) {
            return false;
        }
        return BASE64URL_PATTERN.matcher(value).matches();
    }

    /**
     * Checks if the token appears to be an SD-JWT (contains '~' separator).
     */
    public static boolean isSdJwt(String token) {
        return token != null && token.indexOf(SDJWT_SEPARATOR) >= 0;
    }

    /**
     * Checks if the token appears to be a compact JWS (three dot-separated parts, no '~').
     */
    public static boolean isJwt(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        if (token.indexOf(SDJWT_SEPARATOR) >= 0) {
            return false;
        }
        return countChar(token, JWT_SEPARATOR) == 2;
    }

    private static int countChar(String str, char c) {
        int count = 0;
        for (int i = 0; i < str.length(); i++) {
            if (str.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
