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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Location of a claim inside a claim tree, e.g. {@code address.street_address},
 * {@code nationalities[1]} or {@code nationalities[*]}.
 * <p>
 * Array indices address the reconstructed array, so decoy placeholders never take up an index.
 * The wildcard {@code [*]} matches every index.
 */
public final class ClaimPath {
    /** JSONPath root prefix */
    private static final String JSONPATH_ROOT = "$";
    private static final ClaimPath ROOT = new ClaimPath(List.of());

    private final List<Segment> segments;

    private ClaimPath(List<Segment> segments) {
        this.segments = segments;
    }

    public static ClaimPath root() {
        return ROOT;
    }

    /**
     * Shorthand for a path made of property names only.
     */
    public static ClaimPath of(String... names) {
        ClaimPath path = ROOT;
        for (String name : names) {
            path = path.child(name);
        }
        return path;
    }

    /**
     * Parses the dotted form. A leading {@code $.} is ignored.
     *
     * @throws IllegalArgumentException on malformed input
     */
    public static ClaimPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Claim path must not be empty");
        }
        String normalized = path.trim();
        if (normalized.startsWith(JSONPATH_ROOT)) {
            normalized = normalized.substring(JSONPATH_ROOT.length());
            if (normalized.startsWith(".")) {
                normalized = normalized.substring(1);
            }
        }
        List<Segment> parsed = new ArrayList<>();
        int i = 0;
        while (i < normalized.length()) {
            char c = normalized.charAt(i);
            if (c == '[') {
                int close = normalized.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '[' in claim path: " + path);
                }
                String inner = normalized.substring(i + 1, close).trim();
                if ("*".equals(inner)) {
                    parsed.add(Segment.wildcard());
                } else {
                    try {
                        parsed.add(Segment.ofIndex(Integer.parseInt(inner)));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid array index in claim path: " + path, e);
                    }
                }
                i = close + 1;
            } else if (c == '.') {
                i++;
            } else {
                int end = i;
                while (end < normalized.length() && normalized.charAt(end) != '.' && normalized.charAt(end) != '[') {
                    end++;
                }
                parsed.add(Segment.ofName(normalized.substring(i, end)));
                i = end;
            }
        }
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("Claim path must not be empty");
        }
        return new ClaimPath(Collections.unmodifiableList(parsed));
    }

    public ClaimPath child(String name) {
        return append(Segment.ofName(name));
    }

    public ClaimPath index(int index) {
        return append(Segment.ofIndex(index));
    }

    public ClaimPath anyIndex() {
        return append(Segment.wildcard());
    }

    private ClaimPath append(Segment segment) {
        List<Segment> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new ClaimPath(Collections.unmodifiableList(next));
    }

    public List<Segment> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public Segment last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    /**
     * Same length and every segment matches, with wildcards on either side matching any index.
     */
    public boolean matches(ClaimPath other) {
        return other != null && segments.size() == other.segments.size() && isPrefixOf(other);
    }

    /**
     * True if this path equals, or is an ancestor of, {@code other} (wildcards honoured).
     */
    public boolean isPrefixOf(ClaimPath other) {
        if (other == null || segments.size() > other.segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            if (!segments.get(i).matches(other.segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * True if the path addresses an existing node of {@code tree}. A wildcard matches if the array exists.
     */
    public boolean existsIn(Object tree) {
        return exists(tree, 0);
    }

    private boolean exists(Object node, int position) {
        if (position == segments.size()) {
            return true;
        }
        Segment segment = segments.get(position);
        if (segment.isName()) {
            return node instanceof Map<?, ?> map
                    && map.containsKey(segment.name())
                    && exists(map.get(segment.name()), position + 1);
        }
        if (!(node instanceof List<?> list)) {
            return false;
        }
        if (segment.isAnyIndex()) {
            return position + 1 == segments.size()
                    || list.stream().anyMatch(item -> exists(item, position + 1));
        }
        return segment.index() < list.size() && exists(list.get(segment.index()), position + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ClaimPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return JSONPATH_ROOT;
        }
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.isName()) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(segment.name());
            } else {
                sb.append('[').append(segment.isAnyIndex() ? "*" : String.valueOf(segment.index())).append(']');
            }
        }
        return sb.toString();
    }

    /**
     * A property name, an array index, or the array wildcard.
     */
    public record Segment(String name, int index) {
        private static final int ANY = -1;

        static Segment ofName(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Claim name must not be empty");
            }
            return new Segment(name, ANY);
        }

        static Segment ofIndex(int index) {
            if (index < 0) {
                throw new IllegalArgumentException("Array index must not be negative: " + index);
            }
            return new Segment(null, index);
        }

        static Segment wildcard() {
            return new Segment(null, ANY);
        }

        public boolean isName() {
            return name != null;
        }

        public boolean isAnyIndex() {
            return name == null && index == ANY;
        }

        boolean matches(Segment other) {
            if (isName() || other.isName()) {
                return Objects.equals(name, other.name);
            }
            return isAnyIndex() || other.isAnyIndex() || index == other.index;
        }
    }
}
