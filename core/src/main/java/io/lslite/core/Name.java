package io.lslite.core;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hierarchical name, e.g. {@code /edu/memphis/router-a}.
 *
 * Responsibilities:
 *  - Identify routers and neighbors (used as map keys everywhere).
 *  - Build and take apart hello probe / response names.
 *
 * URI form:
 *  - Components are separated by '/'.
 *  - Characters outside [A-Za-z0-9-._~=] are percent-encoded as UTF-8 bytes,
 *    so a whole Name can be carried as a single component of another Name
 *    (see {@link #append(Name)}).
 *
 * Immutable; negative indexes count from the end like the router's name helpers.
 */
public final class Name implements Comparable<Name> {

    private static final Name ROOT = new Name(List.of());

    private final List<String> components;

    private Name(List<String> components) {
        this.components = components;
    }

    public static Name root() {
        return ROOT;
    }

    /**
     * Parse a URI such as "/a/b/c". Empty components are ignored, so
     * "a/b", "/a/b" and "/a/b/" are the same name.
     */
    public static Name parse(String uri) {
        if (uri == null) {
            throw new IllegalArgumentException("uri must not be null");
        }
        List<String> out = new ArrayList<>();
        for (String raw : uri.split("/")) {
            if (raw.isEmpty()) {
                continue;
            }
            out.add(unescape(raw));
        }
        return out.isEmpty() ? ROOT : new Name(Collections.unmodifiableList(out));
    }

    public static Name of(String... components) {
        Name n = ROOT;
        for (String c : components) {
            n = n.append(c);
        }
        return n;
    }

    public Name append(String component) {
        if (component == null || component.isEmpty()) {
            throw new IllegalArgumentException("component must not be empty");
        }
        List<String> out = new ArrayList<>(components.size() + 1);
        out.addAll(components);
        out.add(component);
        return new Name(Collections.unmodifiableList(out));
    }

    /**
     * Append another name as one nested component (its URI form).
     * {@code Name.parse(n.get(-1))} recovers the nested name.
     */
    public Name append(Name nested) {
        return append(nested.toUri());
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    /** Component at index i; negative i counts from the end (-1 is the last one). */
    public String get(int i) {
        int idx = i < 0 ? components.size() + i : i;
        if (idx < 0 || idx >= components.size()) {
            throw new IndexOutOfBoundsException("component " + i + " of " + toUri());
        }
        return components.get(idx);
    }

    /**
     * First n components; negative n drops -n components from the end.
     */
    public Name getPrefix(int n) {
        int len = n < 0 ? components.size() + n : n;
        if (len < 0 || len > components.size()) {
            throw new IndexOutOfBoundsException("prefix " + n + " of " + toUri());
        }
        if (len == 0) {
            return ROOT;
        }
        return new Name(components.subList(0, len));
    }

    public boolean isPrefixOf(Name other) {
        if (other.components.size() < components.size()) {
            return false;
        }
        for (int i = 0; i < components.size(); i++) {
            if (!components.get(i).equals(other.components.get(i))) {
                return false;
            }
        }
        return true;
    }

    public String toUri() {
        if (components.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (String c : components) {
            sb.append('/').append(escape(c));
        }
        return sb.toString();
    }

    @Override
    public int compareTo(Name o) {
        int n = Math.min(components.size(), o.components.size());
        for (int i = 0; i < n; i++) {
            int c = components.get(i).compareTo(o.components.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(components.size(), o.components.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Name other)) return false;
        return components.equals(other.components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return toUri();
    }

    // ---------- escaping ----------

    private static boolean unreserved(int b) {
        return (b >= 'A' && b <= 'Z')
                || (b >= 'a' && b <= 'z')
                || (b >= '0' && b <= '9')
                || b == '-' || b == '.' || b == '_' || b == '~' || b == '=';
    }

    private static String escape(String component) {
        byte[] bytes = component.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte raw : bytes) {
            int b = raw & 0xFF;
            if (unreserved(b)) {
                sb.append((char) b);
            } else {
                sb.append('%');
                sb.append(Character.toUpperCase(Character.forDigit(b >> 4, 16)));
                sb.append(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
            }
        }
        return sb.toString();
    }

    private static String unescape(String raw) {
        if (raw.indexOf('%') < 0) {
            return raw;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '%') {
                if (i + 2 >= raw.length()) {
                    throw new IllegalArgumentException("truncated escape in component: " + raw);
                }
                int hi = Character.digit(raw.charAt(i + 1), 16);
                int lo = Character.digit(raw.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw new IllegalArgumentException("bad escape in component: " + raw);
                }
                out.write((hi << 4) | lo);
                i += 2;
            } else {
                // whole run up to the next escape, so surrogate pairs stay together
                int end = raw.indexOf('%', i);
                if (end < 0) {
                    end = raw.length();
                }
                byte[] b = raw.substring(i, end).getBytes(StandardCharsets.UTF_8);
                out.write(b, 0, b.length);
                i = end - 1;
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
