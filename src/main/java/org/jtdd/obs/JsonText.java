package org.jtdd.obs;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Compact JSON encoder for maps, collections, strings, numbers and booleans.
 *
 * <p>Map entries are written in iteration order. Non-finite doubles and any other value
 * type are written as strings.
 */
public final class JsonText {
    private JsonText() {
    }

    public static String encode(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value);
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
            return;
        }
        if (value instanceof String s) {
            appendString(sb, s);
            return;
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            appendString(sb, d.toString());
            return;
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            appendString(sb, f.toString());
            return;
        }
        if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
            return;
        }
        if (value instanceof Map<?, ?> map) {
            appendObject(sb, map);
            return;
        }
        if (value instanceof Collection<?> collection) {
            appendArray(sb, collection);
            return;
        }
        appendString(sb, String.valueOf(value));
    }

    private static void appendObject(StringBuilder sb, Map<?, ?> map) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            appendString(sb, String.valueOf(entry.getKey()));
            sb.append(':');
            appendValue(sb, entry.getValue());
        }
        sb.append('}');
    }

    private static void appendArray(StringBuilder sb, Collection<?> values) {
        sb.append('[');
        boolean first = true;
        for (Object value : values) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            appendValue(sb, value);
        }
        sb.append(']');
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c <= 0x1F) {
                        sb.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
