package com.challenges.mxql.output;

import com.challenges.mxql.payload.PayloadNode;
import org.eclipse.collections.api.tuple.Pair;

/**
 * Writes payload trees as JSON, or as query-language literals with single-quoted strings
 * and bare identifiers.
 */
public class OutputFormatter {
    public enum Style {
        JSON,
        QUERY_LITERAL
    }

    private final boolean prettyPrint;
    private final boolean sortKeys;
    private final Style style;

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false, Style.JSON);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys, Style style) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
        this.style = style;
    }

    /**
     * Compact query-literal formatter, as used for generated command payloads.
     */
    public static OutputFormatter queryLiteral() {
        return new OutputFormatter(false, false, Style.QUERY_LITERAL);
    }

    public String format(PayloadNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        if (prettyPrint) {
            formatPretty(node, 0, sb);
        } else {
            formatCompact(node, sb);
        }

        return sb.toString();
    }

    private void formatPretty(PayloadNode node, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);

        if (node instanceof PayloadNode.PayloadObject obj) {
            if (obj.fields().isEmpty()) {
                sb.append("{}");
                return;
            }

            sb.append("{\n");

            boolean first = true;
            for (var entry : entries(obj)) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("  ");
                appendString(entry.getOne(), sb);
                sb.append(": ");
                formatPretty(entry.getTwo(), indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("}");
        } else if (node instanceof PayloadNode.PayloadArray arr) {
            if (arr.elements().isEmpty()) {
                sb.append("[]");
                return;
            }

            sb.append("[\n");

            boolean first = true;
            for (PayloadNode element : arr.elements()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("  ");
                formatPretty(element, indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("]");
        } else {
            formatScalar(node, sb);
        }
    }

    private void formatCompact(PayloadNode node, StringBuilder sb) {
        if (node instanceof PayloadNode.PayloadObject obj) {
            if (obj.fields().isEmpty()) {
                sb.append("{}");
                return;
            }

            sb.append("{");

            boolean first = true;
            for (var entry : entries(obj)) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                appendString(entry.getOne(), sb);
                sb.append(":");
                formatCompact(entry.getTwo(), sb);
            }

            sb.append("}");
        } else if (node instanceof PayloadNode.PayloadArray arr) {
            if (arr.elements().isEmpty()) {
                sb.append("[]");
                return;
            }

            sb.append("[");

            boolean first = true;
            for (PayloadNode element : arr.elements()) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                formatCompact(element, sb);
            }

            sb.append("]");
        } else {
            formatScalar(node, sb);
        }
    }

    private void formatScalar(PayloadNode node, StringBuilder sb) {
        if (node instanceof PayloadNode.PayloadString s) {
            appendString(s.value(), sb);
        } else if (node instanceof PayloadNode.PayloadIdentifier id) {
            if (style == Style.QUERY_LITERAL) {
                sb.append(id.name());
            } else {
                appendString(id.name(), sb);
            }
        } else if (node instanceof PayloadNode.PayloadNumber n) {
            sb.append(n.toLiteral());
        } else if (node instanceof PayloadNode.PayloadBoolean b) {
            sb.append(b.value());
        } else {
            sb.append("null");
        }
    }

    private Iterable<Pair<String, PayloadNode>> entries(PayloadNode.PayloadObject obj) {
        return sortKeys
            ? obj.fields().keyValuesView().toSortedListBy(Pair::getOne)
            : obj.fields().keyValuesView().toList();
    }

    private void appendString(String s, StringBuilder sb) {
        char quote = style == Style.QUERY_LITERAL ? '\'' : '"';
        sb.append(quote).append(escapeString(s, quote)).append(quote);
    }

    private String escapeString(String s, char quote) {
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == quote || c == '\n' || c == '\r' || c == '\t') {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> {
                    if (c == quote) {
                        result.append('\\');
                    }
                    result.append(c);
                }
            }
        }
        return result.toString();
    }
}
