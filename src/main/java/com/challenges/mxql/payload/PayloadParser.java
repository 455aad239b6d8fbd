package com.challenges.mxql.payload;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.regex.Pattern;

/**
 * Reads command payloads written in the relaxed, JSON-like notation of the query language.
 * <p>
 * Compared to JSON, keys and scalar values may be bare words, strings may use single
 * quotes, and a separator may precede a closing delimiter. A payload is one value
 * followed only by whitespace.
 */
public class PayloadParser {
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");
    static final int MAX_DEPTH = 512;

    public ParsedPayload parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PayloadSyntaxException("Empty payload", 0);
        }
        Cursor cursor = new Cursor(text);
        cursor.skipWhitespace();
        PayloadNode value = parseValue(cursor);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw new PayloadSyntaxException("Unexpected '" + cursor.peek() + "' after value", cursor.pos);
        }
        return new ParsedPayload(value, cursor.trailingSeparators, cursor.unquotedKeys.toImmutable());
    }

    private PayloadNode parseValue(Cursor cursor) {
        if (cursor.atEnd()) {
            throw new PayloadSyntaxException("Unexpected end of payload", cursor.pos);
        }
        char c = cursor.peek();
        return switch (c) {
            case '{' -> parseObject(cursor);
            case '[' -> parseArray(cursor);
            case '"', '\'' -> new PayloadNode.PayloadString(parseQuoted(cursor));
            case '}', ']', ',', ':' -> throw new PayloadSyntaxException("Unexpected '" + c + "'", cursor.pos);
            default -> classifyWord(parseBareWord(cursor));
        };
    }

    private PayloadNode.PayloadObject parseObject(Cursor cursor) {
        int start = cursor.pos;
        cursor.enter();
        cursor.pos++; // '{'
        MutableMap<String, PayloadNode> fields = MapAdapter.adapt(new LinkedHashMap<>());

        cursor.skipWhitespace();
        if (cursor.consume('}')) {
            cursor.depth--;
            return new PayloadNode.PayloadObject(fields);
        }
        while (true) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                throw new PayloadSyntaxException("Unterminated object opened", start);
            }
            int keyPos = cursor.pos;
            String key;
            char c = cursor.peek();
            if (c == '"' || c == '\'') {
                key = parseQuoted(cursor);
            } else if (c == ':' || c == ',' || c == '{' || c == '[' || c == '}' || c == ']') {
                throw new PayloadSyntaxException("Expected object key but found '" + c + "'", keyPos);
            } else {
                key = parseBareWord(cursor);
                cursor.unquotedKeys.add(key);
            }
            if (fields.containsKey(key)) {
                throw new PayloadSyntaxException("Duplicate key '" + key + "'", keyPos);
            }

            cursor.skipWhitespace();
            if (!cursor.consume(':')) {
                throw new PayloadSyntaxException("Expected ':' after key '" + key + "'", cursor.pos);
            }
            cursor.skipWhitespace();
            fields.put(key, parseValue(cursor));

            cursor.skipWhitespace();
            if (cursor.consume('}')) {
                cursor.depth--;
                return new PayloadNode.PayloadObject(fields);
            }
            if (!cursor.consume(',')) {
                if (cursor.atEnd()) {
                    throw new PayloadSyntaxException("Unterminated object opened", start);
                }
                throw new PayloadSyntaxException("Expected ',' or '}' but found '" + cursor.peek() + "'", cursor.pos);
            }
            cursor.skipWhitespace();
            if (cursor.consume('}')) {
                cursor.trailingSeparators++;
                cursor.depth--;
                return new PayloadNode.PayloadObject(fields);
            }
        }
    }

    private PayloadNode.PayloadArray parseArray(Cursor cursor) {
        int start = cursor.pos;
        cursor.enter();
        cursor.pos++; // '['
        MutableList<PayloadNode> elements = Lists.mutable.empty();

        cursor.skipWhitespace();
        if (cursor.consume(']')) {
            cursor.depth--;
            return new PayloadNode.PayloadArray(elements);
        }
        while (true) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                throw new PayloadSyntaxException("Unterminated array opened", start);
            }
            elements.add(parseValue(cursor));

            cursor.skipWhitespace();
            if (cursor.consume(']')) {
                cursor.depth--;
                return new PayloadNode.PayloadArray(elements);
            }
            if (!cursor.consume(',')) {
                if (cursor.atEnd()) {
                    throw new PayloadSyntaxException("Unterminated array opened", start);
                }
                throw new PayloadSyntaxException("Expected ',' or ']' but found '" + cursor.peek() + "'", cursor.pos);
            }
            cursor.skipWhitespace();
            if (cursor.consume(']')) {
                cursor.trailingSeparators++;
                cursor.depth--;
                return new PayloadNode.PayloadArray(elements);
            }
        }
    }

    private String parseQuoted(Cursor cursor) {
        int start = cursor.pos;
        char quote = cursor.text.charAt(cursor.pos++);
        StringBuilder sb = new StringBuilder();
        while (!cursor.atEnd()) {
            char c = cursor.text.charAt(cursor.pos++);
            if (c == quote) {
                return sb.toString();
            }
            if (c == '\\') {
                if (cursor.atEnd()) {
                    break;
                }
                char escaped = cursor.text.charAt(cursor.pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        throw new PayloadSyntaxException("Unterminated string opened", start);
    }

    private String parseBareWord(Cursor cursor) {
        int start = cursor.pos;
        while (!cursor.atEnd() && isWordChar(cursor.peek())) {
            cursor.pos++;
        }
        if (start == cursor.pos) {
            throw new PayloadSyntaxException("Unexpected '" + cursor.peek() + "'", start);
        }
        return cursor.text.substring(start, cursor.pos);
    }

    private PayloadNode classifyWord(String word) {
        switch (word) {
            case "true":
                return new PayloadNode.PayloadBoolean(true);
            case "false":
                return new PayloadNode.PayloadBoolean(false);
            case "null":
                return new PayloadNode.PayloadNull();
            default:
                break;
        }
        if (INTEGER.matcher(word).matches()) {
            try {
                return PayloadNode.PayloadNumber.of(Long.parseLong(word));
            } catch (NumberFormatException e) {
                // too large for a long, fall through to double
            }
        }
        if (DECIMAL.matcher(word).matches()) {
            return PayloadNode.PayloadNumber.of(Double.parseDouble(word));
        }
        return new PayloadNode.PayloadIdentifier(word);
    }

    static boolean isWordChar(char c) {
        return !Character.isWhitespace(c)
            && c != ',' && c != ':' && c != '{' && c != '}' && c != '[' && c != ']'
            && c != '"' && c != '\'';
    }

    private static final class Cursor {
        private final String text;
        private final MutableList<String> unquotedKeys = Lists.mutable.empty();
        private int pos;
        private int trailingSeparators;
        private int depth;

        private Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        boolean consume(char expected) {
            if (!atEnd() && text.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        void enter() {
            if (++depth > MAX_DEPTH) {
                throw new PayloadSyntaxException("Payload nested too deeply", pos);
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }
    }
}
