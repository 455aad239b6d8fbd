package com.challenges.mxql.query;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Cuts query text into command tokens.
 * <p>
 * A command is a name followed either by a bracket or brace delimited payload, which may
 * span lines, or by the rest of its line. Tokenizing never fails: unterminated payloads
 * are cut at the next line that starts with a known keyword, and text that cannot start
 * a command is recorded as stray and skipped to the end of its line.
 */
public class Tokenizer {

    public TokenizedText tokenize(String text) {
        return new Scan(text).run();
    }

    private static final class Scan {
        private final String text;
        private final IntArrayList lineStarts = new IntArrayList();
        private final MutableList<Token> tokens = Lists.mutable.empty();
        private final MutableList<StrayText> strays = Lists.mutable.empty();
        private int pos;

        private Scan(String text) {
            this.text = text;
            lineStarts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    lineStarts.add(i + 1);
                }
            }
        }

        TokenizedText run() {
            while (true) {
                skipWhitespace();
                if (atEnd()) {
                    break;
                }
                if (startsWith("#") || startsWith("//") || startsWith("--")) {
                    pos = endOfLine(pos);
                } else if (startsWith("/*")) {
                    int close = text.indexOf("*/", pos + 2);
                    pos = close < 0 ? text.length() : close + 2;
                } else if (Character.isLetter(text.charAt(pos))) {
                    readCommand();
                } else {
                    int end = endOfLine(pos);
                    strays.add(new StrayText(text.substring(pos, end).trim(), lineOf(pos), columnOf(pos), tokens.size()));
                    pos = end;
                }
            }
            return new TokenizedText(tokens.toImmutable(), strays.toImmutable());
        }

        private void readCommand() {
            int start = pos;
            while (!atEnd() && isNameChar(text.charAt(pos))) {
                pos++;
            }
            String name = text.substring(start, pos);
            int line = lineOf(start);
            int column = columnOf(start);

            while (!atEnd() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
                pos++;
            }
            if (atEnd() || text.charAt(pos) == '\n' || text.charAt(pos) == '\r') {
                tokens.add(new Token(name, null, line, column, true));
                return;
            }

            char c = text.charAt(pos);
            if (c == '{' || c == '[') {
                int close = findClosing(pos);
                if (close >= 0) {
                    tokens.add(new Token(name, text.substring(pos, close + 1), line, column, true));
                    pos = close + 1;
                } else {
                    int cut = nextKeywordLine(pos);
                    tokens.add(new Token(name, text.substring(pos, cut).trim(), line, column, false));
                    pos = cut;
                }
                return;
            }

            int end = endOfLine(pos);
            String payload = stripTrailingComment(text.substring(pos, end)).trim();
            tokens.add(new Token(name, payload.isEmpty() ? null : payload, line, column, true));
            pos = end;
        }

        // -1 when input ends before the closing delimiter
        private int findClosing(int open) {
            Deque<Character> stack = new ArrayDeque<>();
            char quote = 0;
            for (int i = open; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == '\\') {
                        i++;
                    } else if (c == quote) {
                        quote = 0;
                    }
                    continue;
                }
                switch (c) {
                    case '"', '\'' -> quote = c;
                    case '{', '[' -> stack.push(c);
                    case '}', ']' -> {
                        stack.pop();
                        if (stack.isEmpty()) {
                            return i;
                        }
                    }
                    default -> {
                        // payload content
                    }
                }
            }
            return -1;
        }

        private int nextKeywordLine(int from) {
            int lineIndex = lineIndexOf(from) + 1;
            for (; lineIndex < lineStarts.size(); lineIndex++) {
                int i = lineStarts.get(lineIndex);
                while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
                    i++;
                }
                int wordStart = i;
                while (i < text.length() && isNameChar(text.charAt(i))) {
                    i++;
                }
                if (i > wordStart && CommandKind.isKeyword(text.substring(wordStart, i)) && !followedByColon(i)) {
                    return lineStarts.get(lineIndex);
                }
            }
            return text.length();
        }

        private boolean followedByColon(int i) {
            while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
                i++;
            }
            return i < text.length() && text.charAt(i) == ':';
        }

        private String stripTrailingComment(String rest) {
            if (rest.startsWith("#") || rest.startsWith("//")) {
                return "";
            }
            int hash = rest.indexOf(" #");
            int slashes = rest.indexOf(" //");
            int cut = hash < 0 ? slashes : slashes < 0 ? hash : Math.min(hash, slashes);
            return cut < 0 ? rest : rest.substring(0, cut);
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private boolean startsWith(String prefix) {
            return text.startsWith(prefix, pos);
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private int endOfLine(int from) {
            int newline = text.indexOf('\n', from);
            return newline < 0 ? text.length() : newline;
        }

        private int lineIndexOf(int offset) {
            int index = lineStarts.binarySearch(offset);
            return index >= 0 ? index : -index - 2;
        }

        private int lineOf(int offset) {
            return lineIndexOf(offset) + 1;
        }

        private int columnOf(int offset) {
            return offset - lineStarts.get(lineIndexOf(offset)) + 1;
        }

        private static boolean isNameChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-';
        }
    }
}
