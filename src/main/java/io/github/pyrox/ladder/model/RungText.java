package io.github.pyrox.ladder.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between neutral Logix rung text ({@code XIC(a)[XIC(b),XIO(c)]OTE(d);}) and rung
 * element sequences. Brackets and commas inside an instruction's parentheses are operand syntax
 * (array references, operand lists), not branch markers.
 */
public final class RungText {
    public static final String BRANCH_START = "[";
    public static final String BRANCH_NEXT = ",";
    public static final String BRANCH_END = "]";

    private RungText() {}

    /**
     * Splits rung text into instruction texts and the marker tokens {@code [ , ]}.
     */
    public static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        var body = stripTerminator(text);
        var current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (depth == 0 && (c == '[' || c == ']' || c == ',')) {
                flush(current, tokens);
                tokens.add(String.valueOf(c));
                continue;
            }
            if (depth == 0 && Character.isWhitespace(c)) {
                flush(current, tokens);
                continue;
            }
            current.append(c);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new IllegalArgumentException("Unbalanced parentheses at offset " + i + " in: " + text);
                }
                if (depth == 0) {
                    flush(current, tokens);
                }
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced parentheses in: " + text);
        }
        flush(current, tokens);
        return tokens;
    }

    /**
     * Parses rung text into an unindexed element sequence; {@link Rung} assigns positions and
     * branch ids.
     */
    public static List<RungElement> parse(String text) {
        var elements = new ArrayList<RungElement>();
        for (var token : tokenize(text)) {
            elements.add(switch (token) {
                case BRANCH_START -> RungElement.marker(RungElementType.BRANCH_START);
                case BRANCH_NEXT -> RungElement.marker(RungElementType.BRANCH_NEXT);
                case BRANCH_END -> RungElement.marker(RungElementType.BRANCH_END);
                default -> RungElement.instruction(Instruction.parse(token));
            });
        }
        return elements;
    }

    /**
     * Formats a sequence back to rung text. Non-empty rungs end with {@code ;}, the empty rung is
     * the empty string.
     */
    public static String format(List<RungElement> elements) {
        if (elements.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var element : elements) {
            sb.append(switch (element.kind()) {
                case INSTRUCTION -> element.instruction().text();
                case BRANCH_START -> BRANCH_START;
                case BRANCH_NEXT -> BRANCH_NEXT;
                case BRANCH_END -> BRANCH_END;
            });
        }
        return sb.append(';').toString();
    }

    private static String stripTerminator(String text) {
        var body = text.strip();
        while (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).strip();
        }
        return body;
    }

    private static void flush(StringBuilder current, List<String> tokens) {
        if (!current.toString().isBlank()) {
            tokens.add(current.toString().strip());
        }
        current.setLength(0);
    }
}
