package io.github.pyrox.ladder.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Opaque reference to a PLC instruction as it appears in neutral rung text, e.g. {@code TON(T1,1000,0)}.
 * The ladder core only needs the mnemonic (for its visual kind) and the operands (for display).
 */
public record Instruction(String mnemonic, List<String> operands) {
    private static final Pattern MNEMONIC = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Instruction {
        Objects.requireNonNull(mnemonic, "mnemonic");
        if (!MNEMONIC.matcher(mnemonic).matches()) {
            throw new IllegalArgumentException("Invalid instruction mnemonic: '" + mnemonic + "'");
        }
        operands = List.copyOf(operands);
    }

    public static Instruction of(String mnemonic, String... operands) {
        return new Instruction(mnemonic, List.of(operands));
    }

    /**
     * Parses {@code NAME(op1,op2,...)}. Commas nested inside brackets or parentheses belong to the
     * enclosing operand.
     */
    public static Instruction parse(String text) {
        var trimmed = text.strip();
        int open = trimmed.indexOf('(');
        if (open <= 0 || !trimmed.endsWith(")")) {
            throw new IllegalArgumentException("Invalid instruction format: " + text);
        }
        var mnemonic = trimmed.substring(0, open);
        var body = trimmed.substring(open + 1, trimmed.length() - 1);
        return new Instruction(mnemonic, splitOperands(body, text));
    }

    private static List<String> splitOperands(String body, String source) {
        var operands = new ArrayList<String>();
        if (body.isBlank()) {
            return operands;
        }
        int depth = 0;
        var current = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            switch (c) {
                case '(', '[' -> depth++;
                case ')', ']' -> depth--;
                default -> { }
            }
            if (depth < 0) {
                throw new IllegalArgumentException("Unbalanced operand brackets: " + source);
            }
            if (c == ',' && depth == 0) {
                operands.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced operand brackets: " + source);
        }
        operands.add(current.toString().strip());
        return operands;
    }

    public InstructionKind kind() {
        return InstructionKind.of(mnemonic);
    }

    /** First operand, or {@code "???"} when there is none (what a contact or coil shows). */
    public String primaryOperand() {
        return operands.isEmpty() ? "???" : operands.get(0);
    }

    public String text() {
        return mnemonic + "(" + String.join(",", operands) + ")";
    }

    @Override
    public String toString() {
        return text();
    }
}
