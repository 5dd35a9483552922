package com.phillippitts.arithmetic.domain;

import com.phillippitts.arithmetic.exception.UnsupportedOperatorException;

import java.util.Optional;

/**
 * Closed set of arithmetic operators accepted by the calculator.
 *
 * <p>Each operator is identified on the wire by a short lowercase tag ({@code add}, {@code sub},
 * {@code mul}, {@code div}). Tags are matched exactly via {@link #fromTag(String)};
 * {@code "ADD"} or {@code " add "} is not a tag.
 */
public enum Operator {

    ADD("add", "+"),
    SUB("sub", "-"),
    MUL("mul", "*"),
    DIV("div", "/");

    private final String tag;
    private final String symbol;

    Operator(String tag, String symbol) {
        this.tag = tag;
        this.symbol = symbol;
    }

    /**
     * Wire tag of this operator, e.g. {@code "add"}.
     */
    public String tag() {
        return tag;
    }

    /**
     * Infix symbol, used only for log output.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Parses a wire tag into an operator. Only the exact lowercase tags match.
     *
     * @param tag operator tag supplied by the caller
     * @return matching operator
     * @throws UnsupportedOperatorException if the tag is null or outside the closed set
     */
    public static Operator fromTag(String tag) {
        return lookup(tag).orElseThrow(() -> new UnsupportedOperatorException(tag));
    }

    /**
     * Non-throwing variant of {@link #fromTag(String)}.
     */
    public static Optional<Operator> lookup(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (Operator op : values()) {
            if (op.tag.equals(tag)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tag;
    }
}
