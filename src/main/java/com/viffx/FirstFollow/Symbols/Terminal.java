package com.viffx.FirstFollow.Symbols;

import java.util.Objects;

/**
 * An atomic symbol of the grammar's alphabet. Two terminals with the same text are equal.
 *
 * @param text the literal text of the terminal
 */
public record Terminal(String text) implements Symbol, Lookahead {
    public Terminal {
        Objects.requireNonNull(text, "text cannot be null");
    }

    @Override
    public String toString() {
        return '"' + text.replace("\n", "\\n") + '"';
    }
}
