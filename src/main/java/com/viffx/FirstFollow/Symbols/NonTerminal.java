package com.viffx.FirstFollow.Symbols;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A named grammar node defined by its alternative expansions.
 * <p>
 * Non-terminals are compared by identity: two instances sharing a label are still different nodes.
 * They are mutable while a grammar is being put together, both the label and the alternatives, so that
 * rules can refer to each other (and to themselves) before they are completely defined.
 */
public final class NonTerminal implements Symbol {
    private @Nullable String label;
    private @NotNull ExpansionAlternatives alternatives;

    public NonTerminal(@Nullable String label, @NotNull ExpansionAlternatives alternatives) {
        this.label = label;
        this.alternatives = Objects.requireNonNull(alternatives, "alternatives cannot be null");
    }

    public NonTerminal(@Nullable String label) {
        this(label, ExpansionAlternatives.never());
    }

    public @Nullable String label() {
        return label;
    }

    public void setLabel(@Nullable String label) {
        this.label = label;
    }

    public boolean hasLabel() {
        return label != null;
    }

    public @NotNull ExpansionAlternatives alternatives() {
        return alternatives;
    }

    /**
     * Adds the expansions of {@code expression} to this non-terminal's alternatives.
     *
     * @param expression the expansions to add
     * @return this non-terminal
     * @throws NullPointerException if {@code expression} is {@code null}
     */
    public NonTerminal addExpansion(@NotNull Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        alternatives = alternatives.union(expression);
        return this;
    }

    @Override
    public String toString() {
        return "<" + (label == null ? "?" : label) + ">";
    }
}
