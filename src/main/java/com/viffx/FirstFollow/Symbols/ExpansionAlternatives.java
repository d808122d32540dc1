package com.viffx.FirstFollow.Symbols;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The alternative right hand sides of a non-terminal. Order carries no meaning and duplicates are
 * allowed, but both are preserved so that printing stays stable.
 *
 * @param expansions the alternatives
 */
public record ExpansionAlternatives(List<Expansion> expansions) implements Expression {
    private static final ExpansionAlternatives NEVER = new ExpansionAlternatives(List.of());
    private static final ExpansionAlternatives EPSILON = new ExpansionAlternatives(List.of(Expansion.EMPTY));

    public ExpansionAlternatives {
        expansions = List.copyOf(expansions);
    }

    /**
     * Returns the alternatives with no expansions. A non-terminal defined by it derives nothing.
     * It is the identity of {@link #union} and absorbs {@link #concat}.
     */
    public static ExpansionAlternatives never() {
        return NEVER;
    }

    /**
     * Returns the alternatives holding only the empty expansion, the identity of {@link #concat}.
     */
    public static ExpansionAlternatives epsilon() {
        return EPSILON;
    }

    public static ExpansionAlternatives of(Expansion... expansions) {
        return new ExpansionAlternatives(List.of(expansions));
    }

    public int size() {
        return expansions.size();
    }

    public boolean isEmpty() {
        return expansions.isEmpty();
    }

    @Override
    public @NotNull ExpansionAlternatives asAlternatives() {
        return this;
    }

    @Override
    public String toString() {
        if (expansions.isEmpty()) return "NEVER()";
        return expansions.stream().map(Expansion::toString).collect(Collectors.joining(" | "));
    }
}
