package com.viffx.FirstFollow.Sets;

import com.viffx.FirstFollow.Grammar.Grammar;
import com.viffx.FirstFollow.Symbols.Lookahead;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The solved FIRST or FOLLOW sets of a {@link Grammar}, one set per discovered non-terminal.
 * <p>
 * Lookups are by non-terminal identity. Instances are immutable.
 */
public final class LookaheadSets {
    private final Grammar grammar;
    private final List<Set<Lookahead>> sets;
    private final int passes;

    LookaheadSets(Grammar grammar, List<Set<Lookahead>> sets, int passes) {
        this.grammar = grammar;
        List<Set<Lookahead>> copy = new ArrayList<>(sets.size());
        for (Set<Lookahead> set : sets) {
            copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(set)));
        }
        this.sets = Collections.unmodifiableList(copy);
        this.passes = passes;
    }

    public @NotNull Grammar grammar() {
        return grammar;
    }

    /**
     * Returns the set of a non-terminal.
     *
     * @param nonTerminal a non-terminal of the solved grammar
     * @return its unmodifiable set
     * @throws IllegalArgumentException if the non-terminal is not part of the grammar
     * @throws NullPointerException if {@code nonTerminal} is {@code null}
     */
    public @NotNull Set<Lookahead> get(@NotNull NonTerminal nonTerminal) {
        return sets.get(grammar.id(nonTerminal));
    }

    /**
     * Returns the set of the non-terminal with the given id.
     *
     * @param id the id of a non-terminal of the solved grammar
     * @return its unmodifiable set
     * @throws IndexOutOfBoundsException if {@code id} is not a valid id
     */
    public @NotNull Set<Lookahead> get(int id) {
        return sets.get(id);
    }

    public boolean contains(@NotNull NonTerminal nonTerminal, Lookahead lookahead) {
        return get(nonTerminal).contains(lookahead);
    }

    /**
     * Returns every set keyed by its non-terminal, in discovery order. Since non-terminals compare by
     * identity the map is identity keyed.
     *
     * @return an unmodifiable map from non-terminal to set
     */
    public @NotNull Map<NonTerminal, Set<Lookahead>> asMap() {
        Map<NonTerminal, Set<Lookahead>> map = new LinkedHashMap<>();
        for (int i = 0; i < sets.size(); i++) {
            map.put(grammar.nonTerminal(i), sets.get(i));
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Returns the number of passes the fixpoint iteration needed, counting the final pass that changed
     * nothing.
     *
     * @return the number of passes, at least one
     */
    public int passes() {
        return passes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LookaheadSets that = (LookaheadSets) o;
        return grammar == that.grammar && sets.equals(that.sets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(grammar), sets);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < sets.size(); i++) {
            builder.append(grammar.nonTerminal(i))
                   .append(" => ")
                   .append(sets.get(i))
                   .append('\n');
        }
        return builder.toString();
    }
}
