package com.viffx.FirstFollow.Symbols;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One right hand side: an ordered, possibly empty, sequence of symbols. The empty expansion derives
 * the empty word.
 *
 * @param symbols the symbols of this expansion, left to right
 */
public record Expansion(List<Symbol> symbols) implements Iterable<Symbol> {
    public static final Expansion EMPTY = new Expansion(List.of());

    public Expansion {
        symbols = List.copyOf(symbols);
    }

    public static Expansion of(Symbol... symbols) {
        return new Expansion(Arrays.asList(symbols));
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    public Expansion append(Expansion suffix) {
        if (suffix.isEmpty()) return this;
        if (isEmpty()) return suffix;

        List<Symbol> joined = new ArrayList<>(size() + suffix.size());
        joined.addAll(symbols);
        joined.addAll(suffix.symbols);
        return new Expansion(joined);
    }

    @Override
    public @NotNull Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public String toString() {
        if (symbols.isEmpty()) return "EPSILON()";
        return symbols.stream().map(Symbol::toString).collect(Collectors.joining(" "));
    }
}
