package com.viffx.FirstFollow.Sets;

import com.viffx.FirstFollow.Grammar.Grammar;
import com.viffx.FirstFollow.Grammar.Production;
import com.viffx.FirstFollow.Symbols.Lookahead;
import com.viffx.FirstFollow.Symbols.Marker;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import com.viffx.FirstFollow.Symbols.Symbol;
import com.viffx.FirstFollow.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes the FIRST set of every non-terminal of a {@link Grammar}: the terminals that can begin a
 * derivation from it, plus {@link Marker#NULLABLE} if it can derive the empty word.
 * <p>
 * Every pass scans each production left to right. A terminal is added and ends the scan. A non-terminal
 * contributes its own FIRST set (without the nullable marker) and lets the scan continue only if it is
 * nullable. A scan that runs off the end of the production makes the left hand side nullable. Passes
 * repeat until one of them changes nothing; sets only grow and are bounded by the number of terminals,
 * so this always ends.
 */
public class FirstSetSolver {
    private static final Logger LOGGER = Logger.getLogger(FirstSetSolver.class.getName());

    private final Grammar grammar;

    public FirstSetSolver(@NotNull Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
    }

    @Contract("-> new")
    public @NotNull LookaheadSets solve() {
        List<Set<Lookahead>> first = new ArrayList<>(grammar.size());
        while (first.size() < grammar.size()) first.add(new LinkedHashSet<>());

        int passes = 0;
        boolean changed;
        do {
            changed = false;
            passes++;

            for (int i = 0; i < grammar.productionsSize(); i++) {
                Production production = grammar.production(i);
                Set<Lookahead> lhsFirst = first.get(production.lhs());

                boolean allNullable = true;
                for (Symbol symbol : production.rhs()) {
                    if (symbol instanceof Terminal terminal) {
                        changed |= lhsFirst.add(terminal);
                        allNullable = false;
                        break;
                    }

                    Set<Lookahead> symbolFirst = first.get(grammar.id((NonTerminal) symbol));
                    if (symbolFirst != lhsFirst) {
                        for (Lookahead lookahead : symbolFirst) {
                            if (lookahead != Marker.NULLABLE) changed |= lhsFirst.add(lookahead);
                        }
                    }

                    if (!symbolFirst.contains(Marker.NULLABLE)) {
                        allNullable = false;
                        break;
                    }
                }

                if (allNullable) changed |= lhsFirst.add(Marker.NULLABLE);
            }

            final int pass = passes;
            final boolean passChanged = changed;
            LOGGER.finest(() -> "FIRST pass " + pass + (passChanged ? " changed" : " stable"));
        } while (changed);

        final int total = passes;
        LOGGER.fine(() -> "FIRST sets of " + grammar.size() + " non-terminals stable after " + total + " passes");
        return new LookaheadSets(grammar, first, passes);
    }

    /**
     * Returns the FIRST set of a sequence of symbols, given the solved FIRST sets of a grammar.
     * <p>
     * The result holds {@link Marker#NULLABLE} exactly when every symbol of the sequence is nullable,
     * which includes the empty sequence.
     *
     * @param symbols the sequence, left to right
     * @param first the solved FIRST sets of the grammar the sequence's non-terminals belong to
     * @return a new set
     * @throws IllegalArgumentException if a non-terminal of the sequence is not part of the grammar
     * @throws NullPointerException if an argument is {@code null}
     */
    @Contract("_, _ -> new")
    public static @NotNull Set<Lookahead> first(@NotNull List<? extends Symbol> symbols, @NotNull LookaheadSets first) {
        Objects.requireNonNull(symbols, "symbols cannot be null");
        Objects.requireNonNull(first, "first cannot be null");

        Set<Lookahead> result = new LinkedHashSet<>();
        for (Symbol symbol : symbols) {
            if (symbol instanceof Terminal terminal) {
                result.add(terminal);
                return result;
            }

            Set<Lookahead> symbolFirst = first.get((NonTerminal) symbol);
            for (Lookahead lookahead : symbolFirst) {
                if (lookahead != Marker.NULLABLE) result.add(lookahead);
            }
            if (!symbolFirst.contains(Marker.NULLABLE)) return result;
        }
        result.add(Marker.NULLABLE);
        return result;
    }
}
