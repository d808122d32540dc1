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
 * Computes the FOLLOW set of every non-terminal of a {@link Grammar}: the terminals that can come
 * right after it in some derivation from the start symbol, plus {@link Marker#END} if it can be the
 * last thing before the end of input.
 * <p>
 * The start symbol is seeded with the end marker. Every pass then scans each production of a
 * non-terminal {@code M} right to left, carrying the set of what can follow the current position,
 * starting with {@code FOLLOW(M)}:
 * <ul>
 *   <li>a terminal {@code t} replaces it with <code>{t}</code>;</li>
 *   <li>a non-terminal {@code N} receives all of it; then it becomes {@code FIRST(N)} if {@code N} is
 *       not nullable, or gains {@code FIRST(N)} without the nullable marker if it is.</li>
 * </ul>
 * Passes repeat until one of them changes nothing.
 */
public class FollowSetSolver {
    private static final Logger LOGGER = Logger.getLogger(FollowSetSolver.class.getName());

    private final Grammar grammar;
    private final LookaheadSets first;

    public FollowSetSolver(@NotNull Grammar grammar) {
        this(grammar, new FirstSetSolver(grammar).solve());
    }

    /**
     * @param grammar the grammar to analyse
     * @param first the solved FIRST sets of that same grammar instance
     * @throws IllegalArgumentException if {@code first} was solved for another grammar
     */
    public FollowSetSolver(@NotNull Grammar grammar, @NotNull LookaheadSets first) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        this.first = Objects.requireNonNull(first, "first cannot be null");
        if (first.grammar() != grammar) {
            throw new IllegalArgumentException("FIRST sets were solved for a different grammar");
        }
    }

    @Contract("-> new")
    public @NotNull LookaheadSets solve() {
        List<Set<Lookahead>> follow = new ArrayList<>(grammar.size());
        while (follow.size() < grammar.size()) follow.add(new LinkedHashSet<>());
        follow.get(grammar.id(grammar.start())).add(Marker.END);

        int passes = 0;
        boolean changed;
        do {
            changed = false;
            passes++;

            for (int i = 0; i < grammar.productionsSize(); i++) {
                Production production = grammar.production(i);

                // never mutated, it may alias a live FOLLOW set or a FIRST set
                Set<Lookahead> trailing = follow.get(production.lhs());

                for (int j = production.size() - 1; j >= 0; j--) {
                    Symbol symbol = production.rhs().get(j);
                    if (symbol instanceof Terminal terminal) {
                        trailing = Set.of(terminal);
                        continue;
                    }

                    int id = grammar.id((NonTerminal) symbol);
                    Set<Lookahead> symbolFollow = follow.get(id);
                    if (symbolFollow != trailing) changed |= symbolFollow.addAll(trailing);

                    Set<Lookahead> symbolFirst = first.get(id);
                    if (symbolFirst.contains(Marker.NULLABLE)) {
                        Set<Lookahead> widened = new LinkedHashSet<>(trailing);
                        widened.addAll(symbolFirst);
                        widened.remove(Marker.NULLABLE);
                        trailing = widened;
                    } else {
                        trailing = symbolFirst;
                    }
                }
            }

            final int pass = passes;
            final boolean passChanged = changed;
            LOGGER.finest(() -> "FOLLOW pass " + pass + (passChanged ? " changed" : " stable"));
        } while (changed);

        final int total = passes;
        LOGGER.fine(() -> "FOLLOW sets of " + grammar.size() + " non-terminals stable after " + total + " passes");
        return new LookaheadSets(grammar, follow, passes);
    }
}
