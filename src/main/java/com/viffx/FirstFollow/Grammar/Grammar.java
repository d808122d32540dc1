package com.viffx.FirstFollow.Grammar;

import com.viffx.FirstFollow.Sets.FirstSetSolver;
import com.viffx.FirstFollow.Sets.FollowSetSolver;
import com.viffx.FirstFollow.Sets.LookaheadSets;
import com.viffx.FirstFollow.Symbols.Expansion;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import com.viffx.FirstFollow.Symbols.Symbol;
import com.viffx.FirstFollow.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * A start non-terminal together with every non-terminal reachable from it.
 * <p>
 * Construction walks the object graph once. Each discovered non-terminal gets a dense id (the start
 * symbol is {@code 0}, the rest follow in discovery order) and its alternatives are copied into a
 * production table:
 * <pre>
 *   C > A;        productions  0: (0) &lt;A&gt;
 *   C > A B;                   1: (0) &lt;A&gt; &lt;B&gt;
 *   A > "a";                   2: (1) "a"
 *   B > "b";                   3: (2) "b"
 * </pre>
 * with the range {@code [0, 2)} recorded for {@code C}, {@code [2, 3)} for {@code A} and so on.
 * The analyses only ever read this table, so a grammar is a frozen snapshot: expansions added to a
 * non-terminal after the grammar was built are not seen by it.
 * <p>
 * Non-terminals that are not reachable from the start symbol do not exist as far as this grammar is
 * concerned.
 */
public class Grammar {
    private static final Logger LOGGER = Logger.getLogger(Grammar.class.getName());

    // ====== INSTANCE FIELDS ====== //
    // Symbols fields
    private final NonTerminal start;
    private final List<NonTerminal> nonTerminals = new ArrayList<>();
    private final Map<NonTerminal, Integer> ids = new IdentityHashMap<>();

    // Productions fields
    private final List<Production> productions = new ArrayList<>();
    private final List<int[]> productionRanges = new ArrayList<>();

    // ====== CONSTRUCTORS ====== //
    public Grammar(@NotNull NonTerminal start) {
        this.start = Objects.requireNonNull(start, "start cannot be null");
        discover();
        LOGGER.fine(() -> "Discovered " + nonTerminals.size() + " non-terminals and "
                + productions.size() + " productions from " + start);
    }

    // ====== DISCOVERY ====== //
    // Breadth first walk. A non-terminal is registered the first time it is seen and is never
    // queued again, which is what makes self and mutual references safe.
    private void discover() {
        Queue<NonTerminal> queue = new ArrayDeque<>();
        register(start, queue);

        while (!queue.isEmpty()) {
            NonTerminal nonTerminal = queue.poll();
            int lhs = ids.get(nonTerminal);

            int from = productions.size();
            for (Expansion expansion : nonTerminal.alternatives().expansions()) {
                productions.add(new Production(lhs, expansion));
                for (Symbol symbol : expansion) {
                    if (symbol instanceof NonTerminal referenced && !ids.containsKey(referenced)) {
                        register(referenced, queue);
                    }
                }
            }
            productionRanges.set(lhs, new int[]{from, productions.size()});
        }
    }

    private void register(NonTerminal nonTerminal, Queue<NonTerminal> queue) {
        ids.put(nonTerminal, nonTerminals.size());
        nonTerminals.add(nonTerminal);
        productionRanges.add(new int[]{0, 0});
        queue.add(nonTerminal);
    }

    // ====== PUBLIC API ====== //

    // Non-terminals

    public @NotNull NonTerminal start() {
        return start;
    }

    /**
     * Returns the number of discovered non-terminals.
     *
     * @return the number of non-terminals, at least one
     */
    public int size() {
        return nonTerminals.size();
    }

    /**
     * Returns the discovered non-terminals in discovery order, the start symbol first.
     *
     * @return an unmodifiable list of the non-terminals, indexed by id
     */
    public @NotNull List<NonTerminal> nonTerminals() {
        return Collections.unmodifiableList(nonTerminals);
    }

    public @NotNull NonTerminal nonTerminal(int id) {
        return nonTerminals.get(id);
    }

    /**
     * Returns whether {@code nonTerminal} (this very instance, not one with the same label) was
     * discovered by this grammar.
     *
     * @param nonTerminal the non-terminal to look for
     * @return if the non-terminal is part of this grammar
     */
    public boolean contains(NonTerminal nonTerminal) {
        return nonTerminal != null && ids.containsKey(nonTerminal);
    }

    /**
     * Returns the id of a discovered non-terminal.
     *
     * @param nonTerminal the non-terminal
     * @return its id, between {@code 0} inclusive and {@link #size()} exclusive
     * @throws IllegalArgumentException if the non-terminal is not part of this grammar
     * @throws NullPointerException if {@code nonTerminal} is {@code null}
     */
    public int id(@NotNull NonTerminal nonTerminal) {
        Objects.requireNonNull(nonTerminal, "nonTerminal cannot be null");
        Integer id = ids.get(nonTerminal);
        if (id == null) {
            throw new IllegalArgumentException(nonTerminal + " is not reachable from " + start);
        }
        return id;
    }

    /**
     * Applies the given {@link Consumer} to each discovered non-terminal in id order.
     *
     * @param consumer a function to process each non-terminal
     */
    public void forEachNonTerminal(Consumer<NonTerminal> consumer) {
        nonTerminals.forEach(consumer);
    }

    /**
     * Returns the distinct terminals used by the productions of this grammar, in the order they are
     * first met when reading the production table top to bottom.
     *
     * @return the terminals of this grammar
     */
    public @NotNull Set<Terminal> terminals() {
        Set<Terminal> terminals = new LinkedHashSet<>();
        for (Production production : productions) {
            for (Symbol symbol : production.rhs()) {
                if (symbol instanceof Terminal terminal) terminals.add(terminal);
            }
        }
        return Collections.unmodifiableSet(terminals);
    }

    // Productions

    public @NotNull Production production(int production) {
        return productions.get(production);
    }

    public int productionsSize() {
        return productions.size();
    }

    /**
     * Applies the given {@link Consumer} to every production of the grammar.
     *
     * @param consumer a function to process each {@link Production}
     */
    public void forEachProduction(Consumer<Production> consumer) {
        productions.forEach(consumer);
    }

    /**
     * Applies the given {@link Consumer} to each production of a single non-terminal.
     *
     * @param nonTerminal the id of the non-terminal whose productions to iterate over
     * @param consumer a function to process each {@link Production}
     */
    public void forEachProduction(int nonTerminal, Consumer<Production> consumer) {
        int[] range = productionRanges.get(nonTerminal);
        for (int i = range[0]; i < range[1]; i++) {
            consumer.accept(productions.get(i));
        }
    }

    /**
     * Returns the range of productions belonging to a non-terminal as a two element array:
     * <ul>
     *   <li><code>range[0]</code>: the start index (inclusive)</li>
     *   <li><code>range[1]</code>: the end index (exclusive)</li>
     * </ul>
     *
     * @param nonTerminal the id of the non-terminal
     * @return a copy of the production range
     * @throws IndexOutOfBoundsException if {@code nonTerminal} is not a valid id
     */
    public int[] productionRange(int nonTerminal) {
        return productionRanges.get(nonTerminal).clone();
    }

    // Analyses

    @Contract("-> new")
    public @NotNull LookaheadSets firstSets() {
        return new FirstSetSolver(this).solve();
    }

    @Contract("-> new")
    public @NotNull LookaheadSets followSets() {
        return new FollowSetSolver(this).solve();
    }

    // Debugging

    /**
     * Returns a string representation of the given {@link Production} in the form
     * <pre>
     *   &lt;C&gt; &lt;- &lt;A&gt; "b"
     * </pre>
     * An empty right hand side is shown as {@code EPSILON()}.
     *
     * @param production the production to represent as a string
     * @return a human-readable string showing the production
     */
    public String toString(Production production) {
        return nonTerminals.get(production.lhs()) + " <- " + production.rhs();
    }

    /**
     * Lists every production, one per line, grouped by non-terminal in id order. Meant for people,
     * it is never parsed back in.
     *
     * @return the listing
     */
    public String show() {
        StringBuilder builder = new StringBuilder();
        for (Production production : productions) {
            builder.append(toString(production)).append('\n');
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "Grammar{" +
                "start=" + start +
                ", nonTerminals=" + nonTerminals.size() +
                ", productions=" + productions.size() +
                '}';
    }
}
