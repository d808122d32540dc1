package com.viffx.FirstFollow.Sets;

import com.viffx.FirstFollow.Grammar.Grammar;
import com.viffx.FirstFollow.Symbols.Lookahead;
import com.viffx.FirstFollow.Symbols.Marker;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import com.viffx.FirstFollow.Symbols.Terminal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.viffx.FirstFollow.Construction.Rules.*;
import static org.junit.jupiter.api.Assertions.*;

class FirstSetSolverTest {
    private final Terminal ta = t("a");
    private final Terminal tb = t("b");

    @Test
    void scenarioGrammar() {
        NonTerminal a = nt("A", ta);
        NonTerminal b = nt("B", tb);
        NonTerminal d = nt("D", alt(a, b).concat(alt(a, b)));
        NonTerminal c = nt("C", alt(a, seq(a, b), seq(d, tb)));

        LookaheadSets first = new FirstSetSolver(new Grammar(c)).solve();
        assertEquals(Set.of(ta), first.get(a));
        assertEquals(Set.of(tb), first.get(b));
        assertEquals(Set.of(ta, tb), first.get(d));
        assertEquals(Set.of(ta, tb), first.get(c));
    }

    @Test
    void nullablePropagatesThroughSequence() {
        Terminal x = t("x");
        Terminal y = t("y");
        NonTerminal e = nt("E", alt(epsilon(), x));
        NonTerminal f = nt("F", seq(e, y));
        NonTerminal s = nt("S", alt(e, f));

        LookaheadSets first = new Grammar(s).firstSets();
        assertEquals(Set.of(Marker.NULLABLE, x), first.get(e));
        assertEquals(Set.of(x, y), first.get(f));
        assertFalse(first.contains(f, Marker.NULLABLE));
        assertEquals(Set.of(Marker.NULLABLE, x, y), first.get(s));
    }

    @Test
    void allNullableSequenceIsNullable() {
        NonTerminal e1 = nt("E1", alt(epsilon(), t("x")));
        NonTerminal e2 = nt("E2", epsilon());
        NonTerminal s = nt("S", seq(e1, e2, e1));

        LookaheadSets first = new Grammar(s).firstSets();
        assertEquals(Set.of(Marker.NULLABLE), first.get(e2));
        assertEquals(Set.of(Marker.NULLABLE, t("x")), first.get(s));
    }

    @Test
    void terminalBlocksFurtherSymbols() {
        NonTerminal b = nt("B", tb);
        NonTerminal s = nt("S", seq(ta, b));

        assertEquals(Set.of(ta), new Grammar(s).firstSets().get(s));
    }

    @Test
    void leftRecursionConverges() {
        NonTerminal num = nt("Num", t("n"));
        NonTerminal expr = nt("Expr");
        expr.addExpansion(alt(seq(expr, t("+"), num), num));

        LookaheadSets first = new Grammar(expr).firstSets();
        assertEquals(Set.of(t("n")), first.get(expr));
    }

    @Test
    void nullableSelfReferenceSeesLaterSymbols() {
        NonTerminal s = nt("S");
        s.addExpansion(alt(epsilon(), seq(s, ta)));

        assertEquals(Set.of(Marker.NULLABLE, ta), new Grammar(s).firstSets().get(s));
    }

    @Test
    void neverHasAnEmptySet() {
        NonTerminal n = nt("N");
        NonTerminal s = nt("S", alt(n, seq(n, ta), tb));

        LookaheadSets first = new Grammar(s).firstSets();
        assertTrue(first.get(n).isEmpty());
        assertEquals(Set.of(tb), first.get(s));
    }

    @Test
    void solvingAgainGivesTheSameSets() {
        NonTerminal e = nt("E", alt(epsilon(), t("x")));
        NonTerminal list = nt("List");
        list.addExpansion(alt(epsilon(), seq(e, ta, list)));
        Grammar grammar = new Grammar(list);

        LookaheadSets once = new FirstSetSolver(grammar).solve();
        LookaheadSets twice = new FirstSetSolver(grammar).solve();
        assertEquals(once, twice);
        assertEquals(once.hashCode(), twice.hashCode());
        assertEquals(once.passes(), twice.passes());
        assertTrue(once.passes() >= 2);
    }

    @Test
    void firstOfSequence() {
        Terminal x = t("x");
        Terminal y = t("y");
        NonTerminal e = nt("E", alt(epsilon(), x));
        NonTerminal f = nt("F", seq(e, y));
        NonTerminal s = nt("S", seq(e, f));
        LookaheadSets first = new Grammar(s).firstSets();

        assertEquals(Set.of(x, y), FirstSetSolver.first(List.of(e, f), first));
        assertEquals(Set.of(x, Marker.NULLABLE), FirstSetSolver.first(List.of(e, e), first));
        assertEquals(Set.of(Marker.NULLABLE), FirstSetSolver.first(List.of(), first));
        assertEquals(Set.of(x, ta), FirstSetSolver.first(List.of(e, ta, f), first));

        NonTerminal stranger = nt("Stranger", x);
        assertThrows(IllegalArgumentException.class, () -> FirstSetSolver.first(List.of(stranger), first));
    }

    @Test
    void setsAreKeyedByIdentityAndReadOnly() {
        NonTerminal a = nt("A", ta);
        NonTerminal twin = nt("A", tb);
        NonTerminal s = nt("S", seq(a, twin));
        LookaheadSets first = new Grammar(s).firstSets();

        assertEquals(Set.of(ta), first.get(a));
        assertEquals(Set.of(tb), first.get(twin));
        assertEquals(first.get(twin), first.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> first.get(3));
        assertEquals(List.of(s, a, twin), List.copyOf(first.asMap().keySet()));
        assertThrows(IllegalArgumentException.class, () -> first.get(nt("A", ta)));

        Set<Lookahead> set = first.get(a);
        assertThrows(UnsupportedOperationException.class, () -> set.add(tb));
        assertTrue(first.toString().contains("<A> => [\"a\"]\n"));
    }
}
