package com.viffx.FirstFollow.Construction;

import com.viffx.FirstFollow.Symbols.Expansion;
import com.viffx.FirstFollow.Symbols.ExpansionAlternatives;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.viffx.FirstFollow.Construction.Rules.*;
import static org.junit.jupiter.api.Assertions.*;

class RulesTest {

    @Test
    void ntWrapsExpression() {
        NonTerminal a = nt("A", t("a"));
        assertEquals("A", a.label());
        assertEquals(List.of(Expansion.of(t("a"))), a.alternatives().expansions());
        assertTrue(nt("B").alternatives().isEmpty());
    }

    @Test
    void seqAndAltFoldLeft() {
        NonTerminal a = nt("A", t("a"));
        assertEquals(epsilon(), seq());
        assertEquals(never(), alt());
        assertEquals(List.of(Expansion.of(a, t("b"), a)), seq(a, t("b"), a).expansions());
        assertEquals(List.of(Expansion.of(a), Expansion.EMPTY, Expansion.of(t("b"))), alt(a, epsilon(), t("b")).expansions());
    }

    @Test
    void terminalsSpellOneExpansion() {
        ExpansionAlternatives keyword = terminals("i", "f");
        assertEquals(List.of(Expansion.of(t("i"), t("f"))), keyword.expansions());
    }

    @Test
    void labelsOnlyFillInMissingNames() {
        NonTerminal unnamed = nt(null, t("a"));
        NonTerminal named = nt("Named", t("b"));
        Map<String, NonTerminal> bindings = new LinkedHashMap<>();
        bindings.put("first", unnamed);
        bindings.put("second", named);

        assertEquals(1, new GrammarContext().label(bindings));
        assertEquals("first", unnamed.label());
        assertEquals("Named", named.label());
        assertEquals(0, Labels.assign(bindings));
    }

    @Test
    void labelsRejectMissingNodes() {
        Map<String, NonTerminal> bindings = new LinkedHashMap<>();
        bindings.put("ghost", null);
        assertThrows(NullPointerException.class, () -> Labels.assign(bindings));
    }
}
