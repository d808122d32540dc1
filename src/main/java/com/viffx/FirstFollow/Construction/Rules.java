package com.viffx.FirstFollow.Construction;

import com.viffx.FirstFollow.Symbols.Expansion;
import com.viffx.FirstFollow.Symbols.ExpansionAlternatives;
import com.viffx.FirstFollow.Symbols.Expression;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import com.viffx.FirstFollow.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Short static constructors for writing grammars by hand, meant to be imported statically:
 * <pre>
 *   NonTerminal a = nt("A", t("a"));
 *   NonTerminal b = nt("B", t("b"));
 *   NonTerminal c = nt("C", alt(a, seq(a, b)));
 * </pre>
 */
public final class Rules {
    private Rules() {}

    @Contract("_ -> new")
    public static @NotNull Terminal t(@NotNull String text) {
        return new Terminal(text);
    }

    /**
     * Creates a non-terminal with no expansions yet, to be filled in later with
     * {@link NonTerminal#addExpansion}. This is how recursive rules are written.
     */
    @Contract("_ -> new")
    public static @NotNull NonTerminal nt(@Nullable String label) {
        return new NonTerminal(label);
    }

    @Contract("_, _ -> new")
    public static @NotNull NonTerminal nt(@Nullable String label, @NotNull Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return new NonTerminal(label, expression.asAlternatives());
    }

    /**
     * Concatenates the expressions left to right. No expressions at all give {@link #epsilon()}.
     */
    public static @NotNull ExpansionAlternatives seq(@NotNull Expression... expressions) {
        ExpansionAlternatives result = epsilon();
        for (Expression expression : expressions) {
            result = result.concat(expression);
        }
        return result;
    }

    /**
     * Unions the expressions left to right. No expressions at all give {@link #never()}.
     */
    public static @NotNull ExpansionAlternatives alt(@NotNull Expression... expressions) {
        ExpansionAlternatives result = never();
        for (Expression expression : expressions) {
            result = result.union(expression);
        }
        return result;
    }

    public static @NotNull ExpansionAlternatives epsilon() {
        return ExpansionAlternatives.epsilon();
    }

    public static @NotNull ExpansionAlternatives never() {
        return ExpansionAlternatives.never();
    }

    /**
     * Returns the alternatives holding exactly one expansion made of the given terminals, one per
     * string. Handy for keywords spelled out symbol by symbol.
     */
    public static @NotNull ExpansionAlternatives terminals(@NotNull String... texts) {
        Terminal[] symbols = new Terminal[texts.length];
        for (int i = 0; i < texts.length; i++) {
            symbols[i] = t(texts[i]);
        }
        return ExpansionAlternatives.of(Expansion.of(symbols));
    }
}
