package com.viffx.FirstFollow.Construction;

import com.viffx.FirstFollow.Symbols.Expression;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A parametrised family of non-terminals, such as "exactly {@code n} copies of {@code X}", with one
 * node per distinct argument.
 * <p>
 * The node for an argument is created and cached <em>before</em> the generating function runs, so a
 * definition may ask the family for the very node it is defining, or for any other member, and
 * construction still terminates:
 * <pre>
 *   NonTerminalFamily&lt;Integer&gt; p = context.family("P");
 *   p.define(n -&gt; n == 0 ? t("a") : seq(p.get(n - 1), t("x")));
 *   NonTerminal p3 = p.get(3); // &lt;P(3)&gt; -&gt; &lt;P(2)&gt; "x"
 * </pre>
 * Several arguments are passed as one {@link List} key, and show up comma separated in the label.
 * List keys are copied when cached, so changing the caller's list afterwards does not affect lookups.
 *
 * @param <K> the argument type; equal arguments give the same node
 */
public final class NonTerminalFamily<K> {
    private final String name;
    private final Map<Object, NonTerminal> cache = new HashMap<>();
    private Function<? super K, ? extends Expression> definition;

    NonTerminalFamily(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public boolean isDefined() {
        return definition != null;
    }

    /**
     * Supplies the generating function. This can only happen once.
     *
     * @param definition maps an argument to the expansions of its node
     * @return this family
     * @throws IllegalStateException if the family already has a definition
     * @throws NullPointerException if {@code definition} is {@code null}
     */
    public NonTerminalFamily<K> define(@NotNull Function<? super K, ? extends Expression> definition) {
        Objects.requireNonNull(definition, "definition cannot be null");
        if (this.definition != null) {
            throw new IllegalStateException("non-terminal family " + name + " is already defined");
        }
        this.definition = definition;
        return this;
    }

    /**
     * Returns the node for {@code argument}, building it on first use.
     *
     * @param argument the argument, must not be {@code null}
     * @return the node cached for arguments equal to {@code argument}
     * @throws IllegalStateException if no definition has been supplied yet
     * @throws NullPointerException if {@code argument}, an element of a list argument, or the expansions
     *         returned by the definition are {@code null}
     */
    public @NotNull NonTerminal get(@NotNull K argument) {
        Objects.requireNonNull(argument, "argument cannot be null");

        Object key = argument instanceof List<?> list ? List.copyOf(list) : argument;
        NonTerminal cached = cache.get(key);
        if (cached != null) return cached;

        if (definition == null) {
            throw new IllegalStateException("non-terminal family " + name + " was used before it was defined");
        }

        NonTerminal nonTerminal = new NonTerminal(label(argument));
        cache.put(key, nonTerminal);
        try {
            nonTerminal.addExpansion(Objects.requireNonNull(definition.apply(argument),
                    () -> "definition of " + name + " returned null for " + argument));
        } catch (RuntimeException e) {
            // a half built node must not be handed out by later calls
            cache.remove(key);
            throw e;
        }
        return nonTerminal;
    }

    /**
     * Returns the number of distinct arguments built so far.
     */
    public int size() {
        return cache.size();
    }

    private String label(K argument) {
        String arguments = argument instanceof List<?> list
                ? list.stream().map(String::valueOf).collect(Collectors.joining(", "))
                : String.valueOf(argument);
        return name + "(" + arguments + ")";
    }

    @Override
    public String toString() {
        return "NonTerminalFamily{" +
                "name='" + name + '\'' +
                ", defined=" + isDefined() +
                ", size=" + cache.size() +
                '}';
    }
}
