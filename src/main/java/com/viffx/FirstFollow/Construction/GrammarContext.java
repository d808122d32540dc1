package com.viffx.FirstFollow.Construction;

import com.viffx.FirstFollow.Symbols.Expression;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Owns the {@link NonTerminalFamily} caches used while one grammar is being built. Two contexts never
 * share nodes, even for families of the same name.
 */
public final class GrammarContext {
    private final Map<String, NonTerminalFamily<?>> families = new LinkedHashMap<>();

    /**
     * Declares a new family without defining it. Declaring first and defining later allows families
     * to refer to each other. Keep the returned family: a name can only be declared once per context.
     *
     * @param name the family name, used as the label prefix of its nodes
     * @param <K> the argument type
     * @return the new family
     * @throws IllegalStateException if a family of this name was already declared in this context
     */
    public <K> @NotNull NonTerminalFamily<K> family(@NotNull String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (families.containsKey(name)) {
            throw new IllegalStateException("non-terminal family " + name + " is already declared");
        }

        NonTerminalFamily<K> family = new NonTerminalFamily<>(name);
        families.put(name, family);
        return family;
    }

    /**
     * Declares and defines a family in one go.
     *
     * @throws IllegalStateException if a family of this name was already declared in this context
     */
    public <K> @NotNull NonTerminalFamily<K> family(@NotNull String name,
                                                    @NotNull Function<? super K, ? extends Expression> definition) {
        NonTerminalFamily<K> family = family(name);
        return family.define(definition);
    }

    /**
     * Throws if some declared family never got a definition. Call once the grammar is complete and
     * before handing it to the analyses.
     *
     * @throws IllegalStateException naming the first undefined family
     */
    public void checkDefined() {
        for (NonTerminalFamily<?> family : families.values()) {
            if (!family.isDefined()) {
                throw new IllegalStateException("non-terminal family " + family.name() + " is declared but never defined");
            }
        }
    }

    /**
     * @see Labels#assign(Map)
     */
    public int label(@NotNull Map<String, NonTerminal> bindings) {
        return Labels.assign(bindings);
    }
}
