package com.viffx.FirstFollow.Construction;

import com.viffx.FirstFollow.Symbols.NonTerminal;

import java.util.Map;
import java.util.Objects;

public final class Labels {
    private Labels() {}

    /**
     * Names every unlabeled non-terminal after the key it is mapped from. Non-terminals that already
     * carry a label keep it.
     *
     * @param bindings names mapped to the non-terminals they should label
     * @return the number of labels that were assigned
     * @throws NullPointerException if {@code bindings} or one of its keys or values is {@code null}
     */
    public static int assign(Map<String, NonTerminal> bindings) {
        Objects.requireNonNull(bindings, "bindings cannot be null");

        int assigned = 0;
        for (Map.Entry<String, NonTerminal> binding : bindings.entrySet()) {
            String name = Objects.requireNonNull(binding.getKey(), "name cannot be null");
            NonTerminal nonTerminal = Objects.requireNonNull(binding.getValue(), () -> "no non-terminal bound to " + name);
            if (nonTerminal.hasLabel()) continue;

            nonTerminal.setLabel(name);
            assigned++;
        }
        return assigned;
    }
}
