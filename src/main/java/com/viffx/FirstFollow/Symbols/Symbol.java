package com.viffx.FirstFollow.Symbols;

import org.jetbrains.annotations.NotNull;

import java.util.List;

public sealed interface Symbol extends Expression permits Terminal, NonTerminal {

    @Override
    default @NotNull ExpansionAlternatives asAlternatives() {
        return new ExpansionAlternatives(List.of(new Expansion(List.of(this))));
    }
}
