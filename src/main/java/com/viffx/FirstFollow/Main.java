package com.viffx.FirstFollow;

import com.viffx.FirstFollow.Grammar.Grammar;
import com.viffx.FirstFollow.Symbols.NonTerminal;
import com.viffx.FirstFollow.Symbols.Terminal;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.viffx.FirstFollow.Construction.Rules.*;

public class Main {
    // held here so the level survives, the log manager only keeps weak references
    private static final Logger PACKAGE_LOGGER = Logger.getLogger("com.viffx.FirstFollow");

    public static void main(String[] args) {
        if (args.length > 0 && args[0].equals("-v")) verbose();

        Terminal ta = t("a");
        Terminal tb = t("b");
        NonTerminal a = nt("A", ta);
        NonTerminal b = nt("B", tb);
        NonTerminal d = nt("D", alt(a, b).concat(alt(a, b)));
        NonTerminal c = nt("C", alt(a, seq(a, b), seq(d, tb)));

        Grammar grammar = new Grammar(c);
        System.out.println(grammar.show());
        System.out.println("FIRST");
        System.out.println(grammar.firstSets());
        System.out.println("FOLLOW");
        System.out.println(grammar.followSets());
    }

    private static void verbose() {
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        PACKAGE_LOGGER.addHandler(handler);
        PACKAGE_LOGGER.setLevel(Level.FINE);
    }
}
