package com.viffx.FirstFollow.Symbols;

public enum Marker implements Lookahead {
    /** The non-terminal can derive the empty word. Only ever found in FIRST sets. */
    NULLABLE,
    /** End of input can follow the non-terminal. Only ever found in FOLLOW sets. */
    END,
}
