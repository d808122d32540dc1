package com.viffx.FirstFollow.Symbols;

/**
 * An element of a FIRST or FOLLOW set: either a concrete {@link Terminal} or one of the
 * {@link Marker} sentinels.
 */
public sealed interface Lookahead permits Terminal, Marker {}
