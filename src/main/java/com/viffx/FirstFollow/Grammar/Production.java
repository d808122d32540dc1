package com.viffx.FirstFollow.Grammar;

import com.viffx.FirstFollow.Symbols.Expansion;

/**
 * One row of a {@link Grammar}'s production table.
 *
 * @param lhs the id of the non-terminal on the left hand side, see {@link Grammar#id}
 * @param rhs the right hand side
 */
public record Production(int lhs, Expansion rhs) {
    public int size() {
        return rhs.size();
    }

    public boolean isEmpty() {
        return rhs.isEmpty();
    }

    @Override
    public String toString() {
        return "Production{" +
                "lhs=" + lhs +
                ", rhs=" + rhs +
                '}';
    }
}
