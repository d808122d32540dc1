package com.viffx.FirstFollow.Symbols;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Anything that can stand on the right hand side of a rule: a single {@link Symbol} or a set of
 * {@link ExpansionAlternatives}.
 * <p>
 * Both operators accept either kind of operand on either side. A bare symbol behaves like the
 * alternatives set holding the single one-symbol expansion {@code (symbol)}. Neither operator has
 * side effects; each returns a new value.
 */
public sealed interface Expression permits Symbol, ExpansionAlternatives {

    /**
     * Lifts this expression into an alternatives set.
     *
     * @return this expression viewed as a set of alternatives
     */
    @NotNull ExpansionAlternatives asAlternatives();

    /**
     * Concatenates this expression with {@code other}.
     * <p>
     * The result is the cross product of the expansions: every expansion of this expression followed by
     * every expansion of {@code other}, with the left expansions varying slowest. Concatenating with
     * {@link ExpansionAlternatives#never()} on either side yields no expansions at all and
     * {@link ExpansionAlternatives#epsilon()} is the identity.
     *
     * @param other the right operand
     * @return the concatenated alternatives
     * @throws NullPointerException if {@code other} is {@code null}
     */
    @Contract(value = "_ -> new", pure = true)
    default @NotNull ExpansionAlternatives concat(@NotNull Expression other) {
        Objects.requireNonNull(other, "other cannot be null");

        List<Expansion> left = asAlternatives().expansions();
        List<Expansion> right = other.asAlternatives().expansions();

        List<Expansion> product = new ArrayList<>(left.size() * right.size());
        for (Expansion prefix : left) {
            for (Expansion suffix : right) {
                product.add(prefix.append(suffix));
            }
        }
        return new ExpansionAlternatives(product);
    }

    /**
     * Unions this expression with {@code other}: the expansions of this expression followed by those of
     * {@code other}. Duplicates are kept.
     *
     * @param other the right operand
     * @return the combined alternatives
     * @throws NullPointerException if {@code other} is {@code null}
     */
    @Contract(value = "_ -> new", pure = true)
    default @NotNull ExpansionAlternatives union(@NotNull Expression other) {
        Objects.requireNonNull(other, "other cannot be null");

        List<Expansion> left = asAlternatives().expansions();
        List<Expansion> right = other.asAlternatives().expansions();

        List<Expansion> sum = new ArrayList<>(left.size() + right.size());
        sum.addAll(left);
        sum.addAll(right);
        return new ExpansionAlternatives(sum);
    }
}
