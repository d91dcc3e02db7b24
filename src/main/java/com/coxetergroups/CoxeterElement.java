package com.coxetergroups;

/**
 * An immutable element of a {@link CoxeterGroup}. The first six methods are the primitives every
 * representation provides; the rest have generic descent-based implementations in
 * {@link CoxeterAlgorithms} which a representation may replace with faster ones.
 */
public interface CoxeterElement<E extends CoxeterElement<E>> {
    CoxeterGroup<E> parent();
    boolean isIdentity();

    /** True iff {@code l(s w) < l(w)}. */
    boolean isLeftDescent(int s);

    /** True iff {@code l(w s) < l(w)}. */
    boolean isRightDescent(int s);

    E leftMultiply(int s);
    E rightMultiply(int s);

    E multiply(E other);
    E inverse();
    E power(int exponent);
    int length();

    /** (-1)^length. */
    int sign();

    /** The lexicographically least reduced word. */
    int[] shortLex();

    /** The reduced word which is lexicographically least when read from right to left. */
    int[] inverseShortLex();
}
