package com.coxetergroups;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Length, normal forms and arithmetic written once against the element primitives: descent tests,
 * left/right multiplication by a generator, the identity and the parent group. Every loop below
 * strips one descent per step, so the element it works on gets strictly shorter and the loop ends.
 */
public final class CoxeterAlgorithms {

    private CoxeterAlgorithms() {}

    /** The smallest {@code s} with {@code l(s w) < l(w)}, or 0 if {@code w} is the identity. */
    public static <E extends CoxeterElement<E>> int firstLeftDescent(E w) {
        int rank = w.parent().rank();
        for (int s = 1; s <= rank; s++) {
            if (w.isLeftDescent(s)) return s;
        }
        return 0;
    }

    /** The smallest {@code s} with {@code l(w s) < l(w)}, or 0 if {@code w} is the identity. */
    public static <E extends CoxeterElement<E>> int firstRightDescent(E w) {
        int rank = w.parent().rank();
        for (int s = 1; s <= rank; s++) {
            if (w.isRightDescent(s)) return s;
        }
        return 0;
    }

    public static <E extends CoxeterElement<E>> int length(E w) {
        int steps = 0;
        for (int s = firstLeftDescent(w); s != 0; s = firstLeftDescent(w)) {
            w = w.leftMultiply(s);
            steps++;
        }
        return steps;
    }

    public static <E extends CoxeterElement<E>> int[] shortLex(E w) {
        List<Integer> word = new ArrayList<>();
        for (int s = firstLeftDescent(w); s != 0; s = firstLeftDescent(w)) {
            word.add(s);
            w = w.leftMultiply(s);
        }
        return toArray(word);
    }

    public static <E extends CoxeterElement<E>> int[] inverseShortLex(E w) {
        List<Integer> word = new ArrayList<>();
        for (int s = firstRightDescent(w); s != 0; s = firstRightDescent(w)) {
            word.add(s);
            w = w.rightMultiply(s);
        }
        Collections.reverse(word);
        return toArray(word);
    }

    /** Moves the left descents of {@code y} one at a time onto the right end of {@code x}. */
    public static <E extends CoxeterElement<E>> E multiply(E x, E y) {
        MismatchedParentException.check(x, y);
        for (int s = firstLeftDescent(y); s != 0; s = firstLeftDescent(y)) {
            x = x.rightMultiply(s);
            y = y.leftMultiply(s);
        }
        return x;
    }

    public static <E extends CoxeterElement<E>> E inverse(E x) {
        E acc = x.parent().identity();
        for (int s = firstLeftDescent(x); s != 0; s = firstLeftDescent(x)) {
            x = x.leftMultiply(s);
            acc = acc.leftMultiply(s);
        }
        return acc;
    }

    public static <E extends CoxeterElement<E>> E power(E x, int exponent) {
        E result = x.parent().identity();
        if (exponent == 0) return result;

        long e = exponent;
        E base = x;
        if (e < 0) {
            base = base.inverse();
            e = -e;
        }
        while (e > 0) {
            if ((e & 1L) != 0) result = result.multiply(base);
            e >>= 1;
            if (e > 0) base = base.multiply(base);
        }
        return result;
    }

    /** Climbs by non-descents until every generator is a right descent. */
    public static <E extends CoxeterElement<E>> E longestElement(CoxeterGroup<E> group) {
        if (!group.isFinite()) throw new NonFiniteGroupException("The longest element only exists in a finite Coxeter group");
        E w = group.identity();
        int rank = group.rank();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (int s = 1; s <= rank; s++) {
                if (!w.isRightDescent(s)) {
                    w = w.rightMultiply(s);
                    grew = true;
                    break;
                }
            }
        }
        return w;
    }

    public static <E extends CoxeterElement<E>> E fromWord(CoxeterGroup<E> group, int... word) {
        E w = group.identity();
        for (int s : word) w = w.rightMultiply(s);
        return w;
    }

    private static int[] toArray(List<Integer> word) {
        int[] out = new int[word.size()];
        for (int i = 0; i < out.length; i++) out[i] = word.get(i);
        return out;
    }
}
