package com.coxetergroups;

import java.util.List;

/**
 * A Coxeter group given by a Coxeter matrix, with generators numbered {@code 1..rank()}.
 * Implementations are immutable and share nothing mutable with their elements.
 */
public interface CoxeterGroup<E extends CoxeterElement<E>> {
    int rank();

    /** A copy of the Coxeter matrix; 0 entries stand for infinity. */
    int[][] coxeterMatrix();

    E identity();

    /** The simple generators, in order. */
    List<E> generators();

    boolean isFinite();

    /** Display name of generator {@code s}. */
    String generatorName(int s);

    default E generator(int s) {
        GeneratorOutOfRangeException.check(s, rank());
        return generators().get(s - 1);
    }

    /** The product of the generators named by {@code word}, left to right. */
    default E element(int... word) {
        return CoxeterAlgorithms.fromWord(this, word);
    }

    /** The unique element of maximal length; only defined for finite groups. */
    default E longestElement() {
        return CoxeterAlgorithms.longestElement(this);
    }
}
