package com.coxetergroups;

/** Routes the derived operations of {@link CoxeterElement} through {@link CoxeterAlgorithms}. */
public abstract class AbstractCoxeterElement<E extends CoxeterElement<E>> implements CoxeterElement<E> {

    protected abstract E self();

    @Override public E multiply(E other)     { return CoxeterAlgorithms.multiply(self(), other); }
    @Override public E inverse()             { return CoxeterAlgorithms.inverse(self()); }
    @Override public E power(int exponent)   { return CoxeterAlgorithms.power(self(), exponent); }
    @Override public int length()            { return CoxeterAlgorithms.length(self()); }
    @Override public int sign()              { return (length() % 2 == 0) ? 1 : -1; }
    @Override public int[] shortLex()        { return CoxeterAlgorithms.shortLex(self()); }
    @Override public int[] inverseShortLex() { return CoxeterAlgorithms.inverseShortLex(self()); }

    /** Concatenated generator names, {@code <>} for the identity. */
    @Override public String toString() {
        int[] word = shortLex();
        if (word.length == 0) return "<>";
        StringBuilder sb = new StringBuilder();
        for (int s : word) sb.append(parent().generatorName(s));
        return sb.toString();
    }
}
