package com.coxetergroups;

/** Thrown when an operation combines elements of two different groups. */
public class MismatchedParentException extends IllegalArgumentException {
    public MismatchedParentException() {
        super("The elements come from different Coxeter groups");
    }

    static void check(CoxeterElement<?> x, CoxeterElement<?> y) {
        if (x.parent() != y.parent()) throw new MismatchedParentException();
    }
}
