package com.coxetergroups;

/** Thrown by queries that are only defined for finite Coxeter groups. */
public class NonFiniteGroupException extends IllegalStateException {
    public NonFiniteGroupException(String message) {
        super(message);
    }
}
