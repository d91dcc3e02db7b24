package com.coxetergroups;

/** Thrown when an input matrix is neither a Coxeter matrix nor a generalised Cartan matrix. */
public class InvalidMatrixException extends IllegalArgumentException {
    public InvalidMatrixException(String message) {
        super(message);
    }
}
