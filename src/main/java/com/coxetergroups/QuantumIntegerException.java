package com.coxetergroups;

/**
 * Internal arithmetic failure of {@link QuantumInteger}. Seeing one of these means the
 * minimal root case analysis handed the arithmetic a value outside the class it supports.
 */
public class QuantumIntegerException extends IllegalStateException {
    public enum Kind { MIXED_CYCLOTOMY, UNSUPPORTED_FORM }

    private final Kind kind;

    public QuantumIntegerException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
