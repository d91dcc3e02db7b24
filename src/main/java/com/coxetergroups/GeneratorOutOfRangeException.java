package com.coxetergroups;

/** Thrown when a generator index lies outside {@code [1, rank]}. */
public class GeneratorOutOfRangeException extends IllegalArgumentException {
    private final int generator;
    private final int rank;

    public GeneratorOutOfRangeException(int generator, int rank) {
        super(generator + " is not a generator in the range [1, " + rank + "]");
        this.generator = generator;
        this.rank = rank;
    }

    public int generator() { return generator; }
    public int rank() { return rank; }

    /** Throws unless {@code 1 <= s <= rank}. */
    static void check(int s, int rank) {
        if (s < 1 || s > rank) throw new GeneratorOutOfRangeException(s, rank);
    }
}
