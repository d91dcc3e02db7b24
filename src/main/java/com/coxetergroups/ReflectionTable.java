package com.coxetergroups;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * The minimal root reflection table of a Coxeter system.
 *
 * Minimal roots are numbered {@code 1..rootCount()}; roots {@code 1..rank()} are the simple roots,
 * root {@code s} belonging to generator {@code s}, and the rest are numbered in discovery order.
 * The entry for {@code (s, alpha)} is the index of {@code s(alpha)} when that root is again minimal,
 * and the sentinel 0 when {@code s(alpha)} is negative (only for {@code alpha = s}) or no longer minimal.
 */
public final class ReflectionTable {
    private final int rank;
    private final int rootCount;
    private final int[][] entries;   // [s - 1][root - 1], 0 = sentinel

    ReflectionTable(int[][] entries, int rank) {
        this.rank = rank;
        this.rootCount = rank == 0 ? 0 : entries[0].length;
        this.entries = entries;
    }

    public int rank()      { return rank; }
    public int rootCount() { return rootCount; }

    /** The index of {@code s(root)}, or empty when that root is negative or not minimal. */
    public OptionalInt reflect(int s, int root) {
        GeneratorOutOfRangeException.check(s, rank);
        if (root < 1 || root > rootCount) {
            throw new IndexOutOfBoundsException("Root " + root + " outside [1, " + rootCount + "]");
        }
        int r = entries[s - 1][root - 1];
        return r == 0 ? OptionalInt.empty() : OptionalInt.of(r);
    }

    /** Unchecked raw lookup for the word algorithms; 0 is the sentinel. */
    int entry(int s, int root) {
        return entries[s - 1][root - 1];
    }

    /**
     * Number of sentinel entries. There are always {@code rank} of them from the simple roots;
     * any extra one is a minimal root escaping the minimal set, so the group is infinite.
     */
    public int zeroCount() {
        int zeros = 0;
        for (int[] row : entries)
            for (int v : row)
                if (v == 0) zeros++;
        return zeros;
    }

    public boolean describesFiniteGroup() {
        return zeroCount() == rank;
    }

    /** A {@code rank × rootCount} copy, 0 for the sentinel. */
    public int[][] toArray() {
        int[][] out = new int[rank][];
        for (int s = 0; s < rank; s++) out[s] = entries[s].clone();
        return out;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ReflectionTable)) return false;
        ReflectionTable o = (ReflectionTable) obj;
        return rank == o.rank && rootCount == o.rootCount && Arrays.deepEquals(entries, o.entries);
    }

    @Override public int hashCode() { return Arrays.deepHashCode(entries) * 31 + rank; }

    /** One row per generator. */
    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int[] row : entries) {
            for (int j = 0; j < row.length; j++) {
                if (j > 0) sb.append(' ');
                sb.append(row[j]);
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }
}
