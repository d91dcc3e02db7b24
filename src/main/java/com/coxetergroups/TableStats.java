package com.coxetergroups;

/** Counters collected while building a {@link ReflectionTable}. */
public final class TableStats {
    public int minimalRoots;
    public int lockedPairs;
    public int maxDepth;

    @Override
    public String toString() {
        return "*Totals: minimal_roots=" + minimalRoots +
                " locked_pairs=" + lockedPairs +
                " max_root_depth=" + maxDepth;
    }
}
