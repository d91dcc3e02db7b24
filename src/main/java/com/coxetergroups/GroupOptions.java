package com.coxetergroups;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Construction settings for Coxeter groups. Immutable; see {@link Builder}. */
public final class GroupOptions {
    public enum TableAlgorithm {
        AUTO,               // GCM input -> crystallographic, Coxeter matrix input -> general
        CRYSTALLOGRAPHIC,   // GCM input only
        GENERAL             // any input, GCMs are converted first
    }

    /** Word letters are stored as unsigned bytes. */
    public static final int RANK_LIMIT = 255;

    public final TableAlgorithm algorithm;
    public final int maxRank;                    // checked before any table is built
    public final List<String> generatorNames;    // empty = "<1>", "<2>", ...

    private GroupOptions(Builder b) {
        this.algorithm = b.algorithm;
        this.maxRank = b.maxRank;
        this.generatorNames = Collections.unmodifiableList(new ArrayList<>(b.generatorNames));
    }

    public static GroupOptions defaults() {
        return new Builder().build();
    }

    /** Throws unless a group of this rank may be built. */
    void checkRank(int rank) {
        if (rank > maxRank) {
            throw new InvalidMatrixException("Rank " + rank + " exceeds the configured limit " + maxRank);
        }
        if (!generatorNames.isEmpty() && generatorNames.size() != rank) {
            throw new IllegalArgumentException("For a matrix of rank " + rank + ", there should be "
                    + rank + " generator names, got " + generatorNames.size());
        }
    }

    String nameOf(int s) {
        return generatorNames.isEmpty() ? "<" + s + ">" : generatorNames.get(s - 1);
    }

    public static final class Builder {
        private TableAlgorithm algorithm = TableAlgorithm.AUTO;
        private int maxRank = RANK_LIMIT;
        private final List<String> generatorNames = new ArrayList<>();

        public Builder algorithm(TableAlgorithm a){ this.algorithm = a; return this; }
        public Builder maxRank(int v){ this.maxRank = Math.max(0, Math.min(RANK_LIMIT, v)); return this; }
        public Builder generatorNames(List<String> names){
            this.generatorNames.clear();
            this.generatorNames.addAll(names);
            return this;
        }
        public GroupOptions build(){ return new GroupOptions(this); }
    }
}
