package com.coxetergroups;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A Coxeter group whose elements are InverseShortLex words rewritten with the exchange condition
 * directly on the Coxeter matrix. It needs no reflection table for arithmetic, and is much slower than
 * {@link MinimalRootGroup}; it mainly serves as an independent check on it.
 */
public final class ExchangeGroup implements CoxeterGroup<ExchangeElement> {
    private static final Logger logger = LogManager.getLogger(ExchangeGroup.class);

    private final int[][] coxeterMatrix;
    private final GroupOptions options;
    private final ExchangeElement identity;
    private final List<ExchangeElement> generators;
    private final boolean finite;

    private ExchangeGroup(int[][] coxeterMatrix, GroupOptions options, boolean finite) {
        this.coxeterMatrix = coxeterMatrix;
        this.options = options;
        this.finite = finite;
        this.identity = new ExchangeElement(this, new int[0]);
        List<ExchangeElement> gens = new ArrayList<>(rank());
        for (int s = 1; s <= rank(); s++) gens.add(new ExchangeElement(this, new int[] { s }));
        this.generators = Collections.unmodifiableList(gens);
    }

    /** Builds the group of a Coxeter matrix or a generalised Cartan matrix. */
    public static ExchangeGroup create(int[][] matrix) {
        return create(matrix, GroupOptions.defaults());
    }

    public static ExchangeGroup create(int[][] matrix, GroupOptions options) {
        int[][] coxeter = ReflectionTables.toCoxeterMatrix(matrix);
        options.checkRank(coxeter.length);
        // Finiteness is the one question answered through the minimal roots.
        boolean finite = new CoxeterReflectionTableBuilder(coxeter).build().describesFiniteGroup();
        logger.debug("Created exchange group of rank {}, finite={}", coxeter.length, finite);
        return new ExchangeGroup(coxeter, options, finite);
    }

    @Override public int rank() { return coxeterMatrix.length; }
    @Override public int[][] coxeterMatrix() { return CoxeterMatrices.copy(coxeterMatrix); }
    @Override public ExchangeElement identity() { return identity; }
    @Override public List<ExchangeElement> generators() { return generators; }
    @Override public String generatorName(int s) {
        GeneratorOutOfRangeException.check(s, rank());
        return options.nameOf(s);
    }

    @Override public boolean isFinite() { return finite; }

    /** Entry {@code m(s, t)} for 1-based generators. */
    int bond(int s, int t) {
        return coxeterMatrix[s - 1][t - 1];
    }

    @Override public String toString() {
        return "Exchange Coxeter group of rank " + rank();
    }
}
