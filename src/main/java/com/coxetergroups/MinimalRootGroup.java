package com.coxetergroups;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A Coxeter group implemented with the minimal root reflection table. Elements are stored in
 * ShortLex normal form; multiplying on the right by a generator runs through the table in time linear
 * in word length.
 *
 * <pre>
 *   MinimalRootGroup w = MinimalRootGroup.create(new int[][] { { 1, 3 }, { 3, 1 } });
 *   MinimalRootElement st = w.generator(1).multiply(w.generator(2));
 * </pre>
 */
public final class MinimalRootGroup implements CoxeterGroup<MinimalRootElement> {
    private static final Logger logger = LogManager.getLogger(MinimalRootGroup.class);

    private final int[][] coxeterMatrix;
    private final ReflectionTable table;
    private final boolean finite;
    private final GroupOptions options;
    private final MinimalRootElement identity;
    private final List<MinimalRootElement> generators;

    private MinimalRootGroup(int[][] coxeterMatrix, ReflectionTable table, GroupOptions options) {
        this.coxeterMatrix = coxeterMatrix;
        this.table = table;
        this.options = options;
        this.finite = table.describesFiniteGroup();
        this.identity = new MinimalRootElement(this, new byte[0]);
        List<MinimalRootElement> gens = new ArrayList<>(rank());
        for (int s = 1; s <= rank(); s++) gens.add(new MinimalRootElement(this, new byte[] { (byte) s }));
        this.generators = Collections.unmodifiableList(gens);
    }

    /** Builds the group of a Coxeter matrix or a generalised Cartan matrix. */
    public static MinimalRootGroup create(int[][] matrix) {
        return create(matrix, GroupOptions.defaults());
    }

    public static MinimalRootGroup create(int[][] matrix, GroupOptions options) {
        int[][] coxeter = ReflectionTables.toCoxeterMatrix(matrix);
        options.checkRank(coxeter.length);
        ReflectionTable table = ReflectionTables.build(matrix, options.algorithm);
        MinimalRootGroup group = new MinimalRootGroup(coxeter, table, options);
        logger.debug("Created rank {} group with {} minimal roots, finite={}",
                group.rank(), table.rootCount(), group.finite);
        return group;
    }

    @Override public int rank() { return coxeterMatrix.length; }
    @Override public int[][] coxeterMatrix() { return CoxeterMatrices.copy(coxeterMatrix); }
    @Override public MinimalRootElement identity() { return identity; }
    @Override public List<MinimalRootElement> generators() { return generators; }
    @Override public boolean isFinite() { return finite; }
    @Override public String generatorName(int s) {
        GeneratorOutOfRangeException.check(s, rank());
        return options.nameOf(s);
    }

    public ReflectionTable reflectionTable() { return table; }

    @Override public String toString() {
        return "Coxeter group of rank " + rank() + " on " + table.rootCount() + " minimal roots";
    }
}
