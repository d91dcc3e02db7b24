package com.coxetergroups;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Chooses the table builder for an input matrix. */
public final class ReflectionTables {
    private static final Logger logger = LogManager.getLogger(ReflectionTables.class);

    private ReflectionTables() {}

    /** The Coxeter matrix of a GCM or (a copy of) a Coxeter matrix. */
    public static int[][] toCoxeterMatrix(int[][] matrix) {
        if (CoxeterMatrices.isGcm(matrix)) return CoxeterMatrices.gcmToCoxeterMatrix(matrix);
        if (CoxeterMatrices.isCoxeterMatrix(matrix)) return CoxeterMatrices.copy(matrix);
        throw new InvalidMatrixException("Is neither a Coxeter matrix nor a generalised Cartan matrix");
    }

    public static ReflectionTable build(int[][] matrix, GroupOptions.TableAlgorithm algorithm) {
        boolean gcm = CoxeterMatrices.isGcm(matrix);
        if (!gcm && !CoxeterMatrices.isCoxeterMatrix(matrix)) {
            throw new InvalidMatrixException("Is neither a Coxeter matrix nor a generalised Cartan matrix");
        }

        switch (algorithm) {
            case AUTO:
                logger.debug("Using the {} table builder", gcm ? "crystallographic" : "general");
                return gcm ? new GcmReflectionTableBuilder(matrix).build()
                           : new CoxeterReflectionTableBuilder(matrix).build();
            case CRYSTALLOGRAPHIC:
                if (!gcm) throw new InvalidMatrixException("The crystallographic builder needs a generalised Cartan matrix");
                return new GcmReflectionTableBuilder(matrix).build();
            case GENERAL:
                return new CoxeterReflectionTableBuilder(toCoxeterMatrix(matrix)).build();
            default:
                throw new IllegalStateException("Unknown table algorithm: " + algorithm);
        }
    }
}
