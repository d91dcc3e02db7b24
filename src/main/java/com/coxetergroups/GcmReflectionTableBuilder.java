package com.coxetergroups;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the minimal root reflection table from a generalised Cartan matrix.
 *
 * Roots are kept in the simple root basis and coroots in the simple coroot basis, both starting out as
 * coordinate vectors, and new roots are generated breadth-first by reflecting wherever possible.
 * Since everything is an integer the only question per pair is whether {@code s(beta)} stays minimal,
 * and that fails exactly when {@code <beta^, alpha_s><alpha_s^, beta> >= 4}, i.e. when {@code s} and the
 * reflection of {@code beta} generate an infinite dihedral group.
 */
public final class GcmReflectionTableBuilder {
    private static final Logger logger = LogManager.getLogger(GcmReflectionTableBuilder.class);

    private static final int UNKNOWN = -1;

    private final int[][] gcm;
    private final int n;
    private TableStats lastStats = null;

    public GcmReflectionTableBuilder(int[][] gcm) {
        if (!CoxeterMatrices.isGcm(gcm)) throw new InvalidMatrixException("Not a generalised Cartan matrix");
        this.gcm = CoxeterMatrices.copy(gcm);
        this.n = gcm.length;
    }

    public TableStats getLastStats() { return lastStats; }

    public ReflectionTable build() {
        logger.debug("Building crystallographic reflection table for rank {}", n);
        TableStats stats = new TableStats();

        List<int[]> roots = new ArrayList<>();
        List<int[]> coroots = new ArrayList<>();
        List<Integer> depth = new ArrayList<>();
        Map<String, Integer> rootIdx = new HashMap<>();
        // refl.get(i)[s] for root index i + 1 and generator s + 1
        List<int[]> refl = new ArrayList<>();

        for (int s = 0; s < n; s++) {
            int[] unit = new int[n];
            unit[s] = 1;
            roots.add(unit);
            coroots.add(unit.clone());
            depth.add(1);
            rootIdx.put(key(unit), s + 1);
            refl.add(unknownRow());
            refl.get(s)[s] = 0;   // s(alpha_s) = -alpha_s
        }

        for (int i = 0; i < roots.size(); i++) {
            int[] root = roots.get(i);
            int[] coroot = coroots.get(i);
            for (int s = 0; s < n; s++) {
                // Already known from the root which first produced this one.
                if (refl.get(i)[s] != UNKNOWN) continue;

                long pairing = 0, copairing = 0;
                for (int j = 0; j < n; j++) {
                    pairing += (long) gcm[s][j] * root[j];
                    copairing += (long) coroot[j] * gcm[j][s];
                }
                if (productAtLeastFour(pairing, copairing)) {
                    refl.get(i)[s] = 0;
                    stats.lockedPairs++;
                    continue;
                }

                int[] newRoot = root.clone();
                newRoot[s] -= Math.toIntExact(pairing);
                String k = key(newRoot);
                Integer si = rootIdx.get(k);
                if (si == null) {
                    int[] newCoroot = coroot.clone();
                    newCoroot[s] -= Math.toIntExact(copairing);
                    roots.add(newRoot);
                    coroots.add(newCoroot);
                    depth.add(depth.get(i) + 1);
                    refl.add(unknownRow());
                    si = roots.size();
                    rootIdx.put(k, si);
                }

                refl.get(i)[s] = si;
                refl.get(si - 1)[s] = i + 1;
            }
        }

        // Every pair should be decided by now; an undecided one still reads as the sentinel.
        int[][] table = new int[n][roots.size()];
        for (int i = 0; i < roots.size(); i++) {
            for (int s = 0; s < n; s++) {
                int v = refl.get(i)[s];
                table[s][i] = (v == UNKNOWN) ? 0 : v;
            }
        }

        stats.minimalRoots = roots.size();
        for (int d : depth) stats.maxDepth = Math.max(stats.maxDepth, d);
        lastStats = stats;
        logger.debug("Crystallographic table done: {}", stats);
        return new ReflectionTable(table, n);
    }

    /** {@code a * b >= 4}, decided without forming the product. */
    static boolean productAtLeastFour(long a, long b) {
        if (a == 0 || b == 0 || (a > 0) != (b > 0)) return false;
        a = Math.abs(a);
        b = Math.abs(b);
        return a >= 4 || b >= 4 || a * b >= 4;
    }

    private int[] unknownRow() {
        int[] row = new int[n];
        Arrays.fill(row, UNKNOWN);
        return row;
    }

    private static String key(int[] v) {
        return Arrays.toString(v);
    }
}
