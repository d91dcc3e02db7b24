package com.coxetergroups;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the minimal root reflection table for an arbitrary Coxeter matrix, following
 * Casselman, <i>Computation in Coxeter groups II: Constructing minimal roots</i>.
 *
 * <p>The Coxeter matrix becomes a symmetric Cartan matrix over {@link QuantumInteger}: 2 on the
 * diagonal, -2 for an infinite bond and {@code -[2]_2m} for a bond of order m. Roots are coefficient
 * vectors in the simple root basis, generated breadth-first. Each root carries a lock set of generators
 * known to send it outside the minimal roots; locks are inherited along reflections. For every
 * unlocked pair the local shape of the diagram around the generator decides between reflecting,
 * locking and skipping.
 *
 * <p>In the Tits representation every coefficient of a minimal root is an integer, an integer multiple
 * of some {@code [2]_2m}, exactly {@code [n]_2m} (dihedral roots only), or {@code a + b[2]_10}. The checks
 * below are arranged so quantum integer arithmetic only ever sees those shapes.
 */
public final class CoxeterReflectionTableBuilder {
    private static final Logger logger = LogManager.getLogger(CoxeterReflectionTableBuilder.class);

    private static final int UNKNOWN = -1;
    private static final QuantumInteger ONE_PLUS_GOLDEN = QuantumInteger.ONE.add(QuantumInteger.of(10, 2));

    enum Decision { SKIP, LOCK, REFLECT }

    private final int[][] m;
    private final int rank;
    private final QuantumInteger[][] cartan;

    private final List<QuantumInteger[]> roots = new ArrayList<>();
    private final Map<List<QuantumInteger>, Integer> rootIdx = new HashMap<>();
    private final List<Integer> depth = new ArrayList<>();
    private final List<int[]> refl = new ArrayList<>();       // per root index - 1, per generator - 1
    private final List<Set<Integer>> locks = new ArrayList<>();

    private TableStats lastStats = null;

    public CoxeterReflectionTableBuilder(int[][] coxeterMatrix) {
        if (!CoxeterMatrices.isCoxeterMatrix(coxeterMatrix)) throw new InvalidMatrixException("Not a Coxeter matrix");
        this.m = CoxeterMatrices.copy(coxeterMatrix);
        this.rank = m.length;
        this.cartan = new QuantumInteger[rank][rank];
        for (int s = 0; s < rank; s++) {
            for (int t = 0; t < rank; t++) {
                int mst = m[s][t];
                cartan[s][t] = mst == 0 ? QuantumInteger.of(-2)
                        : mst == 1 ? QuantumInteger.TWO
                        : QuantumInteger.of(2 * mst, -2);
            }
        }
    }

    public TableStats getLastStats() { return lastStats; }

    public ReflectionTable build() {
        logger.debug("Building general reflection table for rank {}", rank);
        roots.clear();
        rootIdx.clear();
        depth.clear();
        refl.clear();
        locks.clear();

        for (int s = 0; s < rank; s++) {
            QuantumInteger[] simple = new QuantumInteger[rank];
            Arrays.fill(simple, QuantumInteger.ZERO);
            simple[s] = QuantumInteger.ONE;
            register(simple, 1);
            refl.get(s)[s] = 0;
        }

        TableStats stats = new TableStats();
        for (int pos = 0; pos < roots.size(); pos++) {
            for (int s : new ArrayList<>(locks.get(pos))) installLock(s, pos);

            for (int s = 0; s < rank; s++) {
                if (locks.get(pos).contains(s)) continue;
                switch (decide(s, pos)) {
                    case SKIP:
                        break;
                    case LOCK:
                        installLock(s, pos);
                        break;
                    case REFLECT:
                        installReflection(s, pos);
                        break;
                    default:
                        throw new IllegalStateException("Unknown decision");
                }
            }
        }

        int[][] table = new int[rank][roots.size()];
        for (int i = 0; i < roots.size(); i++) {
            for (int s = 0; s < rank; s++) {
                int v = refl.get(i)[s];
                table[s][i] = (v == UNKNOWN) ? 0 : v;
                if (v == 0 && s != i) stats.lockedPairs++;
            }
        }

        stats.minimalRoots = roots.size();
        for (int d : depth) stats.maxDepth = Math.max(stats.maxDepth, d);
        lastStats = stats;
        logger.debug("General table done: {}", stats);
        return new ReflectionTable(table, rank);
    }

    private int register(QuantumInteger[] root, int d) {
        roots.add(root);
        rootIdx.put(Arrays.asList(root), roots.size());
        depth.add(d);
        int[] row = new int[rank];
        Arrays.fill(row, UNKNOWN);
        refl.add(row);
        locks.add(new TreeSet<>());
        return roots.size();
    }

    /** {@code <alpha_s^, root>}; the Cartan matrix is symmetric so roots and coroots agree. */
    private QuantumInteger pairing(int s, QuantumInteger[] root) {
        QuantumInteger sum = QuantumInteger.ZERO;
        for (int t = 0; t < rank; t++) sum = sum.add(cartan[s][t].multiply(root[t]));
        return sum;
    }

    private void installReflection(int s, int pos) {
        QuantumInteger[] root = roots.get(pos);
        QuantumInteger[] reflected = root.clone();
        reflected[s] = root[s].subtract(pairing(s, root));

        Integer idx = rootIdx.get(Arrays.asList(reflected));
        if (idx == null) idx = register(reflected, depth.get(pos) + 1);

        refl.get(pos)[s] = idx;
        refl.get(idx - 1)[s] = pos + 1;
        locks.get(idx - 1).addAll(locks.get(pos));
    }

    private void installLock(int s, int pos) {
        refl.get(pos)[s] = 0;
        locks.get(pos).add(s);
    }

    /**
     * The order of the checks matters: each one assumes all the earlier ones failed.
     */
    Decision decide(int s, int pos) {
        // Already known, since this root is s(some earlier root).
        if (refl.get(pos)[s] != UNKNOWN) return Decision.SKIP;

        QuantumInteger[] root = roots.get(pos);
        List<Integer> supp = new ArrayList<>();
        List<Integer> link = new ArrayList<>();
        for (int t = 0; t < rank; t++) {
            if (root[t].isZero()) continue;
            supp.add(t);
            if (t != s && m[s][t] != 2) link.add(t);
        }
        boolean inSupport = !root[s].isZero();

        // Dihedral root with s in the support: reflect, the arithmetic wraps around correctly.
        if (supp.size() == 2 && inSupport) return Decision.REFLECT;

        if (!inSupport) {
            // s commutes with the whole support, so s(root) = root.
            if (link.isEmpty()) return Decision.REFLECT;

            // The support of a minimal root is a tree without infinite bonds (Cas08, Corollary 8.3).
            for (int t : link) if (m[s][t] == 0) return Decision.LOCK;
            if (link.size() >= 2) return Decision.LOCK;

            // Single neighbour t. Simple bond: the pairing is -root[t], so reflect iff root[t] < 2.
            // Multiple bond: [2] and root[t] are both at least sqrt(2) unless root[t] = 1.
            int t = link.get(0);
            if (m[s][t] == 3) return root[t].inOpenIntervalTwo() ? Decision.REFLECT : Decision.LOCK;
            return root[t].equals(QuantumInteger.ONE) ? Decision.REFLECT : Decision.LOCK;
        }

        // Simple roots have their tables filled in from the start, and dihedral roots were handled above.
        if (supp.size() < 3) throw new IllegalStateException("Length of support is " + supp.size() + ", it should be >= 3.");

        if (root[s].equals(QuantumInteger.ONE)) {
            // Four or more neighbours push the pairing to -2 or below.
            if (link.size() >= 4) return Decision.LOCK;

            // Three neighbours: only all-simple bonds with coefficient 1 survive.
            if (link.size() == 3) {
                for (int t : link) {
                    if (m[s][t] != 3 || !root[t].equals(QuantumInteger.ONE)) return Decision.LOCK;
                }
                return Decision.REFLECT;
            }

            // Two neighbours t, u with m_st <= m_su (Cas08, 11.3 and 11.4).
            if (link.size() == 2) {
                List<Integer> sorted = new ArrayList<>(link);
                sorted.sort(Comparator.comparingInt(x -> m[s][x]));
                int t = sorted.get(0), u = sorted.get(1);

                // Two multiple bonds: root[t], root[u] are already at least sqrt(2).
                if (m[s][t] != 3) {
                    if (root[t].equals(QuantumInteger.ONE) || root[u].equals(QuantumInteger.ONE)) {
                        throw new IllegalStateException("Unexpected root coefficients at " + Arrays.toString(root));
                    }
                    return Decision.LOCK;
                }

                // st simple, su multiple: only m_su in {4, 5} with root[t] = 1 and root[u] = [2].
                if (m[s][u] != 3) {
                    int msu = m[s][u];
                    if (root[t].equals(QuantumInteger.ONE) && 4 <= msu && msu <= 5
                            && root[u].equals(QuantumInteger.of(2 * msu, 2))) {
                        return Decision.REFLECT;
                    }
                    return Decision.LOCK;
                }

                // Both simple: the ends must be {1}, {1, 2} or {1, 1 + [2]_10}.
                Set<QuantumInteger> actual = new HashSet<>(Arrays.asList(root[t], root[u]));
                List<Set<QuantumInteger>> allowed = Arrays.asList(
                        Collections.singleton(QuantumInteger.ONE),
                        new HashSet<>(Arrays.asList(QuantumInteger.ONE, QuantumInteger.TWO)),
                        new HashSet<>(Arrays.asList(QuantumInteger.ONE, ONE_PLUS_GOLDEN)));
                for (Set<QuantumInteger> a : allowed) {
                    if (a.containsAll(actual)) return Decision.REFLECT;
                }
                return Decision.LOCK;
            }

            // One neighbour over a multiple bond. A simple bond falls through to the pairing test.
            if (link.size() == 1) {
                int t = link.get(0);
                int mst = m[s][t];
                if (mst > 3) {
                    if (root[t].equals(QuantumInteger.ONE)) {
                        throw new IllegalStateException("Encountered unexpected root with coefficient 1 at " + Arrays.toString(root));
                    }
                    // 2 - [2][2] = 1 - [3] is always > -2; 2 - [2][3] = 2 - [2] - [4] only for m <= 6.
                    if (root[t].equals(QuantumInteger.of(2 * mst, 2))
                            || (root[t].equals(QuantumInteger.of(2 * mst, 3)) && mst <= 6)) {
                        return Decision.REFLECT;
                    }
                }
            }
        }

        return pairing(s, root).inOpenIntervalTwo() ? Decision.REFLECT : Decision.LOCK;
    }
}
