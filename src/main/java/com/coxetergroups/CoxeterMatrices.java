package com.coxetergroups;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Predicates and conversions for Coxeter matrices and generalised Cartan matrices (GCMs).
 * Matrices are plain {@code int[][]} indexed from zero; generator {@code s} lives in row {@code s - 1}.
 *
 * A Coxeter matrix is square and symmetric, with 1 on the diagonal and off-diagonal entries in
 * {0} ∪ {2, 3, 4, ...}, where 0 stands for an infinite bond.
 */
public final class CoxeterMatrices {

    private static final Pattern TYPE_NAME = Pattern.compile("([A-I])(~?)(\\d+)");

    private CoxeterMatrices() {}

    public static boolean isCoxeterMatrix(int[][] m) {
        if (!isSquare(m)) return false;
        int n = m.length;
        for (int i = 0; i < n; i++) {
            if (m[i][i] != 1) return false;
            for (int j = 0; j < n; j++) {
                if (i == j) continue;
                if (m[i][j] != m[j][i]) return false;
                if (m[i][j] != 0 && m[i][j] < 2) return false;
            }
        }
        return true;
    }

    /**
     * A GCM has 2 on the diagonal, non-positive entries elsewhere, and
     * {@code a[i][j] == 0} exactly when {@code a[j][i] == 0}.
     */
    public static boolean isGcm(int[][] a) {
        if (!isSquare(a)) return false;
        int n = a.length;
        for (int i = 0; i < n; i++) {
            if (a[i][i] != 2) return false;
            for (int j = 0; j < n; j++) {
                if (i == j) continue;
                if (a[i][j] > 0) return false;
                if ((a[i][j] == 0) != (a[j][i] == 0)) return false;
            }
        }
        return true;
    }

    /**
     * Replaces each pair by the product {@code a[i][j] * a[j][i]} and maps
     * 0, 1, 2, 3, (anything else) to 2, 3, 4, 6, 0; the diagonal becomes 1.
     */
    public static int[][] gcmToCoxeterMatrix(int[][] gcm) {
        if (!isGcm(gcm)) throw new InvalidMatrixException("Is not a generalised Cartan matrix");
        int n = gcm.length;
        int[][] m = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m[i][j] = (i == j) ? 1 : bondOrder((long) gcm[i][j] * gcm[j][i]);
            }
        }
        return m;
    }

    // product of two non-positive ints, so never negative and exact in a long
    private static int bondOrder(long product) {
        if (product == 0) return 2;
        if (product == 1) return 3;
        if (product == 2) return 4;
        if (product == 3) return 6;
        return 0;
    }

    /** Deep copy; rows are never shared with the caller. */
    public static int[][] copy(int[][] m) {
        int[][] out = new int[m.length][];
        for (int i = 0; i < m.length; i++) out[i] = m[i].clone();
        return out;
    }

    /**
     * Builds the Coxeter matrix for a type name such as {@code "A4"}, {@code "E8"}, {@code "H3"},
     * {@code "I7"} (the dihedral group of order 14) or an affine name like {@code "D~5"}.
     * Vertices are numbered along the diagrams of Kac, <i>Infinite Dimensional Lie Algebras</i>.
     */
    public static int[][] fromTypeName(String name) {
        Matcher mt = TYPE_NAME.matcher(name.trim().toUpperCase(Locale.ROOT));
        if (!mt.matches()) throw new IllegalArgumentException("Unrecognized group type " + name);
        char letter = mt.group(1).charAt(0);
        boolean affine = !mt.group(2).isEmpty();
        int n = Integer.parseInt(mt.group(3));
        return affine ? affineType(letter, n, name) : finiteType(letter, n, name);
    }

    private static int[][] finiteType(char letter, int n, String name) {
        int[][] m;
        switch (letter) {
            case 'A':
                return path(n);
            case 'B':
            case 'C':
                requireAtLeast(n, 2, name);
                m = path(n);
                bond(m, n - 1, n, 4);
                return m;
            case 'D':
                requireAtLeast(n, 4, name);
                m = path(n);
                bond(m, n - 1, n, 2);
                bond(m, n - 2, n, 3);
                return m;
            case 'E':
                if (n < 6 || n > 8) throw new IllegalArgumentException("Type E needs rank 6, 7 or 8: " + name);
                m = path(n);
                bond(m, n - 1, n, 2);
                bond(m, n == 8 ? 5 : 3, n, 3);
                return m;
            case 'F':
                if (n != 4) throw new IllegalArgumentException("Type F only exists in rank 4: " + name);
                m = path(4);
                bond(m, 2, 3, 4);
                return m;
            case 'G':
                if (n != 2) throw new IllegalArgumentException("Type G only exists in rank 2: " + name);
                m = path(2);
                bond(m, 1, 2, 6);
                return m;
            case 'H':
                if (n < 2 || n > 4) throw new IllegalArgumentException("Type H needs rank 2, 3 or 4: " + name);
                m = path(n);
                bond(m, 1, 2, 5);
                return m;
            case 'I':
                requireAtLeast(n, 2, name);
                m = path(2);
                bond(m, 1, 2, n);
                return m;
            default:
                throw new IllegalArgumentException("Unrecognized group type " + name);
        }
    }

    private static int[][] affineType(char letter, int n, String name) {
        int[][] m;
        switch (letter) {
            case 'A':
                requireAtLeast(n, 1, name);
                m = path(n + 1);
                bond(m, 1, n + 1, n == 1 ? 0 : 3);
                return m;
            case 'B':
                requireAtLeast(n, 3, name);
                m = path(n + 1);
                bond(m, n, n + 1, 4);
                bond(m, 1, 2, 2);
                bond(m, 1, 3, 3);
                return m;
            case 'C':
                requireAtLeast(n, 2, name);
                m = path(n + 1);
                bond(m, 1, 2, 4);
                bond(m, n, n + 1, 4);
                return m;
            case 'D':
                requireAtLeast(n, 4, name);
                m = finiteType('D', n + 1, name);
                bond(m, 1, 2, 2);
                bond(m, 1, 3, 3);
                return m;
            case 'E':
                if (n < 6 || n > 8) throw new IllegalArgumentException("Type E~ needs rank 6, 7 or 8: " + name);
                m = path(n + 1);
                if (n == 6) {
                    bond(m, 5, 6, 2);
                    bond(m, 3, 6, 3);
                } else if (n == 7) {
                    bond(m, 7, 8, 2);
                    bond(m, 4, 8, 3);
                } else {
                    bond(m, 8, 9, 2);
                    bond(m, 6, 9, 3);
                }
                return m;
            case 'F':
                if (n != 4) throw new IllegalArgumentException("Type F~ only exists in rank 4: " + name);
                m = path(5);
                bond(m, 3, 4, 4);
                return m;
            case 'G':
                if (n != 2) throw new IllegalArgumentException("Type G~ only exists in rank 2: " + name);
                m = path(3);
                bond(m, 2, 3, 6);
                return m;
            default:
                throw new IllegalArgumentException("No affine type for " + name);
        }
    }

    /** Type A_n: a path with simple bonds. */
    private static int[][] path(int n) {
        int[][] m = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m[i][j] = (i == j) ? 1 : (Math.abs(i - j) == 1 ? 3 : 2);
            }
        }
        return m;
    }

    // 1-based vertices
    private static void bond(int[][] m, int s, int t, int order) {
        m[s - 1][t - 1] = order;
        m[t - 1][s - 1] = order;
    }

    private static void requireAtLeast(int n, int min, String name) {
        if (n < min) throw new IllegalArgumentException("Cannot create matrix of this size: " + name);
    }

    private static boolean isSquare(int[][] m) {
        if (m == null) return false;
        for (int[] row : m) {
            if (row == null || row.length != m.length) return false;
        }
        return true;
    }
}
