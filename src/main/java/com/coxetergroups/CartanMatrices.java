package com.coxetergroups;

/**
 * Generalised Cartan matrices of the finite crystallographic types.
 * Convention: {@code gcm[i][j] = <alpha_i^, alpha_j>}, vertices numbered from 1 in the comments.
 */
public final class CartanMatrices {

    private CartanMatrices() {}

    /** Type A_n for n >= 0: a path with -1 on both off-diagonals. */
    public static int[][] typeA(int rank) {
        if (rank < 0) throw new IllegalArgumentException("Negative rank " + rank);
        int[][] gcm = new int[rank][rank];
        for (int i = 0; i < rank; i++) {
            for (int j = 0; j < rank; j++) {
                gcm[i][j] = (i == j) ? 2 : (Math.abs(i - j) == 1 ? -1 : 0);
            }
        }
        return gcm;
    }

    /** Type B_n for n >= 2, with the double bond between vertices 1 and 2. */
    public static int[][] typeB(int rank) {
        if (rank < 2) throw new IllegalArgumentException("The rank " + rank + " must be at least 2 to construct type B.");
        int[][] gcm = typeA(rank);
        gcm[0][1] = -2;
        return gcm;
    }

    /** Type C_n for n >= 2, the transpose of B_n. */
    public static int[][] typeC(int rank) {
        return transpose(typeB(rank));
    }

    /** Type D_n for n >= 2. Vertices 1 and 2 both attach to 3, then 3 - 4 - ... - n is a path. */
    public static int[][] typeD(int rank) {
        if (rank < 2) throw new IllegalArgumentException("The rank " + rank + " must be at least 2 to construct type D.");
        int[][] gcm = new int[rank][rank];
        for (int i = 0; i < rank; i++) gcm[i][i] = 2;
        if (rank >= 3) {
            link(gcm, 1, 3);
            link(gcm, 2, 3);
        }
        for (int i = 3; i < rank; i++) link(gcm, i, i + 1);
        return gcm;
    }

    /** Type E_n for 6 <= n <= 8: A_{n-1} with vertex n attached to vertex 3. */
    public static int[][] typeE(int rank) {
        if (rank < 6 || rank > 8) throw new IllegalArgumentException("The rank " + rank + " must be between 6 and 8 inclusive for type E");
        int[][] gcm = new int[rank][rank];
        int[][] a = typeA(rank - 1);
        for (int i = 0; i < rank - 1; i++) System.arraycopy(a[i], 0, gcm[i], 0, rank - 1);
        gcm[rank - 1][rank - 1] = 2;
        link(gcm, 3, rank);
        return gcm;
    }

    public static int[][] typeF4() {
        int[][] gcm = typeA(4);
        gcm[1][2] = -2;
        return gcm;
    }

    public static int[][] typeG2() {
        return new int[][] {
                { 2, -3 },
                { -1, 2 }
        };
    }

    public static int[][] transpose(int[][] a) {
        int n = a.length;
        int[][] t = new int[n][n];
        for (int i = 0; i < n; i++)
            for (int j = 0; j < n; j++)
                t[j][i] = a[i][j];
        return t;
    }

    private static void link(int[][] gcm, int s, int t) {
        gcm[s - 1][t - 1] = -1;
        gcm[t - 1][s - 1] = -1;
    }
}
