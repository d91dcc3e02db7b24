package com.coxetergroups;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable integer combination of quantum integers {@code [n]_q = (z^n - z^-n) / (z - z^-1)},
 * where {@code z = exp(2 pi i / q)}. So {@code [0] = 0}, {@code [1] = 1}, {@code [2] = 2 cos(2 pi / q)}.
 *
 * <p>Indices are reduced with {@code [n + q] = [n]}, {@code [q - n] = -[n]} and, for even q,
 * {@code [q/2 - n] = [n]}, which brings every index into {@code [1, q/4]}. A value whose only
 * surviving term is {@code [1]} collapses to a plain integer with {@code q = 1}.
 *
 * <p>Equality is structural. It agrees with equality of the underlying numbers for {@code q = 1}
 * and for {@code q = 2m} with {@code m} in {2, ..., 6}; the minimal root construction never needs
 * more than that. Arithmetic between two non-integer values with different q is refused.
 */
public final class QuantumInteger {
    public static final QuantumInteger ZERO = new QuantumInteger(1, Collections.<Integer, Integer>emptySortedMap());
    public static final QuantumInteger ONE  = of(1);
    public static final QuantumInteger TWO  = of(2);

    private final int q;
    private final SortedMap<Integer, Integer> terms;   // reduced index -> nonzero coefficient

    private QuantumInteger(int q, SortedMap<Integer, Integer> terms) {
        this.q = q;
        this.terms = terms;
    }

    /** The plain integer {@code value}. */
    public static QuantumInteger of(int value) {
        return fold(1, Collections.singletonList(new int[] { 1, value }));
    }

    /** The quantum integer {@code [n]_q}. */
    public static QuantumInteger of(int q, int n) {
        return fold(q, Collections.singletonList(new int[] { n, 1 }));
    }

    /** The sum of {@code c [n]_q} over the given {@code {n, c}} pairs. */
    public static QuantumInteger of(int q, int[]... pairs) {
        List<int[]> list = new ArrayList<>(pairs.length);
        for (int[] p : pairs) {
            if (p.length != 2) throw new IllegalArgumentException("Expected {n, c} pairs");
            list.add(p);
        }
        return fold(q, list);
    }

    private static QuantumInteger fold(int q, List<int[]> pairs) {
        if (q < 1) throw new IllegalArgumentException("q = " + q + " should be positive");
        TreeMap<Integer, Integer> acc = new TreeMap<>();
        for (int[] p : pairs) {
            int[] r = reduce(q, p[0], p[1]);
            // [0] = 0
            if (r[0] != 0) acc.merge(r[0], r[1], Integer::sum);
        }
        acc.values().removeIf(c -> c == 0);

        if (acc.isEmpty()) return ZERO;
        if (acc.size() == 1 && acc.containsKey(1)) {
            TreeMap<Integer, Integer> single = new TreeMap<>();
            single.put(1, acc.get(1));
            return new QuantumInteger(1, Collections.unmodifiableSortedMap(single));
        }
        return new QuantumInteger(q, Collections.unmodifiableSortedMap(acc));
    }

    /** Rewrites {@code c [n]_q} as an equal {@code c' [n']_q} with n' as small as possible. */
    static int[] reduce(int q, int n, int c) {
        if (n < 0) { n = -n; c = -c; }

        // [n]_1 = n
        if (q == 1) return new int[] { 1, n * c };

        // [n]_2 = (-1)^(n-1) n
        if (q == 2) return new int[] { 1, (n % 2 == 1) ? n * c : -n * c };

        n = n % q;

        // [q - n] = -[n]
        if (2 * n >= q) { n = q - n; c = -c; }

        // symmetry about q/4 for even q
        if (q % 2 == 0 && 4 * n > q) n = q / 2 - n;

        // [3]_12 = 2
        if (q == 12 && n == 3) { n = 1; c = 2 * c; }

        return new int[] { n, c };
    }

    /** Indices m with {@code [n][m'] = sum of [m]}, e.g. {@code [n][2] = [n-1] + [n+1]}. */
    static int[] productIndices(int n, int m) {
        if (n < 0 || m < 0) throw new IllegalArgumentException("n, m must be >= 0.");
        if (n > m) { int t = n; n = m; m = t; }
        int[] out = new int[n];
        for (int k = 0; k < n; k++) out[k] = m - n + 1 + 2 * k;
        return out;
    }

    public int q() { return q; }

    /** Reduced index to coefficient, ascending by index. Empty for zero. */
    public SortedMap<Integer, Integer> terms() { return terms; }

    public boolean isInteger() { return q == 1; }
    public boolean isZero()    { return terms.isEmpty(); }

    public int intValue() {
        if (!isInteger()) throw new ArithmeticException(this + " is not an integer");
        return terms.isEmpty() ? 0 : terms.get(1);
    }

    // ---- arithmetic ----

    public QuantumInteger add(QuantumInteger o) {
        int r = commonQ(o, "add");
        List<int[]> pairs = pairs(terms, 1);
        pairs.addAll(pairs(o.terms, 1));
        return fold(r, pairs);
    }

    public QuantumInteger subtract(QuantumInteger o) {
        int r = commonQ(o, "subtract");
        List<int[]> pairs = pairs(terms, 1);
        pairs.addAll(pairs(o.terms, -1));
        return fold(r, pairs);
    }

    public QuantumInteger multiply(QuantumInteger o) {
        int r = commonQ(o, "multiply");
        List<int[]> pairs = new ArrayList<>();
        for (Map.Entry<Integer, Integer> x : terms.entrySet()) {
            for (Map.Entry<Integer, Integer> y : o.terms.entrySet()) {
                int c = x.getValue() * y.getValue();
                for (int nm : productIndices(x.getKey(), y.getKey())) pairs.add(new int[] { nm, c });
            }
        }
        return fold(r, pairs);
    }

    public QuantumInteger negate() {
        return fold(q, pairs(terms, -1));
    }

    private int commonQ(QuantumInteger o, String op) {
        if (q != 1 && o.q != 1 && q != o.q) {
            throw new QuantumIntegerException(QuantumIntegerException.Kind.MIXED_CYCLOTOMY,
                    "Cannot " + op + " quantum integers with different q: " + this + " and " + o);
        }
        return Math.max(q, o.q);
    }

    private static List<int[]> pairs(SortedMap<Integer, Integer> terms, int sign) {
        List<int[]> out = new ArrayList<>(terms.size() + 2);
        for (Map.Entry<Integer, Integer> e : terms.entrySet()) out.add(new int[] { e.getKey(), sign * e.getValue() });
        return out;
    }

    /**
     * Decides whether this value lies strictly between -2 and 2. Exact for
     * <ul>
     *   <li>plain integers,</li>
     *   <li>a single term {@code c [n]_q} (only {@code [2]}, and {@code [3]} for q at most 10, are inside),</li>
     *   <li>two or more terms all of the same sign (never inside),</li>
     *   <li>{@code ±([1] - [3])_q = ∓2 cos(2 pi / m)} and {@code ±([1] - [2])_10}, both inside.</li>
     * </ul>
     * Anything else throws a {@link QuantumIntegerException} of kind {@code UNSUPPORTED_FORM}.
     */
    public boolean inOpenIntervalTwo() {
        if (q == 1) {
            int v = intValue();
            return -2 < v && v < 2;
        }

        if (q % 2 != 0 || q < 8) throw unsupported();

        // flip so the lowest-index coefficient is positive
        int sign = terms.get(terms.firstKey()) > 0 ? 1 : -1;
        List<int[]> cs = pairs(terms, sign);

        if (cs.size() == 1) {
            int n = cs.get(0)[0], c = cs.get(0)[1];
            return (n == 2 && c == 1) || (n == 3 && c == 1 && q <= 10);
        }

        boolean allPositive = true;
        for (int[] p : cs) if (p[1] <= 0) { allPositive = false; break; }
        if (allPositive) return false;

        if (cs.size() == 2 && matches(cs, 1, 1, 3, -1)) return true;
        if (q == 10 && cs.size() == 2 && matches(cs, 1, 1, 2, -1)) return true;

        throw unsupported();
    }

    private static boolean matches(List<int[]> cs, int n0, int c0, int n1, int c1) {
        return cs.get(0)[0] == n0 && cs.get(0)[1] == c0 && cs.get(1)[0] == n1 && cs.get(1)[1] == c1;
    }

    private QuantumIntegerException unsupported() {
        return new QuantumIntegerException(QuantumIntegerException.Kind.UNSUPPORTED_FORM,
                "Cannot check if " + this + " is in the range (-2, 2)");
    }

    // ---- Object ----

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QuantumInteger)) return false;
        QuantumInteger o = (QuantumInteger) obj;
        return q == o.q && terms.equals(o.terms);
    }

    @Override public int hashCode() { return q * 31 + terms.hashCode(); }

    /** Integers print as integers, everything else as a signed sum like {@code [1]_10 - [2]_10}. */
    @Override public String toString() {
        if (isInteger()) return Integer.toString(intValue());
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Integer> e : terms.entrySet()) {
            int c = e.getValue();
            if (sb.length() == 0) {
                if (c < 0) sb.append('-');
            } else {
                sb.append(c < 0 ? " - " : " + ");
            }
            if (Math.abs(c) != 1) sb.append(Math.abs(c));
            sb.append('[').append(e.getKey()).append("]_").append(q);
        }
        return sb.toString();
    }
}
