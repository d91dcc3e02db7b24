package com.coxetergroups;

import java.util.Arrays;

/**
 * An element of an {@link ExchangeGroup}, stored as its InverseShortLex form: the reduced word which is
 * lexicographically least when read from right to left. Left multiplication by a generator rewrites the
 * word with the exchange condition; everything else comes from the generic algorithms.
 */
public final class ExchangeElement extends AbstractCoxeterElement<ExchangeElement> {

    private final ExchangeGroup group;
    private final int[] word;

    ExchangeElement(ExchangeGroup group, int[] word) {
        this.group = group;
        this.word = word;
    }

    @Override protected ExchangeElement self() { return this; }

    @Override public ExchangeGroup parent() { return group; }
    @Override public boolean isIdentity() { return word.length == 0; }
    @Override public int length() { return word.length; }
    @Override public int[] inverseShortLex() { return word.clone(); }

    @Override public boolean isLeftDescent(int s) {
        return leftMultiply(s).word.length < word.length;
    }

    @Override public boolean isRightDescent(int s) {
        return rightMultiply(s).word.length < word.length;
    }

    @Override public ExchangeElement leftMultiply(int s) {
        GeneratorOutOfRangeException.check(s, group.rank());
        return new ExchangeElement(group, leftMultiplyWord(group, s, word));
    }

    @Override public ExchangeElement rightMultiply(int s) {
        GeneratorOutOfRangeException.check(s, group.rank());
        int[] result = { s };
        for (int i = word.length - 1; i >= 0; i--) result = leftMultiplyWord(group, word[i], result);
        return new ExchangeElement(group, result);
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ExchangeElement)) return false;
        ExchangeElement o = (ExchangeElement) obj;
        return group == o.group && Arrays.equals(word, o.word);
    }

    @Override public int hashCode() { return Arrays.hashCode(word); }

    /**
     * The InverseShortLex form of {@code s w}. Scans w from the left, and at each letter which is at least
     * the current bound asks {@link #exchange} whether s can be pushed through the prefix read so far.
     * Positions in the comments are 1-based.
     */
    static int[] leftMultiplyWord(ExchangeGroup g, int s, int[] w) {
        int n = w.length;
        int l = 1;
        int r = 1;
        int sigma = s;
        while (r <= n) {
            int c = w[r - 1];
            r++;
            if (c >= sigma) {
                sigma = c;
                int t = exchange(g, s, Arrays.copyOfRange(w, l - 1, r - 1));
                if (t != 0) {
                    if (s == w[l - 1]) return remove(w, l - 1);
                    s = t;
                    l = r;
                    sigma = t;
                }
            }
        }
        return insert(w, l - 1, s);
    }

    /**
     * Given a segment {@code w} of a normal form, returns the generator t with {@code s w = w' t} for a
     * rewritten segment w', or 0 when s does not pass through {@code w}.
     */
    static int exchange(ExchangeGroup g, int s, int[] w) {
        int n = w.length;
        int w1 = w[0];
        if (n == 1) {
            if (w1 == s) return s;
            if (w1 < s || g.bond(w1, s) != 2) return 0;
            return s;
        }

        // w alternates between w1 and s: the braid relation of m(w1, s)
        if (n == g.bond(w1, s) - 1) {
            int i = 2;
            while (i <= n && (w[i - 1] == s || w[i - 1] == w1)) i++;
            if (i == n + 1 && w[n - 1] > w[n - 2]) return w[n - 2];
            return 0;
        }

        int[] sy = new int[n];
        sy[0] = s;
        System.arraycopy(w, 0, sy, 1, n - 1);
        int[] z = leftMultiplyWord(g, w1, sy);
        if (z.length < n) {
            int m = 1;
            while (m < z.length && z[m] == sy[m]) m++;

            // omega = w1 s w[1..m-1] w[m+1..n]
            int[] prefix = new int[m + 1];
            prefix[0] = w1;
            prefix[1] = s;
            System.arraycopy(w, 0, prefix, 2, m - 1);
            int[] omega = Arrays.copyOfRange(w, m, n);
            for (int i = prefix.length - 1; i >= 0; i--) omega = leftMultiplyWord(g, prefix[i], omega);

            if (omega.length == 0) return 0;
            int last = omega[omega.length - 1];
            for (int t : omega) {
                if (t > last) return last;
            }
        }
        return 0;
    }

    private static int[] remove(int[] w, int at) {
        int[] out = new int[w.length - 1];
        System.arraycopy(w, 0, out, 0, at);
        System.arraycopy(w, at + 1, out, at, w.length - at - 1);
        return out;
    }

    private static int[] insert(int[] w, int at, int letter) {
        int[] out = new int[w.length + 1];
        System.arraycopy(w, 0, out, 0, at);
        out[at] = letter;
        System.arraycopy(w, at, out, at + 1, w.length - at);
        return out;
    }
}
