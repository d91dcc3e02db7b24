package com.coxetergroups;

import java.util.Arrays;

/**
 * An element of a {@link MinimalRootGroup}, stored as its ShortLex normal form: the lexicographically
 * least reduced word. Since the form is unique, equal elements have equal words and the word alone
 * gives equality, hashing and the ShortLex order.
 */
public final class MinimalRootElement extends AbstractCoxeterElement<MinimalRootElement>
        implements Comparable<MinimalRootElement> {

    private final MinimalRootGroup group;
    private final byte[] word;   // unsigned letters in [1, 255]

    MinimalRootElement(MinimalRootGroup group, byte[] word) {
        this.group = group;
        this.word = word;
    }

    @Override protected MinimalRootElement self() { return this; }

    @Override public MinimalRootGroup parent() { return group; }
    @Override public boolean isIdentity() { return word.length == 0; }
    @Override public int length() { return word.length; }

    /*
     * Descent tests. For a simple reflection t with root alpha, l(w t) < l(w) iff w(alpha) < 0. Run alpha
     * through the letters of the reduced word from the right: meeting the letter whose simple root we hold
     * means alpha turns negative and stays negative; leaving the minimal roots means it never comes back.
     */

    @Override public boolean isRightDescent(int t) {
        ReflectionTable table = group.reflectionTable();
        GeneratorOutOfRangeException.check(t, table.rank());
        int root = t;
        for (int i = word.length - 1; i >= 0; i--) {
            int s = word[i] & 0xFF;
            if (s == root) return true;
            root = table.entry(s, root);
            if (root == 0) return false;
        }
        return false;
    }

    @Override public boolean isLeftDescent(int t) {
        ReflectionTable table = group.reflectionTable();
        GeneratorOutOfRangeException.check(t, table.rank());
        int root = t;
        for (int i = 0; i < word.length; i++) {
            int s = word[i] & 0xFF;
            if (s == root) return true;
            root = table.entry(s, root);
            if (root == 0) return false;
        }
        return false;
    }

    @Override public MinimalRootElement rightMultiply(int s) {
        GeneratorOutOfRangeException.check(s, group.rank());
        WordBuffer buf = new WordBuffer(word, 1);
        buf.rightMultiply(group.reflectionTable(), s);
        return new MinimalRootElement(group, buf.toArray());
    }

    @Override public MinimalRootElement leftMultiply(int s) {
        GeneratorOutOfRangeException.check(s, group.rank());
        // rebuilds s w one letter at a time, so O(l(w)^2); only rightMultiply is linear
        WordBuffer buf = new WordBuffer(new byte[] { (byte) s }, word.length);
        ReflectionTable table = group.reflectionTable();
        for (byte b : word) buf.rightMultiply(table, b & 0xFF);
        return new MinimalRootElement(group, buf.toArray());
    }

    @Override public MinimalRootElement multiply(MinimalRootElement other) {
        MismatchedParentException.check(this, other);
        WordBuffer buf = new WordBuffer(word, other.word.length);
        ReflectionTable table = group.reflectionTable();
        for (byte b : other.word) buf.rightMultiply(table, b & 0xFF);
        return new MinimalRootElement(group, buf.toArray());
    }

    @Override public MinimalRootElement inverse() {
        WordBuffer buf = new WordBuffer(new byte[0], word.length);
        ReflectionTable table = group.reflectionTable();
        for (int i = word.length - 1; i >= 0; i--) buf.rightMultiply(table, word[i] & 0xFF);
        return new MinimalRootElement(group, buf.toArray());
    }

    @Override public int[] shortLex() {
        int[] out = new int[word.length];
        for (int i = 0; i < word.length; i++) out[i] = word[i] & 0xFF;
        return out;
    }

    /** The reverse of the ShortLex form of the inverse. */
    @Override public int[] inverseShortLex() {
        int[] inv = inverse().shortLex();
        int[] out = new int[inv.length];
        for (int i = 0; i < inv.length; i++) out[i] = inv[inv.length - 1 - i];
        return out;
    }

    /** ShortLex order: shorter first, then lexicographic on the normal forms. */
    @Override public int compareTo(MinimalRootElement o) {
        MismatchedParentException.check(this, o);
        if (word.length != o.word.length) return Integer.compare(word.length, o.word.length);
        for (int i = 0; i < word.length; i++) {
            int c = Integer.compare(word[i] & 0xFF, o.word[i] & 0xFF);
            if (c != 0) return c;
        }
        return 0;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MinimalRootElement)) return false;
        MinimalRootElement o = (MinimalRootElement) obj;
        return group == o.group && Arrays.equals(word, o.word);
    }

    @Override public int hashCode() { return Arrays.hashCode(word); }

    /**
     * Scratch word rewritten in place by right multiplication. Never shared: each operation copies the
     * source word in and hands out a fresh array at the end.
     */
    static final class WordBuffer {
        private byte[] data;
        private int len;

        WordBuffer(byte[] initial, int extra) {
            this.data = Arrays.copyOf(initial, initial.length + Math.max(extra, 1));
            this.len = initial.length;
        }

        int length() { return len; }

        byte[] toArray() { return Arrays.copyOf(data, len); }

        /**
         * Multiplies the (reduced, ShortLex) word on the right by {@code t}, keeping it ShortLex.
         *
         * Walk right to left carrying {@code alpha = s(i+1) ... s(n) . alpha_t}, which stays a minimal root:
         * <ol>
         *   <li>If alpha is the simple root of s(i) then {@code s(i+1) ... s(n) t = s(i) ... s(n)} and the
         *       letter s(i) cancels: delete it.</li>
         *   <li>If s(i)(alpha) is the simple root of some r, inserting r just before position i is also valid;
         *       it beats the current candidate when r &lt; s(i).</li>
         *   <li>If s(i)(alpha) is no longer minimal it never will be again: insert at the best point so far.</li>
         * </ol>
         * Reaching the front of the word also means an insertion.
         */
        void rightMultiply(ReflectionTable table, int t) {
            int insertAt = len;
            int letter = t;
            int root = t;
            for (int i = len - 1; i >= 0; i--) {
                int s = data[i] & 0xFF;
                if (s == root) {
                    System.arraycopy(data, i + 1, data, i, len - i - 1);
                    len--;
                    return;
                }

                root = table.entry(s, root);
                if (root == 0) break;

                // s is a generator, so root < s means root is simple.
                if (root < s) {
                    insertAt = i;
                    letter = root;
                }
            }

            if (len == data.length) data = Arrays.copyOf(data, Math.max(4, data.length * 2));
            System.arraycopy(data, insertAt, data, insertAt + 1, len - insertAt);
            data[insertAt] = (byte) letter;
            len++;
        }
    }
}
