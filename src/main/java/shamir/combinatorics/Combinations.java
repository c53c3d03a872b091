package shamir.combinatorics;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * All k-element subsets of the index set [0, n), as strictly increasing arrays in lexicographic order.
 * Subsets are produced on demand; every call to {@link #iterator()} starts a fresh enumeration.
 */
public class Combinations implements Iterable<int[]> {
    private final int n;
    private final int k;

    /**
     * @param n Universe size
     * @param k Subset size, 0 &lt;= k &lt;= n
     */
    public Combinations(int n, int k) {
        if (k < 0 || n < k)
            throw new IllegalArgumentException("Invalid combination size: n = " + n + ", k = " + k);
        this.n = n;
        this.k = k;
    }

    /**
     * Computes the binomial coefficient C(n, k)
     * @param n Universe size
     * @param k Subset size
     * @return Number of k-subsets of an n-set, zero if k is out of [0, n]
     */
    public static BigInteger count(int n, int k) {
        if (k < 0 || n < k)
            return BigInteger.ZERO;
        k = Math.min(k, n - k);
        BigInteger result = BigInteger.ONE;
        for (int i = 1; i <= k; i++) {
            // exact at every step: result is C(n - k + i, i)
            result = result.multiply(BigInteger.valueOf(n - k + i)).divide(BigInteger.valueOf(i));
        }
        return result;
    }

    @Override
    public Iterator<int[]> iterator() {
        return new CombinationIterator();
    }

    private class CombinationIterator implements Iterator<int[]> {
        private final int[] indices;
        private boolean hasNext;

        private CombinationIterator() {
            indices = new int[k];
            for (int i = 0; i < k; i++) {
                indices[i] = i;
            }
            hasNext = true;
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public int[] next() {
            if (!hasNext)
                throw new NoSuchElementException();
            int[] current = Arrays.copyOf(indices, k);
            advance();
            return current;
        }

        private void advance() {
            int i = k - 1;
            while (i >= 0 && indices[i] == i + n - k) {
                i--;
            }
            if (i < 0) {
                hasNext = false;
                return;
            }
            indices[i]++;
            for (int j = i + 1; j < k; j++) {
                indices[j] = indices[j - 1] + 1;
            }
        }
    }
}
