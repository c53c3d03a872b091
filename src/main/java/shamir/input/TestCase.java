package shamir.input;

import shamir.secretsharing.Share;

import java.util.Collections;
import java.util.List;

/**
 * Decoded reconstruction problem: declared share count, threshold and the shares sorted by shareholder
 */
public final class TestCase {
    private final int n;
    private final int k;
    private final List<Share> shares;

    public TestCase(int n, int k, List<Share> shares) {
        this.n = n;
        this.k = k;
        this.shares = Collections.unmodifiableList(shares);
    }

    /**
     * @return Share count declared in the input, which may differ from the number of shares present
     */
    public int getN() {
        return n;
    }

    public int getK() {
        return k;
    }

    public List<Share> getShares() {
        return shares;
    }
}
