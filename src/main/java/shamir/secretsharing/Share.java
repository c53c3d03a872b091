package shamir.secretsharing;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Stores shareholder and its share, i.e., the point (x, y) of the hidden polynomial
 */
public final class Share {
    private final BigInteger shareholder;
    private final BigInteger share;

    public Share(BigInteger shareholder, BigInteger share) {
        if (shareholder == null || share == null)
            throw new IllegalArgumentException("Shareholder and share cannot be null!");
        this.shareholder = shareholder;
        this.share = share;
    }

    public static Share of(long shareholder, long share) {
        return new Share(BigInteger.valueOf(shareholder), BigInteger.valueOf(share));
    }

    /**
     * @return x coordinate
     */
    public BigInteger getShareholder() {
        return shareholder;
    }

    /**
     * @return y coordinate
     */
    public BigInteger getShare() {
        return share;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Share share1 = (Share) o;
        return Objects.equals(shareholder, share1.shareholder) &&
                Objects.equals(share, share1.share);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shareholder, share);
    }

    @Override
    public String toString() {
        return "(" + shareholder + ", " + share + ")";
    }
}
