package shamir.interpolation;

import shamir.Constants;
import shamir.arithmetic.Rational;
import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;
import shamir.polynomial.Polynomial;
import shamir.secretsharing.Share;

import java.math.BigInteger;

/**
 * Solves the Vandermonde system [x_i^(k-1), ..., x_i, 1] * a = y_i by Gaussian elimination.
 * Yields every coefficient of the polynomial, not only its value at one point.
 */
public class GaussianInterpolation implements InterpolationStrategy {

    @Override
    public Rational interpolateAt(BigInteger x, Share[] shares) throws SecretSharingException {
        return interpolate(shares).evaluateAt(x);
    }

    /**
     * Solves the linear system defined by the shares
     * @param shares Shares used to interpolate polynomial
     * @return Polynomial with coefficients [a_(k-1), ..., a_1, a_0]
     * @throws SecretSharingException When the system is singular
     */
    @Override
    public Polynomial interpolate(Share[] shares) throws SecretSharingException {
        if (shares == null || shares.length == 0)
            throw new IllegalArgumentException("Cannot interpolate polynomial without shares!");
        return new Polynomial(solve(vandermondeMatrix(shares), rightHandSide(shares)));
    }

    static Rational[][] vandermondeMatrix(Share[] shares) {
        int k = shares.length;
        Rational[][] matrix = new Rational[k][k];
        for (int r = 0; r < k; r++) {
            BigInteger x = shares[r].getShareholder();
            for (int c = 0; c < k; c++) {
                matrix[r][c] = Rational.of(x.pow(k - 1 - c));
            }
        }
        return matrix;
    }

    private static Rational[] rightHandSide(Share[] shares) {
        Rational[] b = new Rational[shares.length];
        for (int i = 0; i < shares.length; i++) {
            b[i] = Rational.of(shares[i].getShare());
        }
        return b;
    }

    /**
     * Solves A * x = b exactly. A and b are not modified.
     * @param a Square coefficient matrix
     * @param b Right-hand side
     * @return Solution vector
     * @throws SecretSharingException When some column has no non-zero pivot
     */
    static Rational[] solve(Rational[][] a, Rational[] b) throws SecretSharingException {
        int k = a.length;
        Rational[][] m = new Rational[k][k + 1];
        for (int r = 0; r < k; r++) {
            System.arraycopy(a[r], 0, m[r], 0, k);
            m[r][k] = b[r];
        }

        for (int col = 0; col < k; col++) {
            int pivot = -1;
            for (int r = col; r < k; r++) {
                if (!m[r][col].isZero()) {
                    pivot = r;
                    break;
                }
            }
            if (pivot == -1)
                throw new SecretSharingException(FailureReason.SINGULAR_SYSTEM,
                        "No pivot in column " + col + ", system has no unique solution");
            if (pivot != col) {
                Rational[] tmp = m[col];
                m[col] = m[pivot];
                m[pivot] = tmp;
            }

            Rational pivotValue = m[col][col];
            for (int c = col; c <= k; c++) {
                m[col][c] = m[col][c].divide(pivotValue);
            }

            for (int r = col + 1; r < k; r++) {
                Rational factor = m[r][col];
                if (factor.isZero())
                    continue;
                for (int c = col; c <= k; c++) {
                    m[r][c] = m[r][c].subtract(factor.multiply(m[col][c]));
                }
            }
        }

        // pivots are 1 after normalization
        Rational[] x = new Rational[k];
        for (int r = k - 1; r >= 0; r--) {
            Rational sum = Rational.ZERO;
            for (int c = r + 1; c < k; c++) {
                sum = sum.add(m[r][c].multiply(x[c]));
            }
            x[r] = m[r][k].subtract(sum);
        }
        return x;
    }

    @Override
    public String getName() {
        return Constants.VALUE_GAUSSIAN;
    }
}
