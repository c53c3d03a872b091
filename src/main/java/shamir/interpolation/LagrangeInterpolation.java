package shamir.interpolation;

import shamir.Constants;
import shamir.arithmetic.Rational;
import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;
import shamir.polynomial.Polynomial;
import shamir.secretsharing.Share;

import java.math.BigInteger;

/**
 * This class implements Lagrange Interpolation equations.
 * Numerator and denominator of each basis polynomial are accumulated as exact integers.
 */
public class LagrangeInterpolation implements InterpolationStrategy {

    /**
     * Interpolated a polynomial F and returns value y of point (x,y) on F
     * @param x Value of x
     * @param shares Shares used to interpolate polynomial
     * @return Value y
     * @throws SecretSharingException When two shares have the same shareholder
     */
    @Override
    public Rational interpolateAt(BigInteger x, Share[] shares) throws SecretSharingException {
        Rational result = Rational.ZERO;

        for (int i = 0; i < shares.length; i++) {
            BigInteger numerator = BigInteger.ONE;
            BigInteger denominator = BigInteger.ONE;
            BigInteger xi = shares[i].getShareholder();
            for (int j = 0; j < shares.length; j++) {
                if (i == j)
                    continue;
                numerator = numerator.multiply(x.subtract(shares[j].getShareholder()));
                denominator = denominator.multiply(xi.subtract(shares[j].getShareholder()));
            }
            if (denominator.signum() == 0)
                throw new SecretSharingException(FailureReason.DIVISION_BY_ZERO,
                        "Shareholder " + xi + " appears more than once");
            result = result.add(new Rational(numerator.multiply(shares[i].getShare()), denominator));
        }

        return result;
    }

    /**
     * Returns interpolated polynomial
     * @param shares Shares used to interpolate polynomial
     * @return Return interpolate polynomial
     * @throws SecretSharingException When two shares have the same shareholder
     */
    @Override
    public Polynomial interpolate(Share[] shares) throws SecretSharingException {
        return new Polynomial(shares);
    }

    @Override
    public String getName() {
        return Constants.VALUE_LAGRANGE;
    }
}
