package shamir.interpolation;

import shamir.arithmetic.Rational;
import shamir.facade.SecretSharingException;
import shamir.polynomial.Polynomial;
import shamir.secretsharing.Share;

import java.math.BigInteger;

/**
 * Exposes methods that can be invoked to interpolate polynomial and compute point on it.
 * All computations are exact over the rationals.
 */
public interface InterpolationStrategy {

    /**
     * This method interpolates polynomial of degree shares.length - 1 and returns value evaluated at x.
     * @param x Value of x
     * @param shares Shares used to interpolate polynomial
     * @return Value of y
     * @throws SecretSharingException When the shares do not determine a unique polynomial
     */
    Rational interpolateAt(BigInteger x, Share[] shares) throws SecretSharingException;

    /**
     * This method interpolates polynomial using share.length and returns it. The polynomial will have at most degree shares.length - 1
     * @param shares Shares used to interpolate polynomial
     * @return Polynomial
     * @throws SecretSharingException When the shares do not determine a unique polynomial
     */
    Polynomial interpolate(Share[] shares) throws SecretSharingException;

    /**
     * @return Name used in configuration and logs
     */
    String getName();
}
