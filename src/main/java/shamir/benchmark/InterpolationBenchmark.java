package shamir.benchmark;

import shamir.arithmetic.Rational;
import shamir.facade.SecretSharingException;
import shamir.interpolation.GaussianInterpolation;
import shamir.interpolation.InterpolationStrategy;
import shamir.interpolation.LagrangeInterpolation;
import shamir.polynomial.Polynomial;
import shamir.secretsharing.Share;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Compares the cost of Lagrange and Gaussian interpolation of the secret.
 * Arguments: threshold nTests
 */
public class InterpolationBenchmark {
    private static final int nDecimals = 4;
    private static final int coefficientBits = 256;
    private static final SecureRandom rndGenerator = new SecureRandom("ola".getBytes());

    public static void main(String[] args) throws SecretSharingException {
        int threshold = args.length == 0 ? 5 : Integer.parseInt(args[0]);
        int nTests = args.length < 2 ? 100 : Integer.parseInt(args[1]);

        System.out.println("Warming up");
        runTests(false, threshold, nTests);
        System.out.println("Running test");
        runTests(true, threshold, nTests);
    }

    private static void runTests(boolean printResults, int threshold, int nTests) throws SecretSharingException {
        InterpolationStrategy lagrange = new LagrangeInterpolation();
        InterpolationStrategy gaussian = new GaussianInterpolation();
        Measurement mLagrange = new Measurement(nTests);
        Measurement mGaussian = new Measurement(nTests);

        for (int t = 0; t < nTests; t++) {
            BigInteger secret = new BigInteger(coefficientBits, rndGenerator);
            BigInteger[] coefficients = new BigInteger[threshold - 1];
            for (int i = 0; i < coefficients.length; i++) {
                coefficients[i] = new BigInteger(coefficientBits, rndGenerator);
            }
            Polynomial polynomial = new Polynomial(secret, coefficients);

            Share[] shares = new Share[threshold];
            for (int i = 0; i < threshold; i++) {
                BigInteger shareholder = BigInteger.valueOf(i + 1);
                shares[i] = new Share(shareholder, polynomial.evaluateAt(shareholder).toBigIntegerExact());
            }

            mLagrange.start();
            Rational lagrangeSecret = lagrange.interpolateAt(BigInteger.ZERO, shares);
            mLagrange.stop();

            mGaussian.start();
            Rational gaussianSecret = gaussian.interpolateAt(BigInteger.ZERO, shares);
            mGaussian.stop();

            if (!lagrangeSecret.equals(gaussianSecret) || !lagrangeSecret.equals(Rational.of(secret)))
                throw new RuntimeException("Interpolation strategies disagree");
        }

        if (printResults) {
            System.out.println("Threshold: " + threshold);
            System.out.println("Lagrange interpolation: " + mLagrange.getAverageInMillis(nDecimals) + " ms");
            System.out.println("Gaussian interpolation: " + mGaussian.getAverageInMillis(nDecimals) + " ms");
        }
    }
}
