package shamir.polynomial;

import shamir.arithmetic.Rational;
import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;
import shamir.secretsharing.Share;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Represents polynomial with rational coefficients.
 * Coefficients are stored from the highest degree down to the constant term.
 */
public class Polynomial {
    private final Rational[] polynomial;
    private final int degree;

    /**
     * Creates polynomial of type coefficients[0]*x^t + ... + coefficients[t], where t = coefficients.length - 1
     * @param coefficients Coefficients, highest degree first
     */
    public Polynomial(Rational[] coefficients) {
        if (coefficients == null || coefficients.length == 0)
            throw new IllegalArgumentException("Polynomial needs at least one coefficient!");
        this.polynomial = Arrays.copyOf(coefficients, coefficients.length);
        this.degree = computeDegree(polynomial);
    }

    /**
     * Generates polynomial of type a_t*x^t+ ... + a_1*x + constant, where t = coefficients.length,
     * a_t,...,a_1 are coefficients[0],..., coefficients[t - 1], respectively.
     * @param constant Constant term of this polynomial
     * @param coefficients Coefficients of this polynomial
     */
    public Polynomial(BigInteger constant, BigInteger... coefficients) {
        this.polynomial = new Rational[coefficients.length + 1];
        for (int i = 0; i < coefficients.length; i++) {
            polynomial[i] = Rational.of(coefficients[i]);
        }
        this.polynomial[coefficients.length] = Rational.of(constant);
        this.degree = computeDegree(polynomial);
    }

    /**
     * Interpolates the polynomial defined by shares as a sum of Lagrange basis polynomials.
     * This polynomial has degree at most shares.length - 1.
     * @param shares Points of the polynomial
     * @throws SecretSharingException When two shares have the same shareholder
     */
    public Polynomial(Share[] shares) throws SecretSharingException {
        if (shares == null || shares.length == 0)
            throw new IllegalArgumentException("Cannot interpolate polynomial without shares!");
        Rational[] result = new Rational[shares.length];
        Arrays.fill(result, Rational.ZERO);
        for (int i = 0; i < shares.length; i++) {
            BigInteger denominator = BigInteger.ONE;
            BigInteger j = shares[i].getShareholder();
            Rational[] numerator = {Rational.ONE};
            for (int m = 0; m < shares.length; m++) {
                if (i == m)
                    continue;
                numerator = multiply(numerator, Rational.ONE, Rational.of(shares[m].getShareholder().negate()));
                denominator = denominator.multiply(j.subtract(shares[m].getShareholder()));
            }
            if (denominator.signum() == 0)
                throw new SecretSharingException(FailureReason.DIVISION_BY_ZERO,
                        "Shareholder " + j + " appears more than once");
            Rational scale = new Rational(shares[i].getShare(), denominator);
            numerator = multiply(numerator, scale);
            result = add(result, numerator);
        }
        this.polynomial = result;
        this.degree = computeDegree(polynomial);
    }

    /**
     * This method uses Horner's method to evaluate polynomial at x.
     * @param x X value
     * @return Polynomial evaluated at x
     */
    public Rational evaluateAt(BigInteger x) {
        Rational rx = Rational.of(x);
        Rational b = polynomial[0];
        for (int i = 1; i < polynomial.length; i++) {
            b = polynomial[i].add(b.multiply(rx));
        }
        return b;
    }

    public int getDegree() {
        return degree;
    }

    public Rational[] getCoefficients() {
        return Arrays.copyOf(polynomial, polynomial.length);
    }

    private static int computeDegree(Rational[] polynomial) {
        int degree = polynomial.length - 1;
        for (Rational coefficient : polynomial) {
            if (!coefficient.isZero())
                return degree;
            degree--;
        }
        return 0;
    }

    /**
     * Adds two coefficient vectors of the same length.
     */
    private static Rational[] add(Rational[] p1, Rational[] p2) {
        Rational[] result = new Rational[p1.length];
        for (int i = 0; i < p1.length; i++) {
            result[i] = p1[i].add(p2[i]);
        }
        return result;
    }

    /**
     * Multiplies to polynomials or polynomial with constant.
     * @param p1 First polynomial
     * @param p2 Second polynomial or a constant
     * @return Product of p1 with p2
     */
    private static Rational[] multiply(Rational[] p1, Rational... p2) {
        Rational[] result = new Rational[p1.length + p2.length - 1];
        Arrays.fill(result, Rational.ZERO);
        for (int i = 0; i < p1.length; i++) {
            for (int j = 0; j < p2.length; j++) {
                result[i + j] = result[i + j].add(p1[i].multiply(p2[j]));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(polynomial, ((Polynomial) o).polynomial);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(polynomial);
    }

    @Override
    public String toString() {
        int t = polynomial.length - 1;
        StringBuilder sb = new StringBuilder();
        boolean start = false;
        for (Rational coefficient : polynomial) {
            if (!start && !coefficient.isZero())
                start = true;
            if (start && t != 0) {
                sb.append(coefficient);
                sb.append("x^");
                sb.append(t);
                sb.append(" + ");
            } else if (t == 0) {
                sb.append(coefficient);
            }
            t--;
        }
        return sb.toString();
    }
}
