package shamir.arithmetic;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact fraction over arbitrary precision integers.
 * Instances are always kept in lowest terms with a strictly positive denominator.
 * Arithmetic failures are reported with {@link ArithmeticException}, as {@link BigInteger} does.
 */
public final class Rational {
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    /**
     * Creates the normalized fraction numerator/denominator
     * @param numerator Numerator
     * @param denominator Denominator, must not be zero
     * @throws ArithmeticException When denominator is zero
     */
    public Rational(BigInteger numerator, BigInteger denominator) {
        if (numerator == null || denominator == null)
            throw new IllegalArgumentException("Numerator and denominator cannot be null!");
        if (denominator.signum() == 0)
            throw new ArithmeticException("Division by zero");
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        // gcd(0, d) is d, so 0/d becomes 0/1
        BigInteger gcd = numerator.gcd(denominator);
        this.numerator = numerator.divide(gcd);
        this.denominator = denominator.divide(gcd);
    }

    public static Rational of(BigInteger value) {
        return new Rational(value, BigInteger.ONE);
    }

    public static Rational of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static Rational of(long numerator, long denominator) {
        return new Rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public BigInteger getNumerator() {
        return numerator;
    }

    public BigInteger getDenominator() {
        return denominator;
    }

    public Rational add(Rational other) {
        return new Rational(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return new Rational(numerator.multiply(other.denominator).subtract(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational multiply(Rational other) {
        return new Rational(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @param other Divisor
     * @return this / other
     * @throws ArithmeticException When other is zero
     */
    public Rational divide(Rational other) {
        if (other.isZero())
            throw new ArithmeticException("Division by zero");
        return new Rational(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    /**
     * Returns the integer value of this fraction
     * @return Integer value
     * @throws ArithmeticException When this fraction is not integral
     */
    public BigInteger toBigIntegerExact() {
        if (!isInteger())
            throw new ArithmeticException("Non-integer result: " + this);
        return numerator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rational rational = (Rational) o;
        return numerator.equals(rational.numerator) && denominator.equals(rational.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
