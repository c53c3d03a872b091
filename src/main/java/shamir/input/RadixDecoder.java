package shamir.input;

import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;

import java.math.BigInteger;

/**
 * Decodes share values written in a radix between 2 and 36 (digits 0-9 then a-z, case insensitive).
 * Unlike {@link BigInteger#BigInteger(String, int)} no sign is accepted, so results are never negative.
 */
public final class RadixDecoder {
    public static final int MIN_RADIX = Character.MIN_RADIX;
    public static final int MAX_RADIX = Character.MAX_RADIX;

    private RadixDecoder() {}

    public static BigInteger decode(String value, int radix) throws SecretSharingException {
        if (radix < MIN_RADIX || radix > MAX_RADIX)
            throw new SecretSharingException(FailureReason.INVALID_ENCODING,
                    "Base " + radix + " is outside [" + MIN_RADIX + ", " + MAX_RADIX + "]");
        if (value == null || value.trim().isEmpty())
            throw new SecretSharingException(FailureReason.INVALID_ENCODING, "Empty value in base " + radix);

        String digits = value.trim();
        BigInteger base = BigInteger.valueOf(radix);
        BigInteger result = BigInteger.ZERO;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            int digit = Character.digit(c, radix);
            // Character.digit also accepts non-ASCII digits
            if (digit < 0 || c > 'z')
                throw new SecretSharingException(FailureReason.INVALID_ENCODING,
                        "Digit '" + c + "' is not valid in base " + radix);
            result = result.multiply(base).add(BigInteger.valueOf(digit));
        }
        return result;
    }
}
