package shamir.input;

import org.junit.jupiter.api.Test;
import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RadixDecoderTest {

    @Test
    public void decodesAnyRadix() throws SecretSharingException {
        assertEquals(BigInteger.valueOf(7), RadixDecoder.decode("111", 2));
        assertEquals(BigInteger.valueOf(39), RadixDecoder.decode("213", 4));
        assertEquals(BigInteger.valueOf(255), RadixDecoder.decode("ff", 16));
        assertEquals(BigInteger.valueOf(255), RadixDecoder.decode("FF", 16));
        assertEquals(BigInteger.valueOf(35), RadixDecoder.decode("z", 36));
        assertEquals(BigInteger.valueOf(90), RadixDecoder.decode(" 2i ", 36));
    }

    @Test
    public void decodesValuesBeyondLong() throws SecretSharingException {
        String digits = "aed7050a9ff6d8a4f8b4a2a5e76b1234567890abcdef";
        assertEquals(new BigInteger(digits, 16), RadixDecoder.decode(digits, 16));
    }

    @Test
    public void rejectsInvalidInput() {
        assertInvalid("102", 2);
        assertInvalid("-1", 10);
        assertInvalid("+1", 10);
        assertInvalid("", 10);
        assertInvalid("   ", 10);
        assertInvalid("12", 1);
        assertInvalid("12", 37);
        assertInvalid("١", 10);
    }

    private static void assertInvalid(String value, int radix) {
        SecretSharingException e = assertThrows(SecretSharingException.class, () -> RadixDecoder.decode(value, radix));
        assertEquals(FailureReason.INVALID_ENCODING, e.getReason());
    }
}
