package shamir.input;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;
import shamir.secretsharing.Share;

import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads test cases of the form
 * <pre>
 * { "keys": { "n": 4, "k": 3 },
 *   "1": { "base": "10", "value": "4" },
 *   "2": { "base": "2", "value": "111" } }
 * </pre>
 * Every top-level entry other than "keys" is the share of the shareholder named by its key.
 */
public final class TestCaseReader {
    private static final Logger logger = LoggerFactory.getLogger("input");
    private static final String KEYS = "keys";

    private TestCaseReader() {}

    public static TestCase read(Path path) throws IOException, SecretSharingException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static TestCase read(Reader reader) throws SecretSharingException {
        JSONObject root;
        try {
            root = new JSONObject(new JSONTokener(reader));
        } catch (JSONException e) {
            throw new SecretSharingException(FailureReason.INVALID_INPUT, "Malformed JSON: " + e.getMessage(), e);
        }
        return parse(root);
    }

    public static TestCase parse(String json) throws SecretSharingException {
        try {
            return parse(new JSONObject(json));
        } catch (JSONException e) {
            throw new SecretSharingException(FailureReason.INVALID_INPUT, "Malformed JSON: " + e.getMessage(), e);
        }
    }

    private static TestCase parse(JSONObject root) throws SecretSharingException {
        JSONObject keys = root.optJSONObject(KEYS);
        if (keys == null || !keys.has("n") || !keys.has("k"))
            throw new SecretSharingException(FailureReason.INVALID_INPUT, "Invalid JSON: missing keys.n or keys.k");
        int n;
        int k;
        try {
            n = keys.getInt("n");
            k = keys.getInt("k");
        } catch (JSONException e) {
            throw new SecretSharingException(FailureReason.INVALID_INPUT, "keys.n and keys.k must be integers", e);
        }
        if (k < 1)
            throw new SecretSharingException(FailureReason.INVALID_INPUT, "Threshold k must be at least 1, got " + k);

        List<Share> shares = new ArrayList<>();
        for (String key : root.keySet()) {
            if (KEYS.equals(key))
                continue;
            JSONObject entry = root.optJSONObject(key);
            if (entry == null || !entry.has("base") || !entry.has("value")) {
                logger.warn("Ignoring entry {}: not a share", key);
                continue;
            }
            shares.add(new Share(parseShareholder(key), decodeValue(key, entry)));
        }

        shares.sort(Comparator.comparing(Share::getShareholder));
        for (int i = 1; i < shares.size(); i++) {
            if (shares.get(i).getShareholder().equals(shares.get(i - 1).getShareholder()))
                throw new SecretSharingException(FailureReason.INVALID_INPUT,
                        "Shareholder " + shares.get(i).getShareholder() + " appears more than once");
        }
        if (shares.size() < k)
            throw new SecretSharingException(FailureReason.INVALID_INPUT,
                    "Threshold is " + k + " but only " + shares.size() + " shares were found");
        if (shares.size() != n)
            logger.warn("Declared n = {} but found {} shares", n, shares.size());
        logger.debug("Read test case with n = {}, k = {}, shares = {}", n, k, shares);
        return new TestCase(n, k, shares);
    }

    private static BigInteger parseShareholder(String key) throws SecretSharingException {
        try {
            return new BigInteger(key.trim());
        } catch (NumberFormatException e) {
            throw new SecretSharingException(FailureReason.INVALID_INPUT, "Shareholder '" + key + "' is not an integer", e);
        }
    }

    private static BigInteger decodeValue(String key, JSONObject entry) throws SecretSharingException {
        Object base = entry.get("base");
        Object value = entry.get("value");
        int radix;
        try {
            radix = Integer.parseInt(base.toString().trim());
        } catch (NumberFormatException e) {
            throw new SecretSharingException(FailureReason.INVALID_ENCODING,
                    "Share " + key + " has invalid base " + base, e);
        }
        try {
            return RadixDecoder.decode(value.toString(), radix);
        } catch (SecretSharingException e) {
            throw new SecretSharingException(e.getReason(), "Share " + key + ": " + e.getMessage(), e);
        }
    }
}
