package shamir.reconstruction;

import shamir.polynomial.Polynomial;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/**
 * Reconstructed secret together with the subset that produced it and the polynomial through that subset.
 * In voting mode it also carries the support of every candidate.
 */
public class ReconstructionResult {
    private final BigInteger secret;
    private final ReconstructionMode mode;
    private final int[] usedIndices;
    private final Polynomial polynomial;
    private final Map<BigInteger, Integer> votes;

    public ReconstructionResult(BigInteger secret, ReconstructionMode mode, int[] usedIndices,
                                Polynomial polynomial, Map<BigInteger, Integer> votes) {
        this.secret = secret;
        this.mode = mode;
        this.usedIndices = Arrays.copyOf(usedIndices, usedIndices.length);
        this.polynomial = polynomial;
        this.votes = votes == null ? Collections.emptyMap() : votes;
    }

    public BigInteger getSecret() {
        return secret;
    }

    public ReconstructionMode getMode() {
        return mode;
    }

    /**
     * @return Indices of the shares used; the witness subset in voting mode
     */
    public int[] getUsedIndices() {
        return Arrays.copyOf(usedIndices, usedIndices.length);
    }

    /**
     * @return Polynomial interpolated from the used shares
     */
    public Polynomial getPolynomial() {
        return polynomial;
    }

    /**
     * @return Candidate secret to number of supporting subsets, empty in direct mode
     */
    public Map<BigInteger, Integer> getVotes() {
        return votes;
    }

    @Override
    public String toString() {
        return "ReconstructionResult{secret=" + secret + ", mode=" + mode +
                ", usedIndices=" + Arrays.toString(usedIndices) + ", polynomial=" + polynomial + ", votes=" + votes + "}";
    }
}
