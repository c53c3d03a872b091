package shamir.reconstruction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.arithmetic.Rational;
import shamir.combinatorics.Combinations;
import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;
import shamir.interpolation.InterpolationStrategy;
import shamir.polynomial.Polynomial;
import shamir.secretsharing.Share;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reconstructs the constant term of the polynomial hidden behind a set of shares.
 * With exactly k shares it interpolates once (direct mode). With more than k shares every k-subset
 * votes for the secret it produces and the most supported secret wins (voting mode), which tolerates
 * shares that do not lie on the polynomial.
 */
public class SecretReconstructor implements AutoCloseable {
    private final Logger logger = LoggerFactory.getLogger("reconstruction");

    private final InterpolationStrategy interpolationStrategy;
    private final int votingThreads;
    private final int votingBatchSize;
    private final ExecutorService votingExecutor;

    public SecretReconstructor(InterpolationStrategy interpolationStrategy) {
        this(interpolationStrategy, 1, 1);
    }

    /**
     * @param interpolationStrategy Strategy used for every interpolation attempt
     * @param votingThreads Number of workers evaluating subsets in voting mode; 1 evaluates on the calling thread
     * @param votingBatchSize Number of subsets handed to a worker at once
     */
    public SecretReconstructor(InterpolationStrategy interpolationStrategy, int votingThreads, int votingBatchSize) {
        if (interpolationStrategy == null)
            throw new IllegalArgumentException("Interpolation strategy cannot be null!");
        if (votingThreads < 1 || votingBatchSize < 1)
            throw new IllegalArgumentException("Voting threads and batch size must be at least 1");
        this.interpolationStrategy = interpolationStrategy;
        this.votingThreads = votingThreads;
        this.votingBatchSize = votingBatchSize;
        this.votingExecutor = votingThreads > 1 ? Executors.newFixedThreadPool(votingThreads) : null;
    }

    /**
     * Reconstructs the secret. Runs direct mode if shares.size() == threshold, voting mode otherwise.
     * @param shares Shares with pairwise distinct shareholders
     * @param threshold Number of shares that determine the polynomial
     * @return Secret and how it was obtained
     * @throws SecretSharingException When there are fewer shares than threshold, when the single
     * interpolation of direct mode fails, or when no subset produces an integral secret
     */
    public ReconstructionResult reconstruct(List<Share> shares, int threshold) throws SecretSharingException {
        checkArguments(shares, threshold);
        if (shares.size() < threshold)
            throw new SecretSharingException(FailureReason.NOT_ENOUGH_SHARES,
                    "Need " + threshold + " shares but only " + shares.size() + " were given");
        if (shares.size() == threshold) {
            int[] indices = new int[threshold];
            for (int i = 0; i < threshold; i++) {
                indices[i] = i;
            }
            return direct(shares, indices);
        }
        return voting(shares, threshold);
    }

    /**
     * Reconstructs the secret from the shares of the given shareholders only
     * @param shares All available shares
     * @param threshold Number of shares that determine the polynomial
     * @param pickedShareholders Exactly threshold distinct shareholders
     * @return Secret and the indices of the picked shares
     * @throws SecretSharingException When the pick list has the wrong size, repeats or names an unknown
     * shareholder, or when the interpolation fails
     */
    public ReconstructionResult reconstruct(List<Share> shares, int threshold, List<BigInteger> pickedShareholders)
            throws SecretSharingException {
        checkArguments(shares, threshold);
        if (pickedShareholders == null)
            throw new IllegalArgumentException("Picked shareholders cannot be null!");
        if (pickedShareholders.size() != threshold)
            throw new SecretSharingException(FailureReason.WRONG_SUBSET_SIZE,
                    "Expected " + threshold + " shareholders but " + pickedShareholders.size() + " were picked");

        Set<BigInteger> seen = new HashSet<>();
        int[] indices = new int[threshold];
        for (int p = 0; p < threshold; p++) {
            BigInteger shareholder = pickedShareholders.get(p);
            if (!seen.add(shareholder))
                throw new SecretSharingException(FailureReason.DUPLICATE_KEY,
                        "Shareholder " + shareholder + " was picked more than once");
            indices[p] = indexOf(shares, shareholder);
        }
        return direct(shares, indices);
    }

    /**
     * Runs one interpolation attempt per subset and tallies the integral results.
     * Failed attempts cast no vote.
     * @param shares Shares indexed by the subsets
     * @param threshold Size of every subset
     * @param subsets Subsets of share indices, in the order that defines witnesses
     * @return Tally of the votes
     * @throws IllegalArgumentException When a subset does not have exactly threshold indices
     */
    public VoteTally vote(List<Share> shares, int threshold, Iterable<int[]> subsets) {
        checkArguments(shares, threshold);
        if (votingExecutor == null)
            return voteBatch(shares, threshold, subsets, 0);
        return voteInParallel(shares, threshold, subsets);
    }

    /**
     * Interpolates the shares at zero and requires an integral value
     * @param subset Exactly k shares
     * @return Secret
     * @throws SecretSharingException When interpolation fails or the value at zero is not an integer
     */
    public BigInteger interpolateSecret(Share[] subset) throws SecretSharingException {
        Rational secret;
        try {
            secret = interpolationStrategy.interpolateAt(BigInteger.ZERO, subset);
        } catch (ArithmeticException e) {
            throw new SecretSharingException(FailureReason.DIVISION_BY_ZERO, e.getMessage(), e);
        }
        if (!secret.isInteger())
            throw new SecretSharingException(FailureReason.NON_INTEGER_RESULT,
                    "Value at zero is not an integer: " + secret);
        return secret.getNumerator();
    }

    /**
     * Interpolates the full polynomial through the shares
     * @param subset Exactly k shares
     * @return Polynomial of degree at most k - 1
     * @throws SecretSharingException When interpolation fails
     */
    private Polynomial interpolatePolynomial(Share[] subset) throws SecretSharingException {
        try {
            return interpolationStrategy.interpolate(subset);
        } catch (ArithmeticException e) {
            throw new SecretSharingException(FailureReason.DIVISION_BY_ZERO, e.getMessage(), e);
        }
    }

    private ReconstructionResult direct(List<Share> shares, int[] indices) throws SecretSharingException {
        Share[] subset = select(shares, indices);
        BigInteger secret = interpolateSecret(subset);
        Polynomial polynomial = interpolatePolynomial(subset);
        logger.debug("Reconstructed secret from shares {} using {} interpolation, polynomial of degree {}",
                Arrays.toString(indices), interpolationStrategy.getName(), polynomial.getDegree());
        return new ReconstructionResult(secret, ReconstructionMode.DIRECT, indices, polynomial, null);
    }

    private ReconstructionResult voting(List<Share> shares, int threshold) throws SecretSharingException {
        logger.info("Voting over {} subsets of {} shares with threshold {}",
                Combinations.count(shares.size(), threshold), shares.size(), threshold);
        VoteTally tally = vote(shares, threshold, new Combinations(shares.size(), threshold));
        VoteTally.Candidate winner = tally.winner().orElseThrow(() ->
                new SecretSharingException(FailureReason.NO_CONSISTENT_SUBSET,
                        "None of the " + Combinations.count(shares.size(), threshold) +
                                " subsets of size " + threshold + " produced an integral secret"));
        logger.info("Secret {} won with {} of {} votes", winner.getValue(), winner.getVotes(),
                tally.getTotalVotes());
        Polynomial polynomial = interpolatePolynomial(select(shares, winner.getWitness()));
        return new ReconstructionResult(winner.getValue(), ReconstructionMode.VOTING, winner.getWitness(),
                polynomial, tally.getSupport());
    }

    private VoteTally voteBatch(List<Share> shares, int threshold, Iterable<int[]> subsets, long firstOrdinal) {
        VoteTally tally = new VoteTally();
        long ordinal = firstOrdinal;
        for (int[] subset : subsets) {
            checkSubset(subset, threshold);
            try {
                tally.record(interpolateSecret(select(shares, subset)), subset, ordinal);
            } catch (SecretSharingException e) {
                logger.debug("Subset {} casts no vote: {} ({})", Arrays.toString(subset), e.getReason(),
                        e.getMessage());
            }
            ordinal++;
        }
        return tally;
    }

    private VoteTally voteInParallel(List<Share> shares, int threshold, Iterable<int[]> subsets) {
        VoteTally tally = new VoteTally();
        Queue<Future<VoteTally>> pending = new ArrayDeque<>();
        List<int[]> batch = new ArrayList<>(votingBatchSize);
        long batchOrdinal = 0;
        long ordinal = 0;
        for (int[] subset : subsets) {
            checkSubset(subset, threshold);
            batch.add(subset);
            ordinal++;
            if (batch.size() == votingBatchSize) {
                submit(shares, threshold, batch, batchOrdinal, pending);
                batch = new ArrayList<>(votingBatchSize);
                batchOrdinal = ordinal;
                // bounds the number of subsets held in memory
                if (pending.size() >= votingThreads * 2)
                    tally.merge(await(pending.poll()));
            }
        }
        if (!batch.isEmpty())
            submit(shares, threshold, batch, batchOrdinal, pending);
        while (!pending.isEmpty()) {
            tally.merge(await(pending.poll()));
        }
        return tally;
    }

    private void submit(List<Share> shares, int threshold, List<int[]> batch, long firstOrdinal,
                        Queue<Future<VoteTally>> pending) {
        pending.add(votingExecutor.submit(() -> voteBatch(shares, threshold, batch, firstOrdinal)));
    }

    private VoteTally await(Future<VoteTally> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for voting workers", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException)
                throw (RuntimeException) e.getCause();
            throw new IllegalStateException("Voting worker failed", e.getCause());
        }
    }

    private static Share[] select(List<Share> shares, int[] indices) {
        Share[] subset = new Share[indices.length];
        for (int i = 0; i < indices.length; i++) {
            subset[i] = shares.get(indices[i]);
        }
        return subset;
    }

    private static int indexOf(List<Share> shares, BigInteger shareholder) throws SecretSharingException {
        for (int i = 0; i < shares.size(); i++) {
            if (shares.get(i).getShareholder().equals(shareholder))
                return i;
        }
        throw new SecretSharingException(FailureReason.UNKNOWN_KEY, "Unknown shareholder " + shareholder);
    }

    private static void checkArguments(List<Share> shares, int threshold) {
        if (shares == null)
            throw new IllegalArgumentException("Shares cannot be null!");
        if (threshold < 1)
            throw new IllegalArgumentException("Threshold must be at least 1");
    }

    private static void checkSubset(int[] subset, int threshold) {
        if (subset.length != threshold)
            throw new IllegalArgumentException("Subset " + Arrays.toString(subset) + " does not have "
                    + threshold + " indices");
    }

    @Override
    public void close() {
        if (votingExecutor != null)
            votingExecutor.shutdown();
    }
}
