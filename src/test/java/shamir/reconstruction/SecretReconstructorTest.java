package shamir.reconstruction;

import org.junit.jupiter.api.Test;
import shamir.arithmetic.Rational;
import shamir.facade.FailureReason;
import shamir.facade.SecretSharingException;
import shamir.interpolation.GaussianInterpolation;
import shamir.interpolation.InterpolationStrategy;
import shamir.interpolation.LagrangeInterpolation;
import shamir.input.TestCase;
import shamir.input.TestCaseReader;
import shamir.secretsharing.Share;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SecretReconstructorTest {
    private static final BigInteger FIVE = BigInteger.valueOf(5);
    private static final Rational[] QUADRATIC = {Rational.of(3), Rational.of(2), Rational.of(5)};

    /**
     * Shares of 3x^2 + 2x + 5 at x = 1..5 and a corrupted share at x = 6
     */
    private static List<Share> sharesWithOutlier() {
        return Arrays.asList(Share.of(1, 10), Share.of(2, 21), Share.of(3, 38), Share.of(4, 61),
                Share.of(5, 90), Share.of(6, 999));
    }

    private static List<BigInteger> keys(long... keys) {
        List<BigInteger> result = new ArrayList<>();
        for (long key : keys) {
            result.add(BigInteger.valueOf(key));
        }
        return result;
    }

    @Test
    public void directModeWithExactlyKShares() throws SecretSharingException {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        ReconstructionResult result = reconstructor.reconstruct(sharesWithOutlier().subList(0, 3), 3);
        assertEquals(FIVE, result.getSecret());
        assertEquals(ReconstructionMode.DIRECT, result.getMode());
        assertArrayEquals(new int[]{0, 1, 2}, result.getUsedIndices());
        assertTrue(result.getVotes().isEmpty());
    }

    @Test
    public void directModeWithPickedShareholders() throws SecretSharingException {
        SecretReconstructor reconstructor = new SecretReconstructor(new GaussianInterpolation());
        ReconstructionResult result = reconstructor.reconstruct(sharesWithOutlier(), 3, keys(5, 2, 4));
        assertEquals(FIVE, result.getSecret());
        assertArrayEquals(new int[]{4, 1, 3}, result.getUsedIndices());
        assertArrayEquals(QUADRATIC, result.getPolynomial().getCoefficients());
    }

    @Test
    public void directModeSurfacesInterpolationFailures() {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        List<Share> duplicated = Arrays.asList(Share.of(1, 5), Share.of(1, 9), Share.of(2, 13));
        SecretSharingException e = assertThrows(SecretSharingException.class,
                () -> reconstructor.reconstruct(duplicated, 3));
        assertEquals(FailureReason.DIVISION_BY_ZERO, e.getReason());

        List<Share> fractional = Arrays.asList(Share.of(1, 1), Share.of(3, 2));
        e = assertThrows(SecretSharingException.class, () -> reconstructor.reconstruct(fractional, 2));
        assertEquals(FailureReason.NON_INTEGER_RESULT, e.getReason());

        SecretReconstructor gaussian = new SecretReconstructor(new GaussianInterpolation());
        e = assertThrows(SecretSharingException.class, () -> gaussian.reconstruct(duplicated, 3));
        assertEquals(FailureReason.SINGULAR_SYSTEM, e.getReason());
    }

    @Test
    public void wrongPickSizeFailsBeforeInterpolating() {
        InterpolationStrategy failing = new InterpolationStrategy() {
            @Override
            public shamir.arithmetic.Rational interpolateAt(BigInteger x, Share[] shares) {
                throw new AssertionError("Interpolation should not run");
            }

            @Override
            public shamir.polynomial.Polynomial interpolate(Share[] shares) {
                throw new AssertionError("Interpolation should not run");
            }

            @Override
            public String getName() {
                return "failing";
            }
        };
        SecretReconstructor reconstructor = new SecretReconstructor(failing);
        SecretSharingException e = assertThrows(SecretSharingException.class,
                () -> reconstructor.reconstruct(sharesWithOutlier(), 3, keys(1, 2)));
        assertEquals(FailureReason.WRONG_SUBSET_SIZE, e.getReason());
        assertTrue(e.getMessage().contains("3"));
        assertTrue(e.getMessage().contains("2"));
    }

    @Test
    public void unknownAndDuplicatePicksFail() {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        SecretSharingException e = assertThrows(SecretSharingException.class,
                () -> reconstructor.reconstruct(sharesWithOutlier(), 3, keys(1, 2, 42)));
        assertEquals(FailureReason.UNKNOWN_KEY, e.getReason());
        assertTrue(e.getMessage().contains("42"));

        e = assertThrows(SecretSharingException.class,
                () -> reconstructor.reconstruct(sharesWithOutlier(), 3, keys(1, 2, 1)));
        assertEquals(FailureReason.DUPLICATE_KEY, e.getReason());
    }

    @Test
    public void votingOutvotesTheCorruptedShare() throws SecretSharingException {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        ReconstructionResult result = reconstructor.reconstruct(sharesWithOutlier(), 3);

        assertEquals(FIVE, result.getSecret());
        assertEquals(ReconstructionMode.VOTING, result.getMode());
        assertArrayEquals(new int[]{0, 1, 2}, result.getUsedIndices());
        Map<BigInteger, Integer> votes = result.getVotes();
        assertEquals(10, votes.get(FIVE));
        for (Map.Entry<BigInteger, Integer> vote : votes.entrySet()) {
            if (!vote.getKey().equals(FIVE))
                assertTrue(vote.getValue() < 10, "candidate " + vote.getKey());
        }
    }

    @Test
    public void votingReturnsThePolynomialOfTheWitness() throws SecretSharingException {
        for (InterpolationStrategy strategy : Arrays.asList(new LagrangeInterpolation(), new GaussianInterpolation())) {
            ReconstructionResult result = new SecretReconstructor(strategy).reconstruct(sharesWithOutlier(), 3);
            assertArrayEquals(QUADRATIC, result.getPolynomial().getCoefficients(), strategy.getName());
            assertEquals(2, result.getPolynomial().getDegree());
        }
    }

    @Test
    public void outlierFixtureYieldsAllCoefficients() throws URISyntaxException, IOException, SecretSharingException {
        TestCase testCase = TestCaseReader.read(Paths.get(getClass().getResource("/outlier.json").toURI()));
        ReconstructionResult result = new SecretReconstructor(new GaussianInterpolation())
                .reconstruct(testCase.getShares(), testCase.getK());
        assertEquals(FIVE, result.getSecret());
        assertArrayEquals(QUADRATIC, result.getPolynomial().getCoefficients());
    }

    @Test
    public void strategiesProduceTheSameTally() throws SecretSharingException {
        ReconstructionResult lagrange = new SecretReconstructor(new LagrangeInterpolation())
                .reconstruct(sharesWithOutlier(), 3);
        ReconstructionResult gaussian = new SecretReconstructor(new GaussianInterpolation())
                .reconstruct(sharesWithOutlier(), 3);
        assertEquals(lagrange.getVotes(), gaussian.getVotes());
        assertArrayEquals(lagrange.getUsedIndices(), gaussian.getUsedIndices());
    }

    @Test
    public void votingIsOrderIndependent() throws SecretSharingException {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        ReconstructionResult sorted = reconstructor.reconstruct(sharesWithOutlier(), 3);

        List<Share> shuffled = new ArrayList<>(sharesWithOutlier());
        Collections.reverse(shuffled);
        ReconstructionResult reversed = reconstructor.reconstruct(shuffled, 3);
        Collections.shuffle(shuffled, new java.util.Random(7));
        ReconstructionResult random = reconstructor.reconstruct(shuffled, 3);

        assertEquals(sorted.getSecret(), reversed.getSecret());
        assertEquals(sorted.getSecret(), random.getSecret());
        assertEquals(sorted.getVotes(), reversed.getVotes());
        assertEquals(sorted.getVotes(), random.getVotes());
    }

    @Test
    public void repeatedShareholderCastsNoVote() {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        List<Share> shares = Arrays.asList(Share.of(1, 5), Share.of(1, 9), Share.of(2, 13), Share.of(3, 20));
        VoteTally tally = reconstructor.vote(shares, 3, Collections.singletonList(new int[]{0, 1, 2}));
        assertTrue(tally.isEmpty());

        tally = reconstructor.vote(shares, 3, Arrays.asList(new int[]{0, 1, 2}, new int[]{0, 2, 3}));
        assertEquals(1, tally.getTotalVotes());
        assertArrayEquals(new int[]{0, 2, 3}, tally.winner().orElseThrow().getWitness());
    }

    @Test
    public void subsetsOfTheWrongSizeAreRejected() {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        List<int[]> subsets = Arrays.asList(new int[]{0, 1, 2}, new int[]{0, 1});
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> reconstructor.vote(sharesWithOutlier(), 3, subsets));
        assertTrue(e.getMessage().contains("[0, 1]"));
        assertThrows(IllegalArgumentException.class,
                () -> reconstructor.vote(sharesWithOutlier(), 2, Collections.singletonList(new int[]{0, 1, 2})));

        try (SecretReconstructor parallel = new SecretReconstructor(new LagrangeInterpolation(), 2, 1)) {
            assertThrows(IllegalArgumentException.class, () -> parallel.vote(sharesWithOutlier(), 3, subsets));
        }
    }

    @Test
    public void noIntegralSubsetFailsTheRun() {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        List<Share> shares = Arrays.asList(Share.of(1, 0), Share.of(3, 1), Share.of(7, 4));
        SecretSharingException e = assertThrows(SecretSharingException.class,
                () -> reconstructor.reconstruct(shares, 2));
        assertEquals(FailureReason.NO_CONSISTENT_SUBSET, e.getReason());
    }

    @Test
    public void notEnoughShares() {
        SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation());
        SecretSharingException e = assertThrows(SecretSharingException.class,
                () -> reconstructor.reconstruct(sharesWithOutlier().subList(0, 2), 3));
        assertEquals(FailureReason.NOT_ENOUGH_SHARES, e.getReason());
        assertThrows(IllegalArgumentException.class, () -> reconstructor.reconstruct(sharesWithOutlier(), 0));
    }

    @Test
    public void parallelVotingMatchesSequentialVoting() throws SecretSharingException {
        List<Share> shares = new ArrayList<>(sharesWithOutlier());
        shares.add(Share.of(7, 166));
        shares.add(Share.of(8, 7));
        ReconstructionResult sequential = new SecretReconstructor(new LagrangeInterpolation())
                .reconstruct(shares, 3);
        ReconstructionResult parallel;
        try (SecretReconstructor reconstructor = new SecretReconstructor(new LagrangeInterpolation(), 3, 4)) {
            parallel = reconstructor.reconstruct(shares, 3);
        }
        assertEquals(FIVE, parallel.getSecret());
        assertEquals(sequential.getVotes(), parallel.getVotes());
        assertEquals(new ArrayList<>(sequential.getVotes().keySet()), new ArrayList<>(parallel.getVotes().keySet()));
        assertArrayEquals(sequential.getUsedIndices(), parallel.getUsedIndices());
    }
}
