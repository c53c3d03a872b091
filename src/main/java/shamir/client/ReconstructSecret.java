package shamir.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.Configuration;
import shamir.arithmetic.Rational;
import shamir.facade.SecretSharingException;
import shamir.input.TestCase;
import shamir.input.TestCaseReader;
import shamir.interpolation.InterpolationStrategy;
import shamir.polynomial.Polynomial;
import shamir.reconstruction.ReconstructionMode;
import shamir.reconstruction.ReconstructionResult;
import shamir.reconstruction.SecretReconstructor;

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * Usage: ReconstructSecret &lt;testCase.json&gt; [--find-consistent] [--pick x1,x2,...]
 * [--strategy lagrange|gaussian] [--config file]
 */
public class ReconstructSecret {
    private static final Logger logger = LoggerFactory.getLogger("reconstruction");
    private static final String USAGE = "Usage: ReconstructSecret <testCase.json> [--find-consistent] " +
            "[--pick x1,x2,...] [--strategy lagrange|gaussian] [--config file]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the command and returns its exit status: 0 on success, 1 on reconstruction errors, 2 on usage errors
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String file = null;
        boolean findConsistent = false;
        List<BigInteger> picked = null;
        String strategy = null;
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--find-consistent":
                        findConsistent = true;
                        break;
                    case "--pick":
                        picked = parsePick(argumentOf(args, ++i, "--pick"));
                        break;
                    case "--strategy":
                        strategy = argumentOf(args, ++i, "--strategy");
                        break;
                    case "--config":
                        Configuration.setConfigurationFilePath(argumentOf(args, ++i, "--config"));
                        break;
                    default:
                        if (args[i].startsWith("--") || file != null)
                            throw new IllegalArgumentException("Unexpected argument " + args[i]);
                        file = args[i];
                }
            }
            if (file == null)
                throw new IllegalArgumentException("Missing test case file");
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        Configuration configuration;
        InterpolationStrategy interpolationStrategy;
        try {
            configuration = Configuration.getInstance();
            interpolationStrategy = strategy == null ? configuration.getInterpolationStrategy()
                    : Configuration.createInterpolationStrategy(strategy);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        try (SecretReconstructor reconstructor = new SecretReconstructor(interpolationStrategy,
                configuration.getVotingThreads(), configuration.getVotingBatchSize())) {
            TestCase testCase = TestCaseReader.read(Paths.get(file));
            ReconstructionResult result = picked == null
                    ? reconstructor.reconstruct(testCase.getShares(), testCase.getK())
                    : reconstructor.reconstruct(testCase.getShares(), testCase.getK(), picked);

            out.println("constant = " + result.getSecret());
            if (findConsistent)
                printSummary(out, testCase, result);
            return 0;
        } catch (IOException | SecretSharingException e) {
            logger.error("Failed to reconstruct secret from {}: {}", file, e.getMessage());
            logger.debug("Reconstruction failure", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printSummary(PrintStream out, TestCase testCase, ReconstructionResult result) {
        int[] used = result.getUsedIndices();
        List<BigInteger> shareholders = new ArrayList<>(used.length);
        for (int index : used) {
            shareholders.add(testCase.getShares().get(index).getShareholder());
        }
        out.println("used shareholders = " + shareholders + " (indices " + Arrays.toString(used) + ")");
        Polynomial polynomial = result.getPolynomial();
        out.println("degree = " + polynomial.getDegree());
        Rational[] coefficients = polynomial.getCoefficients();
        for (int i = 0; i < coefficients.length; i++) {
            out.println("a_" + (coefficients.length - 1 - i) + " = " + coefficients[i]);
        }
        if (result.getMode() == ReconstructionMode.VOTING) {
            for (Map.Entry<BigInteger, Integer> vote : result.getVotes().entrySet()) {
                out.println("votes[" + vote.getKey() + "] = " + vote.getValue());
            }
        }
    }

    private static String argumentOf(String[] args, int i, String option) {
        if (i >= args.length)
            throw new IllegalArgumentException("Option " + option + " needs a value");
        return args[i];
    }

    private static List<BigInteger> parsePick(String value) {
        List<BigInteger> picked = new ArrayList<>();
        for (String token : value.split(",")) {
            if (token.trim().isEmpty())
                continue;
            try {
                picked.add(new BigInteger(token.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid shareholder in --pick: " + token, e);
            }
        }
        return picked;
    }
}
