package shamir.reconstruction;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Counts how many subsets produced each candidate secret.
 * Each candidate remembers its witness: the first subset, in enumeration order, that produced it.
 * A tally belongs to a single reconstruction call and is not thread safe.
 */
public class VoteTally {
    private final Map<BigInteger, Candidate> candidates;

    public VoteTally() {
        this.candidates = new LinkedHashMap<>();
    }

    /**
     * Registers one vote
     * @param value Secret produced by the subset
     * @param subset Indices of the subset
     * @param ordinal Position of the subset in enumeration order
     */
    public void record(BigInteger value, int[] subset, long ordinal) {
        Candidate candidate = candidates.get(value);
        if (candidate == null) {
            candidates.put(value, new Candidate(value, 1, subset, ordinal));
        } else if (ordinal < candidate.getWitnessOrdinal()) {
            candidates.put(value, new Candidate(value, candidate.getVotes() + 1, subset, ordinal));
        } else {
            candidates.put(value, candidate.withVotes(candidate.getVotes() + 1));
        }
    }

    /**
     * Adds the votes of other to this tally. Witnesses with the lowest ordinal are kept.
     * @param other Tally computed over a disjoint set of subsets
     */
    public void merge(VoteTally other) {
        for (Candidate theirs : other.candidates.values()) {
            Candidate ours = candidates.get(theirs.getValue());
            if (ours == null) {
                candidates.put(theirs.getValue(), theirs);
            } else {
                Candidate earliest = ours.getWitnessOrdinal() <= theirs.getWitnessOrdinal() ? ours : theirs;
                candidates.put(ours.getValue(), earliest.withVotes(ours.getVotes() + theirs.getVotes()));
            }
        }
    }

    /**
     * Candidate with the strictly highest number of votes. Ties go to the candidate seen first.
     * @return Winner, or empty if no subset voted
     */
    public Optional<Candidate> winner() {
        Candidate best = null;
        for (Candidate candidate : candidates.values()) {
            if (best == null || candidate.getVotes() > best.getVotes()
                    || (candidate.getVotes() == best.getVotes()
                    && candidate.getWitnessOrdinal() < best.getWitnessOrdinal()))
                best = candidate;
        }
        return Optional.ofNullable(best);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int getTotalVotes() {
        int total = 0;
        for (Candidate candidate : candidates.values()) {
            total += candidate.getVotes();
        }
        return total;
    }

    /**
     * @return Candidate value to number of votes, in first-seen order
     */
    public Map<BigInteger, Integer> getSupport() {
        Map<BigInteger, Integer> support = new LinkedHashMap<>();
        candidates.values().stream()
                .sorted((c1, c2) -> Long.compare(c1.getWitnessOrdinal(), c2.getWitnessOrdinal()))
                .forEach(c -> support.put(c.getValue(), c.getVotes()));
        return Collections.unmodifiableMap(support);
    }

    /**
     * One candidate secret with its support
     */
    public static final class Candidate {
        private final BigInteger value;
        private final int votes;
        private final int[] witness;
        private final long witnessOrdinal;

        Candidate(BigInteger value, int votes, int[] witness, long witnessOrdinal) {
            this.value = value;
            this.votes = votes;
            this.witness = Arrays.copyOf(witness, witness.length);
            this.witnessOrdinal = witnessOrdinal;
        }

        private Candidate withVotes(int votes) {
            return new Candidate(value, votes, witness, witnessOrdinal);
        }

        public BigInteger getValue() {
            return value;
        }

        public int getVotes() {
            return votes;
        }

        public int[] getWitness() {
            return Arrays.copyOf(witness, witness.length);
        }

        public long getWitnessOrdinal() {
            return witnessOrdinal;
        }

        @Override
        public String toString() {
            return value + " (" + votes + " votes, witness " + Arrays.toString(witness) + ")";
        }
    }
}
