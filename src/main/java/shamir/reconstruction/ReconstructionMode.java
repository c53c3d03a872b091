package shamir.reconstruction;

public enum ReconstructionMode {
    /**
     * Exactly k shares, one interpolation
     */
    DIRECT,
    /**
     * Every k-subset of more than k shares votes for a secret
     */
    VOTING
}
