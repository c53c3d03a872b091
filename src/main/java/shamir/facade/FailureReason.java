package shamir.facade;

/**
 * Kinds of reconstruction failures. None of them is transient, so none is worth retrying.
 */
public enum FailureReason {
    DIVISION_BY_ZERO,
    NON_INTEGER_RESULT,
    SINGULAR_SYSTEM,
    NO_CONSISTENT_SUBSET,
    WRONG_SUBSET_SIZE,
    UNKNOWN_KEY,
    DUPLICATE_KEY,
    NOT_ENOUGH_SHARES,
    INVALID_ENCODING,
    INVALID_INPUT
}
