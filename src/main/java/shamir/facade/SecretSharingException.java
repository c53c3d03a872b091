package shamir.facade;

/**
 * Signals that a secret could not be reconstructed from a set of shares.
 * The {@link FailureReason} tells callers which structural property of the input caused it.
 */
public class SecretSharingException extends Exception {
	private static final long serialVersionUID = 1L;

	private final FailureReason reason;

	public SecretSharingException(FailureReason reason, String msg) {
		super(msg);
		this.reason = reason;
	}

	public SecretSharingException(FailureReason reason, String msg, Throwable throwable) {
		super(msg, throwable);
		this.reason = reason;
	}

	public FailureReason getReason() {
		return reason;
	}
}
