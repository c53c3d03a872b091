package shamir.benchmark;

public class Measurement {
	private long totalTime;
	private final int nTests;
	private long start;

	public Measurement(int nTests) {
		this.nTests = nTests;
	}

	public double getAverageInMillis(int nDecimals) {
		double scale = Math.pow(10, nDecimals);
		return Math.round(((double) totalTime / nTests / 1_000_000.0) * scale) / scale;
	}

	public void start() {
		start = System.nanoTime();
	}

	public void stop() {
		totalTime += System.nanoTime() - start;
	}
}
