package shamir;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.interpolation.GaussianInterpolation;
import shamir.interpolation.InterpolationStrategy;
import shamir.interpolation.LagrangeInterpolation;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

public final class Configuration {
	private static final Logger logger = LoggerFactory.getLogger("configuration");
	private static String configurationFilePath =
			"config" + File.separator + "reconstruction.config";
	private String interpolation = Constants.VALUE_LAGRANGE;
	private int votingThreads = Constants.DEFAULT_VOTING_THREADS;
	private int votingBatchSize = Constants.DEFAULT_VOTING_BATCH_SIZE;

	private static Configuration INSTANT;

	public static synchronized void setConfigurationFilePath(String configurationFilePath) {
		Configuration.configurationFilePath = configurationFilePath;
		INSTANT = null;
	}

	public static synchronized Configuration getInstance() {
		if (INSTANT == null) {
			try {
				INSTANT = load(configurationFilePath);
			} catch (FileNotFoundException e) {
				logger.warn("Configuration file {} not found, using defaults", configurationFilePath);
				INSTANT = new Configuration();
			} catch (IOException e) {
				throw new UncheckedIOException("Failed to read configuration file " + configurationFilePath, e);
			}
		}
		return INSTANT;
	}

	/**
	 * Reads a configuration file without touching the shared instance
	 * @param configurationFilePath Path of the file
	 * @return Parsed configuration
	 * @throws IOException When the file cannot be read
	 */
	public static Configuration load(String configurationFilePath) throws IOException {
		try (Reader in = new FileReader(configurationFilePath)) {
			return load(in);
		}
	}

	public static Configuration load(Reader reader) throws IOException {
		Configuration configuration = new Configuration();
		BufferedReader in = new BufferedReader(reader);
		String line;
		while ((line = in.readLine()) != null) {
			if (line.startsWith("#")) {
				continue;
			}
			String[] tokens = line.split("=");
			if (tokens.length != 2)
				continue;
			String propertyName = tokens[0].trim();
			String value = tokens[1].trim();
			switch (propertyName) {
				case Constants.TAG_INTERPOLATION:
					if (!value.equals(Constants.VALUE_LAGRANGE) && !value.equals(Constants.VALUE_GAUSSIAN))
						throw new IllegalArgumentException("Property " + Constants.TAG_INTERPOLATION +
								" has invalid value " + value);
					configuration.interpolation = value;
					break;
				case Constants.TAG_VOTING_THREADS:
					configuration.votingThreads = parsePositive(propertyName, value);
					break;
				case Constants.TAG_VOTING_BATCH_SIZE:
					configuration.votingBatchSize = parsePositive(propertyName, value);
					break;
				default:
					throw new IllegalArgumentException("Unknown property name " + propertyName);
			}
		}
		logger.debug("Loaded configuration: interpolation={}, voting threads={}, voting batch size={}",
				configuration.interpolation, configuration.votingThreads, configuration.votingBatchSize);
		return configuration;
	}

	private static int parsePositive(String propertyName, String value) {
		int result;
		try {
			result = Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Property " + propertyName + " has invalid value " + value, e);
		}
		if (result < 1)
			throw new IllegalArgumentException("Property " + propertyName + " must be at least 1");
		return result;
	}

	private Configuration() {}

	/**
	 * Creates the interpolation strategy with the given name
	 * @param name {@link Constants#VALUE_LAGRANGE} or {@link Constants#VALUE_GAUSSIAN}
	 * @return Interpolation strategy
	 */
	public static InterpolationStrategy createInterpolationStrategy(String name) {
		if (Constants.VALUE_LAGRANGE.equals(name))
			return new LagrangeInterpolation();
		if (Constants.VALUE_GAUSSIAN.equals(name))
			return new GaussianInterpolation();
		throw new IllegalArgumentException("Unknown interpolation strategy " + name);
	}

	public InterpolationStrategy getInterpolationStrategy() {
		return createInterpolationStrategy(interpolation);
	}

	public String getInterpolation() {
		return interpolation;
	}

	public int getVotingThreads() {
		return votingThreads;
	}

	public int getVotingBatchSize() {
		return votingBatchSize;
	}
}
