package de.kherud.heatmap.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Console logging for the command line tools.
 */
public final class LoggingSetup {
	public static final String ROOT_LOGGER = "de.kherud.heatmap";
	static final String CONFIG_RESOURCE = "/heatmap-logging.properties";

	private LoggingSetup() {
	}

	/**
	 * Load the bundled logging configuration unless the JVM was started with
	 * {@code java.util.logging.config.file}.
	 *
	 * @param verbose lower the tool loggers to FINE
	 */
	public static void configure(boolean verbose) throws IOException {
		if (System.getProperty("java.util.logging.config.file") == null) {
			try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
				if (in != null) {
					LogManager.getLogManager().readConfiguration(in);
				}
			}
		}
		if (verbose) {
			Logger.getLogger(ROOT_LOGGER).setLevel(Level.FINE);
		}
	}
}
