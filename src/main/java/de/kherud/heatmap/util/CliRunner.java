package de.kherud.heatmap.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the command line tools with a consistent mapping from failures to exit codes.
 * Tools throw instead of calling System.exit, so they stay testable and embeddable.
 */
public final class CliRunner {
	private static final Logger LOGGER = Logger.getLogger(CliRunner.class.getName());

	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_FAILURE = 2;

	private CliRunner() {
	}

	/**
	 * A command line tool that may fail with any exception.
	 */
	@FunctionalInterface
	public interface CliApplication {
		void run(String[] args) throws Exception;
	}

	/**
	 * Run a tool and terminate the JVM with its exit code.
	 *
	 * @param app The tool to run
	 * @param args Command line arguments
	 */
	public static void runWithExit(CliApplication app, String[] args) {
		int code = runWithoutExit(app, args);
		if (code != EXIT_OK) {
			System.exit(code);
		}
	}

	/**
	 * Run a tool without terminating the JVM.
	 *
	 * @param app The tool to run
	 * @param args Command line arguments
	 * @return {@link #EXIT_OK}, {@link #EXIT_USAGE} for invalid arguments, {@link #EXIT_FAILURE} otherwise
	 */
	public static int runWithoutExit(CliApplication app, String[] args) {
		try {
			app.run(args);
			return EXIT_OK;
		} catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		} catch (Exception e) {
			LOGGER.log(Level.SEVERE, "Fatal error: " + e.getMessage(), e);
			return EXIT_FAILURE;
		}
	}
}
