package de.kherud.heatmap.stitch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A stitching-vector line that does not follow the expected field layout.
 */
public class StitchVectorFormatException extends IOException {

	private final Path file;
	private final int lineNumber;

	public StitchVectorFormatException(Path file, int lineNumber, String line) {
		super(String.format("Malformed stitching vector line %d in %s: %s", lineNumber, file, line));
		this.file = file;
		this.lineNumber = lineNumber;
	}

	public Path getFile() {
		return file;
	}

	/**
	 * @return 1-based line number in the vector file
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
