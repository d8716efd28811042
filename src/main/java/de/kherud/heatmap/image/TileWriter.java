package de.kherud.heatmap.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists one tile image.
 */
@FunctionalInterface
public interface TileWriter {

	/**
	 * Write {@code buffer} to {@code outputFile}, replacing nothing that is already
	 * complete: the file only appears once fully written.
	 */
	void write(Path outputFile, TileBuffer buffer) throws IOException;
}
