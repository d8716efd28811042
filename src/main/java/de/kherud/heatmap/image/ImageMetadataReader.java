package de.kherud.heatmap.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads pixel dimensions of an image without decoding its pixels.
 */
@FunctionalInterface
public interface ImageMetadataReader {

	/**
	 * @return width and height of the first image in the file
	 * @throws IOException if the file cannot be opened or no reader understands it
	 */
	ImageSize readSize(Path imagePath) throws IOException;

	record ImageSize(int width, int height) {
	}
}
