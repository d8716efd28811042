package de.kherud.heatmap.image;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * {@link ImageMetadataReader} backed by the registered ImageIO readers. Only the
 * image header is read.
 */
public class ImageIOMetadataReader implements ImageMetadataReader {

	@Override
	public ImageSize readSize(Path imagePath) throws IOException {
		try (ImageInputStream in = ImageIO.createImageInputStream(imagePath.toFile())) {
			if (in == null) {
				throw new IOException("Cannot open image: " + imagePath);
			}
			Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
			if (!readers.hasNext()) {
				throw new IOException("No image reader for: " + imagePath);
			}
			ImageReader reader = readers.next();
			try {
				reader.setInput(in, true, true);
				return new ImageSize(reader.getWidth(0), reader.getHeight(0));
			} finally {
				reader.dispose();
			}
		}
	}
}
