package de.kherud.heatmap.image;

import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import java.util.Iterator;
import java.util.logging.Logger;

/**
 * The image runtime the tile writer depends on. Started once before the first tile
 * is written and closed exactly once afterwards, usually with try-with-resources
 * around the image generation phase.
 */
public final class TileImageRuntime implements AutoCloseable {
	private static final Logger LOGGER = Logger.getLogger(TileImageRuntime.class.getName());

	static final String FORMAT = "tiff";

	private final ImageWriter imageWriter;
	private final TiffTileWriter tileWriter;
	private volatile boolean closed = false;

	private TileImageRuntime(ImageWriter imageWriter, String compression) {
		this.imageWriter = imageWriter;
		this.tileWriter = new TiffTileWriter(imageWriter, compression);
	}

	/**
	 * Acquire a TIFF image writer.
	 *
	 * @param compression TIFF compression type, or null to write uncompressed
	 * @throws IllegalStateException if no TIFF writer is registered or the compression is unknown
	 */
	public static TileImageRuntime start(String compression) {
		LOGGER.info("Initializing the image runtime...");
		ImageIO.scanForPlugins();
		Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(FORMAT);
		if (!writers.hasNext()) {
			throw new IllegalStateException("No TIFF image writer available");
		}
		ImageWriter writer = writers.next();
		try {
			TiffTileWriter.checkCompression(writer, compression);
		} catch (IllegalStateException e) {
			writer.dispose();
			throw e;
		}
		return new TileImageRuntime(writer, compression);
	}

	public TileWriter tileWriter() {
		ensureNotClosed();
		return (outputFile, buffer) -> {
			ensureNotClosed();
			tileWriter.write(outputFile, buffer);
		};
	}

	public boolean isClosed() {
		return closed;
	}

	private void ensureNotClosed() {
		if (closed) {
			throw new IllegalStateException("Image runtime has been closed");
		}
	}

	@Override
	public void close() {
		if (!closed) {
			closed = true;
			imageWriter.dispose();
			LOGGER.info("Closed the image runtime");
		}
	}
}
