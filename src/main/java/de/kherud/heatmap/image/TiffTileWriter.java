package de.kherud.heatmap.image;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Locale;

/**
 * Writes 8-bit grayscale TIFF tiles carrying an OME-XML image description.
 * Tiles are written to a temporary file and moved into place, so an interrupted
 * run never leaves a truncated tile under its final name.
 */
class TiffTileWriter implements TileWriter {

	private static final String OME_XML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
		+ "<OME xmlns=\"http://www.openmicroscopy.org/Schemas/OME/2016-06\">"
		+ "<Image ID=\"Image:0\" Name=\"%s\">"
		+ "<Pixels ID=\"Pixels:0\" DimensionOrder=\"XYZCT\" Type=\"uint8\""
		+ " SizeX=\"%d\" SizeY=\"%d\" SizeZ=\"1\" SizeC=\"1\" SizeT=\"1\">"
		+ "<Channel ID=\"Channel:0:0\" SamplesPerPixel=\"1\"/>"
		+ "<TiffData IFD=\"0\" PlaneCount=\"1\"/>"
		+ "</Pixels></Image></OME>";

	private final ImageWriter writer;
	private final String compression;

	TiffTileWriter(ImageWriter writer, String compression) {
		this.writer = writer;
		this.compression = compression;
	}

	static void checkCompression(ImageWriter writer, String compression) {
		if (compression == null) {
			return;
		}
		String[] types = writer.getDefaultWriteParam().getCompressionTypes();
		if (types == null || !Arrays.asList(types).contains(compression)) {
			throw new IllegalStateException("Unsupported TIFF compression: " + compression
				+ (types == null ? "" : ", expected one of " + Arrays.toString(types)));
		}
	}

	@Override
	public void write(Path outputFile, TileBuffer buffer) throws IOException {
		if (buffer.getChannels() != 1) {
			throw new IllegalArgumentException("Heatmap tiles are single channel, got " + buffer.getChannels());
		}

		BufferedImage image = new BufferedImage(buffer.getWidth(), buffer.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
		byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
		System.arraycopy(buffer.getData(), 0, pixels, 0, pixels.length);

		ImageWriteParam param = writer.getDefaultWriteParam();
		if (compression != null) {
			param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
			param.setCompressionType(compression);
		}
		IIOMetadata metadata = withDescription(
			writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param),
			omeXml(outputFile.getFileName().toString(), buffer.getWidth(), buffer.getHeight()));

		Path temp = outputFile.resolveSibling(outputFile.getFileName() + ".part");
		Files.deleteIfExists(temp);
		try {
			try (ImageOutputStream out = ImageIO.createImageOutputStream(temp.toFile())) {
				if (out == null) {
					throw new IOException("Cannot open output stream: " + temp);
				}
				writer.setOutput(out);
				writer.write(null, new IIOImage(image, null, metadata), param);
			} finally {
				writer.reset();
			}
			moveIntoPlace(temp, outputFile);
		} finally {
			Files.deleteIfExists(temp);
		}
	}

	private static IIOMetadata withDescription(IIOMetadata metadata, String description) throws IOException {
		TIFFDirectory directory = TIFFDirectory.createFromMetadata(metadata);
		TIFFTag tag = BaselineTIFFTagSet.getInstance().getTag(BaselineTIFFTagSet.TAG_IMAGE_DESCRIPTION);
		directory.addTIFFField(new TIFFField(tag, TIFFTag.TIFF_ASCII, 1, new String[]{description}));
		return directory.getAsMetadata();
	}

	static String omeXml(String name, int width, int height) {
		return String.format(Locale.ROOT, OME_XML, name, width, height);
	}

	private static void moveIntoPlace(Path temp, Path target) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
