package de.kherud.heatmap.stitch;

import de.kherud.heatmap.ImageIndex;
import de.kherud.heatmap.ImageRecord;
import de.kherud.heatmap.image.ImageMetadataReader;
import de.kherud.heatmap.image.TileGeometry;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Attaches stitching-vector positions and image sizes to the image index.
 *
 * <p>Reads every {@code *-global-positions-<N>.txt} file of a directory. For each
 * line naming an indexed image it writes the position, grid, vector id and line
 * index into the record, then reads the image size. Lines naming other files are
 * skipped. The line index is the ordinal of the line among the matched lines of
 * its vector.
 */
public class StitchVectorIndex {
	private static final Logger LOGGER = Logger.getLogger(StitchVectorIndex.class.getName());

	private final ImageMetadataReader metadataReader;
	private final int progressInterval;

	public StitchVectorIndex(ImageMetadataReader metadataReader, int progressInterval) {
		if (progressInterval <= 0) {
			throw new IllegalArgumentException("Progress interval must be positive");
		}
		this.metadataReader = metadataReader;
		this.progressInterval = progressInterval;
	}

	/**
	 * Parse all vector files in {@code vectorDir} into {@code index}.
	 *
	 * @return the distinct widths and heights of the matched images
	 * @throws StitchVectorFormatException if a line does not follow the vector format
	 */
	public TileGeometry parse(Path vectorDir, ImageIndex index) throws IOException {
		List<Path> vectors = listVectorFiles(vectorDir);
		LOGGER.info(String.format("Found %d stitching vectors in %s", vectors.size(), vectorDir));

		TileGeometry geometry = new TileGeometry();
		int matched = 0;
		for (Path vector : vectors) {
			matched += parseVector(vector, index, geometry, matched);
		}

		LOGGER.info(String.format("Matched %d stitching vector lines, %s", matched, geometry));
		return geometry;
	}

	/**
	 * @return number of lines that matched an indexed image
	 */
	private int parseVector(Path vector, ImageIndex index, TileGeometry geometry, int matchedBefore) throws IOException {
		int vectorId = StitchVectorFormat.vectorId(vector.getFileName().toString());
		int lineIndex = 0;
		int lineNumber = 0;

		try (BufferedReader reader = Files.newBufferedReader(vector, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (line.isBlank()) {
					continue;
				}

				StitchEntry entry = StitchVectorFormat.parseLine(line);
				if (entry == null) {
					throw new StitchVectorFormatException(vector, lineNumber, line);
				}

				ImageRecord record = index.get(entry.fileName());
				if (record == null) {
					LOGGER.fine(() -> "Skipping image outside the collection: " + entry.fileName());
					continue;
				}

				record.setStitchPosition(entry, vectorId, lineIndex++);
				ImageMetadataReader.ImageSize size = metadataReader.readSize(record.getPath());
				record.setSize(size.width(), size.height());
				geometry.add(size.width(), size.height());

				int total = matchedBefore + lineIndex;
				if (total % progressInterval == 0) {
					LOGGER.info("Files parsed: " + total);
				}
			}
		}
		return lineIndex;
	}

	static List<Path> listVectorFiles(Path vectorDir) throws IOException {
		try (Stream<Path> files = Files.list(vectorDir)) {
			return files.filter(Files::isRegularFile)
				.filter(p -> StitchVectorFormat.vectorId(p.getFileName().toString()) >= 0)
				.sorted()
				.collect(Collectors.toList());
		}
	}
}
