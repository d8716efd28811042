package de.kherud.heatmap.stitch;

import de.kherud.heatmap.ImageIndex;
import de.kherud.heatmap.ImageRecord;
import de.kherud.heatmap.image.TileName;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Writes one stitching vector per feature in which every image is replaced by the
 * heatmap tile of its size and level. Position, grid and correlation are copied
 * from the source vector; lines follow source vector id and line order.
 */
public class OutputVectorWriter {
	private static final Logger LOGGER = Logger.getLogger(OutputVectorWriter.class.getName());

	/**
	 * One written vector.
	 *
	 * @param number 1-based position of the feature, also the vector id in the file name
	 */
	public record VectorOutput(String feature, int number, Path file, int lines) {
	}

	public List<VectorOutput> write(Path outputDir, ImageIndex index, Iterable<String> features) throws IOException {
		Files.createDirectories(outputDir);
		List<ImageRecord> ordered = index.stitchedInVectorOrder();
		List<VectorOutput> outputs = new ArrayList<>();

		int number = 0;
		for (String feature : features) {
			number++;
			Path file = outputDir.resolve(StitchVectorFormat.vectorFileName(number));
			int lines = writeVector(file, ordered, feature);
			outputs.add(new VectorOutput(feature, number, file, lines));
			LOGGER.info(String.format("Wrote %d lines for feature %s to %s", lines, feature, file.getFileName()));
		}
		return outputs;
	}

	private int writeVector(Path file, List<ImageRecord> ordered, String feature) throws IOException {
		int lines = 0;
		try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			for (ImageRecord record : ordered) {
				OptionalInt level = record.getFeatureLevel(feature);
				if (level.isEmpty()) {
					continue;
				}
				TileName tile = new TileName(record.getWidth(), record.getHeight(), level.getAsInt());
				writer.write(StitchVectorFormat.formatLine(record.getStitch().withFileName(tile.fileName())));
				writer.write('\n');
				lines++;
			}
		}
		return lines;
	}
}
