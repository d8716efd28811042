package de.kherud.heatmap.image;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.logging.Logger;

/**
 * Writes one constant-valued tile for every width, height and level combination.
 *
 * <p>Tiles are keyed by {@link TileName}; a tile whose file already exists is not
 * written again, so re-running over the same output directory only fills in
 * missing tiles.
 */
public class HeatmapImageGenerator {
	private static final Logger LOGGER = Logger.getLogger(HeatmapImageGenerator.class.getName());

	private final TileWriter tileWriter;

	public HeatmapImageGenerator(TileWriter tileWriter) {
		this.tileWriter = tileWriter;
	}

	/**
	 * Counts of tiles written and tiles found already present.
	 */
	public record GenerationResult(int written, int skipped) {
		public int total() {
			return written + skipped;
		}
	}

	public GenerationResult generate(Path outputDir, TileGeometry geometry, Collection<Integer> levels) throws IOException {
		Files.createDirectories(outputDir);
		int written = 0;
		int skipped = 0;

		for (int width : geometry.getWidths()) {
			for (int height : geometry.getHeights()) {
				for (int level : levels) {
					TileName name = new TileName(width, height, level);
					Path outFile = outputDir.resolve(name.fileName());
					if (Files.exists(outFile)) {
						skipped++;
						continue;
					}
					tileWriter.write(outFile, TileBuffer.filled(width, height, level));
					written++;
				}
			}
		}

		LOGGER.info(String.format("Heatmap tiles: %d written, %d already present", written, skipped));
		return new GenerationResult(written, skipped);
	}
}
