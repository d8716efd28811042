package de.kherud.heatmap;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.heatmap.features.FeatureScale;
import de.kherud.heatmap.image.HeatmapImageGenerator;
import de.kherud.heatmap.image.TileGeometry;
import de.kherud.heatmap.stitch.OutputVectorWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Summary of a heatmap build, written next to the output vectors so the numbered
 * vector files can be traced back to their features.
 */
public class HeatmapManifest {
	public static final String FILE_NAME = "heatmap-manifest.json";

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private final int images;
	private final TileGeometry geometry;
	private final SortedSet<Integer> levels;
	private final Map<String, FeatureScale> scales;
	private final List<OutputVectorWriter.VectorOutput> vectors;
	private final HeatmapImageGenerator.GenerationResult tiles;

	public HeatmapManifest(int images, TileGeometry geometry, SortedSet<Integer> levels,
	                       Map<String, FeatureScale> scales, List<OutputVectorWriter.VectorOutput> vectors,
	                       HeatmapImageGenerator.GenerationResult tiles) {
		this.images = images;
		this.geometry = geometry;
		this.levels = levels;
		this.scales = scales;
		this.vectors = vectors;
		this.tiles = tiles;
	}

	public Map<String, Object> toJson() {
		Map<String, Object> output = new LinkedHashMap<>();
		output.put("images", images);
		output.put("widths", geometry.getWidths());
		output.put("heights", geometry.getHeights());
		output.put("levels", levels);

		Map<String, Object> tileCounts = new LinkedHashMap<>();
		tileCounts.put("written", tiles.written());
		tileCounts.put("skipped", tiles.skipped());
		output.put("tiles", tileCounts);

		List<Map<String, Object>> features = new ArrayList<>();
		for (OutputVectorWriter.VectorOutput vector : vectors) {
			FeatureScale scale = scales.get(vector.feature());
			Map<String, Object> feature = new LinkedHashMap<>();
			feature.put("feature", vector.feature());
			feature.put("vector", vector.file().getFileName().toString());
			feature.put("lines", vector.lines());
			feature.put("min", scale.min());
			feature.put("range", scale.range());
			feature.put("count", scale.count());
			features.add(feature);
		}
		output.put("features", features);
		return output;
	}

	public Path write(Path outputDir) throws IOException {
		Path file = outputDir.resolve(FILE_NAME);
		objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toJson());
		return file;
	}

	public int getImages() {
		return images;
	}

	public TileGeometry getGeometry() {
		return geometry;
	}

	public SortedSet<Integer> getLevels() {
		return levels;
	}

	public Map<String, FeatureScale> getScales() {
		return scales;
	}

	public List<OutputVectorWriter.VectorOutput> getVectors() {
		return vectors;
	}

	public HeatmapImageGenerator.GenerationResult getTiles() {
		return tiles;
	}
}
