package de.kherud.heatmap;

import de.kherud.heatmap.stitch.StitchEntry;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * One source image of the collection and everything the pipeline learns about it.
 *
 * <p>Field ownership:
 * <ul>
 *   <li>stitching position, vector id, line index, width and height are written by
 *   {@link de.kherud.heatmap.stitch.StitchVectorIndex}</li>
 *   <li>feature means are written by {@link de.kherud.heatmap.features.FeatureAggregator}</li>
 *   <li>feature levels are written once by {@link de.kherud.heatmap.features.FeatureScaler}</li>
 * </ul>
 */
public final class ImageRecord {

	private final String fileName;
	private final Path path;

	private StitchEntry stitch;
	private int vectorId = -1;
	private int lineIndex = -1;
	private int width;
	private int height;

	private final Map<String, Double> featureValues = new LinkedHashMap<>();
	private final Map<String, Integer> featureLevels = new LinkedHashMap<>();

	public ImageRecord(Path path) {
		this.path = path;
		this.fileName = path.getFileName().toString();
	}

	public String getFileName() {
		return fileName;
	}

	public Path getPath() {
		return path;
	}

	public void setStitchPosition(StitchEntry entry, int vectorId, int lineIndex) {
		this.stitch = entry;
		this.vectorId = vectorId;
		this.lineIndex = lineIndex;
	}

	public void setSize(int width, int height) {
		this.width = width;
		this.height = height;
	}

	/**
	 * @return true once a stitching-vector line has matched this image
	 */
	public boolean isStitched() {
		return stitch != null;
	}

	@Nullable
	public StitchEntry getStitch() {
		return stitch;
	}

	public int getVectorId() {
		return vectorId;
	}

	public int getLineIndex() {
		return lineIndex;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * Store the mean of a feature, replacing any earlier mean for the same feature.
	 */
	public void putFeatureValue(String feature, double mean) {
		featureValues.put(feature, mean);
	}

	@Nullable
	public Double getFeatureValue(String feature) {
		return featureValues.get(feature);
	}

	public Map<String, Double> getFeatureValues() {
		return Collections.unmodifiableMap(featureValues);
	}

	public void putFeatureLevel(String feature, int level) {
		featureLevels.put(feature, level);
	}

	public OptionalInt getFeatureLevel(String feature) {
		Integer level = featureLevels.get(feature);
		return level == null ? OptionalInt.empty() : OptionalInt.of(level);
	}

	public boolean hasFeatureLevels() {
		return !featureLevels.isEmpty();
	}

	@Override
	public String toString() {
		return String.format("ImageRecord{file=%s, vector=%d, line=%d, size=%dx%d, features=%s}",
			fileName, vectorId, lineIndex, width, height, featureValues.keySet());
	}
}
