package de.kherud.heatmap.features;

import de.kherud.heatmap.ImageIndex;
import de.kherud.heatmap.ImageRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Turns per-image feature means into heatmap levels.
 *
 * <p>Reads the raw means of every record and writes one level per feature. Levels
 * are written once: scaling an index whose records already carry levels fails,
 * since the raw means would be scaled a second time.
 */
public class FeatureScaler {
	private static final Logger LOGGER = Logger.getLogger(FeatureScaler.class.getName());

	/**
	 * Scales of all features with at least one value, and the distinct levels assigned.
	 */
	public static final class ScalingResult {
		private final Map<String, FeatureScale> scales;
		private final SortedSet<Integer> levels;

		ScalingResult(Map<String, FeatureScale> scales, SortedSet<Integer> levels) {
			this.scales = Collections.unmodifiableMap(scales);
			this.levels = Collections.unmodifiableSortedSet(levels);
		}

		/**
		 * @return scales in feature order
		 */
		public Map<String, FeatureScale> getScales() {
			return scales;
		}

		public SortedSet<Integer> getLevels() {
			return levels;
		}
	}

	public ScalingResult scale(FeatureTable table, ImageIndex index) {
		Map<String, FeatureScale> scales = new LinkedHashMap<>();
		for (String feature : table.features()) {
			if (table.values(feature).isEmpty()) {
				LOGGER.warning("Feature has no numeric values, no heatmap is built for it: " + feature);
				continue;
			}
			FeatureScale scale = FeatureScale.of(feature, table.values(feature));
			scales.put(feature, scale);
			LOGGER.fine(() -> String.format("Feature %s: min=%s range=%s over %d images",
				feature, scale.min(), scale.range(), scale.count()));
		}

		for (ImageRecord record : index.records()) {
			if (record.hasFeatureLevels()) {
				throw new IllegalStateException("Image already scaled: " + record.getFileName());
			}
		}

		SortedSet<Integer> levels = new TreeSet<>();
		for (ImageRecord record : index.records()) {
			for (Map.Entry<String, Double> value : record.getFeatureValues().entrySet()) {
				FeatureScale scale = scales.get(value.getKey());
				if (scale == null) {
					continue;
				}
				int level = scale.level(value.getValue());
				record.putFeatureLevel(value.getKey(), level);
				levels.add(level);
			}
		}

		LOGGER.info(String.format("Scaled %d features into %d distinct levels", scales.size(), levels.size()));
		return new ScalingResult(scales, levels);
	}
}
