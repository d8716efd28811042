package de.kherud.heatmap.features;

/**
 * Global scale of one feature across all image means.
 *
 * @param min smallest mean
 * @param range largest mean minus smallest mean
 * @param count number of means the scale was computed from
 */
public record FeatureScale(String feature, double min, double range, int count) {

	public static final int DEGENERATE_LEVEL = 0;
	public static final int MIN_LEVEL = 1;
	public static final int MAX_LEVEL = 255;

	public static FeatureScale of(String feature, Iterable<Double> values) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		int count = 0;
		for (double v : values) {
			min = Math.min(min, v);
			max = Math.max(max, v);
			count++;
		}
		if (count == 0) {
			throw new IllegalArgumentException("No values for feature: " + feature);
		}
		return new FeatureScale(feature, min, max - min, count);
	}

	public boolean isDegenerate() {
		return range == 0;
	}

	/**
	 * Map a mean onto the level range. A zero range gives {@value #DEGENERATE_LEVEL};
	 * otherwise the result is {@code rint((value - min) / range * 254 + 1)}, which is
	 * in [1, 255] for values inside the scale. Halves round to the even level.
	 * Dividing first keeps the fraction in [0, 1] so large values cannot overflow.
	 */
	public int level(double value) {
		if (isDegenerate()) {
			return DEGENERATE_LEVEL;
		}
		double scaled = (value - min) / range * (MAX_LEVEL - MIN_LEVEL) + MIN_LEVEL;
		return (int) Math.rint(scaled);
	}
}
