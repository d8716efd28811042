package de.kherud.heatmap.features;

/**
 * How feature rows are grouped into one mean per image.
 */
public enum GroupingMode {
	/**
	 * A group is a run of consecutive rows with the same file value. If the file
	 * appears again later, that run is a new group whose mean replaces the earlier
	 * one on the image, while both means count towards the feature's scale.
	 */
	CONTIGUOUS,

	/**
	 * All rows of a file within one CSV are reduced together, wherever they appear.
	 */
	BY_FILE
}
