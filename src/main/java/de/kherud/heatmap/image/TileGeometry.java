package de.kherud.heatmap.image;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Distinct tile widths and heights seen in the stitching vectors.
 *
 * <p>Widths and heights are collected independently. Every seen width is combined
 * with every seen height when tiles are generated, including pairs that no
 * single image has.
 */
public final class TileGeometry {

	private final SortedSet<Integer> widths = new TreeSet<>();
	private final SortedSet<Integer> heights = new TreeSet<>();

	public void add(int width, int height) {
		widths.add(width);
		heights.add(height);
	}

	public SortedSet<Integer> getWidths() {
		return Collections.unmodifiableSortedSet(widths);
	}

	public SortedSet<Integer> getHeights() {
		return Collections.unmodifiableSortedSet(heights);
	}

	public boolean isEmpty() {
		return widths.isEmpty();
	}

	/**
	 * @return number of width and height combinations
	 */
	public int combinations() {
		return widths.size() * heights.size();
	}

	@Override
	public String toString() {
		return "TileGeometry{widths=" + widths + ", heights=" + heights + "}";
	}
}
