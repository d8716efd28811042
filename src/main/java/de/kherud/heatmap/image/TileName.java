package de.kherud.heatmap.image;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming convention for heatmap tiles: {@code {width}_{height}_{level}.ome.tif}.
 * A tile is identified by its key alone, never by its pixel content.
 */
public record TileName(int width, int height, int level) {

	public static final String EXTENSION = ".ome.tif";
	private static final Pattern PATTERN = Pattern.compile("(\\d+)_(\\d+)_(\\d+)" + Pattern.quote(EXTENSION));

	public TileName {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Tile dimensions must be positive: " + width + "x" + height);
		}
		if (level < 0 || level > 255) {
			throw new IllegalArgumentException("Tile level must be between 0 and 255: " + level);
		}
	}

	/**
	 * Recover the tile key from a file name.
	 *
	 * @throws IllegalArgumentException if the name does not follow the convention
	 */
	public static TileName parse(String fileName) {
		Matcher m = PATTERN.matcher(fileName);
		if (!m.matches()) {
			throw new IllegalArgumentException("Not a heatmap tile name: " + fileName);
		}
		try {
			return new TileName(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Not a heatmap tile name: " + fileName, e);
		}
	}

	public String fileName() {
		return width + "_" + height + "_" + level + EXTENSION;
	}

	@Override
	public String toString() {
		return fileName();
	}
}
