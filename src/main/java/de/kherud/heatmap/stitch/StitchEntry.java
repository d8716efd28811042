package de.kherud.heatmap.stitch;

/**
 * One parsed stitching-vector line. The correlation is kept as written so it is
 * reproduced verbatim in rewritten vectors.
 */
public record StitchEntry(String fileName, String correlation, int posX, int posY, int gridX, int gridY) {

	/**
	 * The same position and grid fields, pointing at a different file.
	 */
	public StitchEntry withFileName(String otherFileName) {
		return new StitchEntry(otherFileName, correlation, posX, posY, gridX, gridY);
	}
}
