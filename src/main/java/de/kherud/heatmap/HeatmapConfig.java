package de.kherud.heatmap;

import de.kherud.heatmap.features.GroupingMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Options of a heatmap build.
 */
public class HeatmapConfig {
	public static final String DEFAULT_FILE_PATTERN = ".*\\.tif";
	public static final int DEFAULT_PROGRESS_INTERVAL = 1000;
	public static final String DEFAULT_COMPRESSION = "Deflate";

	private Path featureDir;
	private Path imageDir;
	private Path vectorDir;
	private Path outputImageDir;
	private Path outputVectorDir;
	private String filePattern = DEFAULT_FILE_PATTERN;
	private GroupingMode groupingMode = GroupingMode.CONTIGUOUS;
	private int progressInterval = DEFAULT_PROGRESS_INTERVAL;
	private String compression = DEFAULT_COMPRESSION;
	private boolean verbose = false;

	public HeatmapConfig featureDir(Path dir) {
		this.featureDir = dir;
		return this;
	}

	public HeatmapConfig imageDir(Path dir) {
		this.imageDir = dir;
		return this;
	}

	public HeatmapConfig vectorDir(Path dir) {
		this.vectorDir = dir;
		return this;
	}

	public HeatmapConfig outputImageDir(Path dir) {
		this.outputImageDir = dir;
		return this;
	}

	public HeatmapConfig outputVectorDir(Path dir) {
		this.outputVectorDir = dir;
		return this;
	}

	/**
	 * Regular expression that image file names in the input directory must fully match.
	 */
	public HeatmapConfig filePattern(String pattern) {
		this.filePattern = pattern;
		return this;
	}

	public HeatmapConfig groupingMode(GroupingMode mode) {
		this.groupingMode = mode;
		return this;
	}

	public HeatmapConfig progressInterval(int interval) {
		this.progressInterval = interval;
		return this;
	}

	/**
	 * TIFF compression type of the written tiles, or null for none.
	 */
	public HeatmapConfig compression(String compression) {
		this.compression = compression;
		return this;
	}

	public HeatmapConfig verbose(boolean verbose) {
		this.verbose = verbose;
		return this;
	}

	/**
	 * @throws IllegalArgumentException naming the first missing or invalid option
	 */
	public void validate() {
		requireDirectory("--features", featureDir);
		requireDirectory("--inpDir", imageDir);
		requireDirectory("--vector", vectorDir);
		requireSet("--outImages", outputImageDir);
		requireSet("--outVectors", outputVectorDir);
		if (progressInterval <= 0) {
			throw new IllegalArgumentException("Progress interval must be positive: " + progressInterval);
		}
		try {
			Pattern.compile(filePattern);
		} catch (PatternSyntaxException e) {
			throw new IllegalArgumentException("Invalid file pattern: " + filePattern, e);
		}
	}

	private static void requireSet(String option, Path value) {
		if (value == null) {
			throw new IllegalArgumentException("Missing required option " + option);
		}
	}

	private static void requireDirectory(String option, Path value) {
		requireSet(option, value);
		if (!Files.isDirectory(value)) {
			throw new IllegalArgumentException(option + " is not a directory: " + value);
		}
	}

	public Path getFeatureDir() {
		return featureDir;
	}

	public Path getImageDir() {
		return imageDir;
	}

	public Path getVectorDir() {
		return vectorDir;
	}

	public Path getOutputImageDir() {
		return outputImageDir;
	}

	public Path getOutputVectorDir() {
		return outputVectorDir;
	}

	public Pattern getFilePattern() {
		return Pattern.compile(filePattern);
	}

	public GroupingMode getGroupingMode() {
		return groupingMode;
	}

	public int getProgressInterval() {
		return progressInterval;
	}

	public String getCompression() {
		return compression;
	}

	public boolean isVerbose() {
		return verbose;
	}
}
