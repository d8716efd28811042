package de.kherud.heatmap;

import de.kherud.heatmap.features.FeatureAggregator;
import de.kherud.heatmap.features.FeatureScaler;
import de.kherud.heatmap.features.FeatureTable;
import de.kherud.heatmap.features.GroupingMode;
import de.kherud.heatmap.image.HeatmapImageGenerator;
import de.kherud.heatmap.image.ImageIOMetadataReader;
import de.kherud.heatmap.image.ImageMetadataReader;
import de.kherud.heatmap.image.TileGeometry;
import de.kherud.heatmap.image.TileImageRuntime;
import de.kherud.heatmap.stitch.OutputVectorWriter;
import de.kherud.heatmap.stitch.StitchVectorIndex;
import de.kherud.heatmap.util.CliRunner;
import de.kherud.heatmap.util.LoggingSetup;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds heatmap overlay tiles and stitching vectors for a stitched image collection.
 *
 * <p>Stages run in order, each feeding the next: stitching vectors, feature tables,
 * scaling, tile images, output vectors. All stages share one {@link ImageIndex}.
 */
public class HeatmapPyramidBuilder {
	private static final Logger LOGGER = Logger.getLogger(HeatmapPyramidBuilder.class.getName());

	private final HeatmapConfig config;
	private final ImageMetadataReader metadataReader;

	public HeatmapPyramidBuilder(HeatmapConfig config) {
		this(config, new ImageIOMetadataReader());
	}

	HeatmapPyramidBuilder(HeatmapConfig config, ImageMetadataReader metadataReader) {
		this.config = config;
		this.metadataReader = metadataReader;
	}

	/**
	 * Run every stage.
	 *
	 * @return summary of the build, also written to the output vector directory
	 * @throws IllegalArgumentException if the configuration is invalid
	 * @throws IllegalStateException if the image runtime cannot be started
	 */
	public HeatmapManifest build() throws IOException {
		config.validate();

		ImageIndex index = ImageIndex.scan(config.getImageDir(), config.getFilePattern());

		LOGGER.info("Parsing stitching vectors...");
		TileGeometry geometry = new StitchVectorIndex(metadataReader, config.getProgressInterval())
			.parse(config.getVectorDir(), index);

		LOGGER.info("Parsing features...");
		FeatureTable table = new FeatureAggregator(config.getGroupingMode(), config.getProgressInterval())
			.aggregate(config.getFeatureDir(), index);

		LOGGER.info("Setting feature scales...");
		FeatureScaler.ScalingResult scaling = new FeatureScaler().scale(table, index);

		HeatmapImageGenerator.GenerationResult tiles;
		try (TileImageRuntime runtime = TileImageRuntime.start(config.getCompression())) {
			LOGGER.info("Generating heatmap images...");
			tiles = new HeatmapImageGenerator(runtime.tileWriter())
				.generate(config.getOutputImageDir(), geometry, scaling.getLevels());
		}

		LOGGER.info("Generating the heatmap vectors...");
		List<OutputVectorWriter.VectorOutput> vectors = new OutputVectorWriter()
			.write(config.getOutputVectorDir(), index, scaling.getScales().keySet());

		HeatmapManifest manifest = new HeatmapManifest(index.size(), geometry, scaling.getLevels(),
			scaling.getScales(), vectors, tiles);
		Path manifestFile = manifest.write(config.getOutputVectorDir());
		LOGGER.info("Wrote " + manifestFile);
		return manifest;
	}

	public static void main(String[] args) {
		CliRunner.runWithExit(HeatmapPyramidBuilder::runCli, args);
	}

	/**
	 * CLI runner that can be tested without System.exit
	 */
	public static void runCli(String[] args) throws Exception {
		HeatmapConfig config = parseArgs(args);
		if (config == null) {
			return;
		}
		LoggingSetup.configure(config.isVerbose());
		logArguments(config);
		new HeatmapPyramidBuilder(config).build();
	}

	/**
	 * @return the parsed options, or null if help was requested
	 */
	static HeatmapConfig parseArgs(String[] args) {
		if (args.length == 0) {
			printUsage();
			throw new IllegalArgumentException("No arguments specified");
		}

		HeatmapConfig config = new HeatmapConfig();
		for (int i = 0; i < args.length; i++) {
			switch (args[i]) {
				case "--features":
					config.featureDir(Paths.get(value(args, ++i, "--features")));
					break;
				case "--inpDir":
					config.imageDir(Paths.get(value(args, ++i, "--inpDir")));
					break;
				case "--vector":
					config.vectorDir(Paths.get(value(args, ++i, "--vector")));
					break;
				case "--outImages":
					config.outputImageDir(Paths.get(value(args, ++i, "--outImages")));
					break;
				case "--outVectors":
					config.outputVectorDir(Paths.get(value(args, ++i, "--outVectors")));
					break;
				case "--filePattern":
					config.filePattern(value(args, ++i, "--filePattern"));
					break;
				case "--groupByFile":
					config.groupingMode(GroupingMode.BY_FILE);
					break;
				case "--compression":
					String compression = value(args, ++i, "--compression");
					config.compression("none".equalsIgnoreCase(compression) ? null : compression);
					break;
				case "--progress":
					String interval = value(args, ++i, "--progress");
					try {
						config.progressInterval(Integer.parseInt(interval));
					} catch (NumberFormatException e) {
						throw new IllegalArgumentException("--progress expects a number: " + interval);
					}
					break;
				case "--verbose":
				case "-v":
					config.verbose(true);
					break;
				case "--help":
				case "-h":
					printUsage();
					return null;
				default:
					throw new IllegalArgumentException("Unknown option: " + args[i]);
			}
		}
		return config;
	}

	private static String value(String[] args, int i, String option) {
		if (i >= args.length) {
			throw new IllegalArgumentException("Missing value for " + option);
		}
		return args[i];
	}

	private static void logArguments(HeatmapConfig config) {
		LOGGER.info("features = " + config.getFeatureDir());
		LOGGER.info("inpDir = " + config.getImageDir());
		LOGGER.info("vector = " + config.getVectorDir());
		LOGGER.info("outImages = " + config.getOutputImageDir());
		LOGGER.info("outVectors = " + config.getOutputVectorDir());
	}

	private static void printUsage() {
		System.out.println("Usage: HeatmapPyramidBuilder --features <dir> --inpDir <dir> --vector <dir>");
		System.out.println("                             --outImages <dir> --outVectors <dir> [options]");
		System.out.println();
		System.out.println("Build a heatmap overlay for feature values in CSV files, registered to an existing pyramid.");
		System.out.println();
		System.out.println("Required:");
		System.out.println("  --features <dir>     CSV collection containing features");
		System.out.println("  --inpDir <dir>       Input image collection the pyramid was built from");
		System.out.println("  --vector <dir>       Stitching vectors used to build the pyramid");
		System.out.println("  --outImages <dir>    Heatmap output images");
		System.out.println("  --outVectors <dir>   Heatmap output vectors");
		System.out.println();
		System.out.println("Options:");
		System.out.println("  --filePattern <re>   Input image name pattern (default: " + HeatmapConfig.DEFAULT_FILE_PATTERN + ")");
		System.out.println("  --groupByFile        Average all rows of an image in a CSV, not only consecutive rows");
		System.out.println("  --compression <c>    TIFF compression, or 'none' (default: " + HeatmapConfig.DEFAULT_COMPRESSION + ")");
		System.out.println("  --progress <n>       Log progress every n items (default: " + HeatmapConfig.DEFAULT_PROGRESS_INTERVAL + ")");
		System.out.println("  --verbose, -v        Verbose logging");
		System.out.println("  --help, -h           Show this help");
	}
}
