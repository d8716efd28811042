package de.kherud.heatmap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.heatmap.image.ImageIOMetadataReader;
import de.kherud.heatmap.util.CliRunner;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * End-to-end runs of the heatmap builder over a small stitched collection.
 */
public class HeatmapPyramidBuilderTest {

	@Rule
	public TemporaryFolder tempDir = new TemporaryFolder();

	private Path features;
	private Path images;
	private Path vectors;
	private Path outImages;
	private Path outVectors;

	@Before
	public void setUp() throws IOException {
		features = tempDir.newFolder("features").toPath();
		images = tempDir.newFolder("images").toPath();
		vectors = tempDir.newFolder("vectors").toPath();
		outImages = tempDir.getRoot().toPath().resolve("out-images");
		outVectors = tempDir.getRoot().toPath().resolve("out-vectors");

		writeImage("A.tif", 4, 3);
		writeImage("B.tif", 4, 3);
		writeImage("C.tif", 5, 3);

		Files.write(vectors.resolve("img-global-positions-1.txt"), Arrays.asList(
			"file: A.tif; corr: 0.95; position: (0, 0); grid: (0, 0);",
			"file: B.tif; corr: 0.90; position: (4, 0); grid: (1, 0);",
			"file: missing.tif; corr: 0.10; position: (8, 0); grid: (2, 0);",
			"file: C.tif; corr: 0.85; position: (0, 3); grid: (0, 1);"));

		Files.write(features.resolve("objects.csv"), Arrays.asList(
			"file,area,label",
			"A.tif,10,cell",
			"A.tif,20,cell",
			"B.tif,5,cell",
			"missing.tif,1000,cell",
			"C.tif,25,nucleus"));
	}

	@Test
	public void testCliBuildsTilesAndVectors() throws IOException {
		int code = CliRunner.runWithoutExit(HeatmapPyramidBuilder::runCli, requiredArgs());
		assertEquals(CliRunner.EXIT_OK, code);

		assertEquals("2 widths x 1 height x 3 levels", Arrays.asList(
			"4_3_1.ome.tif", "4_3_128.ome.tif", "4_3_255.ome.tif",
			"5_3_1.ome.tif", "5_3_128.ome.tif", "5_3_255.ome.tif"), list(outImages));

		assertEquals(Arrays.asList(
			"file: 4_3_128.ome.tif; corr: 0.95; position: (0, 0); grid: (0, 0);",
			"file: 4_3_1.ome.tif; corr: 0.90; position: (4, 0); grid: (1, 0);",
			"file: 5_3_255.ome.tif; corr: 0.85; position: (0, 3); grid: (0, 1);"),
			Files.readAllLines(outVectors.resolve("img-global-positions-1.txt")));
		assertFalse("A feature without numbers gets no vector",
			Files.exists(outVectors.resolve("img-global-positions-2.txt")));

		JsonNode manifest = new ObjectMapper().readTree(outVectors.resolve(HeatmapManifest.FILE_NAME).toFile());
		assertEquals(3, manifest.path("images").asInt());
		assertEquals(6, manifest.path("tiles").path("written").asInt());
		JsonNode area = manifest.path("features").get(0);
		assertEquals("area", area.path("feature").asText());
		assertEquals("img-global-positions-1.txt", area.path("vector").asText());
		assertEquals(5.0, area.path("min").asDouble(), 0.0);
		assertEquals(20.0, area.path("range").asDouble(), 0.0);
	}

	@Test
	public void testRerunSkipsExistingTiles() throws IOException {
		HeatmapConfig config = new HeatmapConfig()
			.featureDir(features)
			.imageDir(images)
			.vectorDir(vectors)
			.outputImageDir(outImages)
			.outputVectorDir(outVectors);

		new HeatmapPyramidBuilder(config).build();
		long modified = Files.getLastModifiedTime(outImages.resolve("4_3_128.ome.tif")).toMillis();
		HeatmapManifest second = new HeatmapPyramidBuilder(config).build();

		assertEquals(0, second.getTiles().written());
		assertEquals(6, second.getTiles().skipped());
		assertEquals(6, list(outImages).size());
		assertEquals(modified, Files.getLastModifiedTime(outImages.resolve("4_3_128.ome.tif")).toMillis());
	}

	@Test
	public void testTilesMatchTheirNames() throws Exception {
		HeatmapPyramidBuilder.runCli(requiredArgs());

		BufferedImage tile = ImageIO.read(outImages.resolve("5_3_128.ome.tif").toFile());
		assertEquals(5, tile.getWidth());
		assertEquals(3, tile.getHeight());
		assertEquals(128, tile.getRaster().getSample(4, 2, 0));
	}

	@Test
	public void testGroupByFileOption() throws IOException {
		Files.write(features.resolve("objects.csv"), Arrays.asList(
			"file,area",
			"A.tif,10",
			"B.tif,5",
			"A.tif,20",
			"C.tif,25"));

		HeatmapConfig config = HeatmapPyramidBuilder.parseArgs(concat(requiredArgs(), "--groupByFile"));
		HeatmapManifest manifest = new HeatmapPyramidBuilder(config, new ImageIOMetadataReader()).build();

		assertEquals(3, manifest.getScales().get("area").count());
		assertTrue(Files.readAllLines(outVectors.resolve("img-global-positions-1.txt")).get(0)
			.startsWith("file: 4_3_128.ome.tif;"));
	}

	@Test
	public void testMalformedVectorFailsTheRun() throws IOException {
		Files.write(vectors.resolve("img-global-positions-2.txt"), Arrays.asList("file: A.tif; corr: 0.5;"));

		int code = CliRunner.runWithoutExit(HeatmapPyramidBuilder::runCli, requiredArgs());

		assertEquals(CliRunner.EXIT_FAILURE, code);
		assertFalse("No tile is written when parsing fails", Files.exists(outImages));
	}

	@Test
	public void testUsageErrors() {
		assertEquals(CliRunner.EXIT_USAGE, CliRunner.runWithoutExit(HeatmapPyramidBuilder::runCli, new String[0]));
		assertEquals(CliRunner.EXIT_USAGE, CliRunner.runWithoutExit(HeatmapPyramidBuilder::runCli,
			new String[]{"--features", features.toString()}));
		assertEquals(CliRunner.EXIT_USAGE, CliRunner.runWithoutExit(HeatmapPyramidBuilder::runCli,
			concat(requiredArgs(), "--unknown")));
		assertEquals(CliRunner.EXIT_USAGE, CliRunner.runWithoutExit(HeatmapPyramidBuilder::runCli,
			new String[]{"--vector"}));
		assertEquals(CliRunner.EXIT_OK, CliRunner.runWithoutExit(HeatmapPyramidBuilder::runCli,
			new String[]{"--help"}));
	}

	private String[] requiredArgs() {
		return new String[]{
			"--features", features.toString(),
			"--inpDir", images.toString(),
			"--vector", vectors.toString(),
			"--outImages", outImages.toString(),
			"--outVectors", outVectors.toString()
		};
	}

	private static String[] concat(String[] args, String... more) {
		return Stream.concat(Arrays.stream(args), Arrays.stream(more)).toArray(String[]::new);
	}

	private void writeImage(String name, int width, int height) throws IOException {
		BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
		assertTrue(ImageIO.write(image, "tiff", images.resolve(name).toFile()));
	}

	private static List<String> list(Path dir) throws IOException {
		try (Stream<Path> files = Files.list(dir)) {
			return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
		}
	}
}
