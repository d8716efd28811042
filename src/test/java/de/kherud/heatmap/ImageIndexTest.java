package de.kherud.heatmap;

import de.kherud.heatmap.stitch.StitchEntry;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.regex.Pattern;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

public class ImageIndexTest {

	@Rule
	public TemporaryFolder tempDir = new TemporaryFolder();

	@Test
	public void testScanMatchesFullFileNames() throws IOException {
		tempDir.newFile("a.tif");
		tempDir.newFile("b.ome.tif");
		tempDir.newFile("c.tiff");
		tempDir.newFile("notes.txt");
		tempDir.newFolder("sub.tif");

		ImageIndex index = ImageIndex.scan(tempDir.getRoot().toPath(), Pattern.compile(HeatmapConfig.DEFAULT_FILE_PATTERN));

		assertEquals(2, index.size());
		assertNotNull(index.get("a.tif"));
		assertNotNull(index.get("b.ome.tif"));
		assertNull(index.get("c.tiff"));
		assertNull(index.get("sub.tif"));
	}

	@Test
	public void testStitchedInVectorOrder() {
		ImageIndex index = new ImageIndex();
		StitchEntry entry = new StitchEntry("x", "0.5", 0, 0, 0, 0);
		index.add(Paths.get("a.tif")).setStitchPosition(entry, 2, 0);
		index.add(Paths.get("b.tif")).setStitchPosition(entry, 1, 1);
		index.add(Paths.get("c.tif")).setStitchPosition(entry, 1, 0);
		index.add(Paths.get("d.tif"));

		Object[] order = index.stitchedInVectorOrder().stream().map(ImageRecord::getFileName).toArray();

		assertEquals(Arrays.asList("c.tif", "b.tif", "a.tif"), Arrays.asList(order));
	}

	@Test
	public void testRecordsAreKeyedByFileName() {
		ImageIndex index = new ImageIndex();
		Path path = Paths.get("collection", "r01.tif");
		ImageRecord record = index.add(path);

		assertEquals("r01.tif", record.getFileName());
		assertEquals(path, index.get("r01.tif").getPath());
		assertNull(index.get("collection/r01.tif"));
	}
}
