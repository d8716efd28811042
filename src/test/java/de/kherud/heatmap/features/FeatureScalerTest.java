package de.kherud.heatmap.features;

import de.kherud.heatmap.ImageIndex;
import de.kherud.heatmap.ImageRecord;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;

/**
 * JUnit4 tests for assigning levels to image records.
 */
public class FeatureScalerTest {

	private ImageIndex index;
	private FeatureTable table;

	@Before
	public void setUp() {
		index = new ImageIndex();
		table = new FeatureTable();
	}

	@Test
	public void testScalesEveryRecord() {
		put("A.tif", "area", 15.0);
		put("B.tif", "area", 5.0);
		put("C.tif", "area", 25.0);

		FeatureScaler.ScalingResult result = new FeatureScaler().scale(table, index);

		Assert.assertEquals(128, index.get("A.tif").getFeatureLevel("area").getAsInt());
		Assert.assertEquals(1, index.get("B.tif").getFeatureLevel("area").getAsInt());
		Assert.assertEquals(255, index.get("C.tif").getFeatureLevel("area").getAsInt());
		Assert.assertEquals(Arrays.asList(1, 128, 255), Arrays.asList(result.getLevels().toArray()));
		Assert.assertEquals(20.0, result.getScales().get("area").range(), 0.0);
		Assert.assertEquals("Raw means stay available", 15.0, index.get("A.tif").getFeatureValue("area"), 0.0);
	}

	@Test
	public void testIdenticalValuesGetLevelZero() {
		put("A.tif", "area", 7.0);
		put("B.tif", "area", 7.0);
		put("A.tif", "intensity", 1.0);
		put("B.tif", "intensity", 3.0);

		FeatureScaler.ScalingResult result = new FeatureScaler().scale(table, index);

		Assert.assertEquals(0, index.get("A.tif").getFeatureLevel("area").getAsInt());
		Assert.assertEquals(0, index.get("B.tif").getFeatureLevel("area").getAsInt());
		Assert.assertEquals(1, index.get("A.tif").getFeatureLevel("intensity").getAsInt());
		Assert.assertEquals(255, index.get("B.tif").getFeatureLevel("intensity").getAsInt());
		Assert.assertEquals(Arrays.asList(0, 1, 255), Arrays.asList(result.getLevels().toArray()));
	}

	@Test
	public void testFeatureWithoutValuesHasNoScale() {
		put("A.tif", "area", 1.0);
		table.declare("label");

		FeatureScaler.ScalingResult result = new FeatureScaler().scale(table, index);

		Assert.assertEquals(Arrays.asList("area"), Arrays.asList(result.getScales().keySet().toArray()));
	}

	@Test
	public void testRecordsWithoutFeatureGetNoLevel() {
		put("A.tif", "area", 1.0);
		put("B.tif", "area", 2.0);
		index.add(Paths.get("C.tif"));

		new FeatureScaler().scale(table, index);

		Assert.assertFalse(index.get("C.tif").getFeatureLevel("area").isPresent());
	}

	@Test(expected = IllegalStateException.class)
	public void testScalingTwiceFails() {
		put("A.tif", "area", 1.0);
		put("B.tif", "area", 2.0);

		FeatureScaler scaler = new FeatureScaler();
		scaler.scale(table, index);
		scaler.scale(table, index);
	}

	private void put(String file, String feature, double mean) {
		ImageRecord record = index.get(file);
		if (record == null) {
			record = index.add(Paths.get(file));
		}
		record.putFeatureValue(feature, mean);
		table.add(feature, mean);
	}
}
