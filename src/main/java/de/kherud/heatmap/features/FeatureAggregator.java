package de.kherud.heatmap.features;

import de.kherud.heatmap.ImageIndex;
import de.kherud.heatmap.ImageRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reduces feature CSV files to one mean per image and feature.
 *
 * <p>Each CSV starts with a header row. The {@value #FILE_COLUMN} column names the
 * image a row belongs to; every other column is a feature. Cells that are not
 * numbers are left out of their column's mean. Groups naming an image outside the
 * index are dropped. Each mean is written to the image record and appended to the
 * returned {@link FeatureTable}.
 */
public class FeatureAggregator {
	private static final Logger LOGGER = Logger.getLogger(FeatureAggregator.class.getName());

	public static final String FILE_COLUMN = "file";

	private final GroupingMode groupingMode;
	private final int progressInterval;

	private int groups;
	private int droppedGroups;

	public FeatureAggregator(GroupingMode groupingMode, int progressInterval) {
		if (progressInterval <= 0) {
			throw new IllegalArgumentException("Progress interval must be positive");
		}
		this.groupingMode = groupingMode;
		this.progressInterval = progressInterval;
	}

	/**
	 * Aggregate every {@code .csv} file in {@code featureDir}, in file name order.
	 */
	public FeatureTable aggregate(Path featureDir, ImageIndex index) throws IOException {
		List<Path> csvFiles;
		try (Stream<Path> files = Files.list(featureDir)) {
			csvFiles = files.filter(Files::isRegularFile)
				.filter(p -> p.getFileName().toString().endsWith(".csv"))
				.sorted()
				.collect(Collectors.toList());
		}
		LOGGER.info(String.format("Found %d feature files in %s", csvFiles.size(), featureDir));

		FeatureTable table = new FeatureTable();
		groups = 0;
		droppedGroups = 0;
		for (Path csv : csvFiles) {
			aggregateFile(csv, index, table);
		}

		LOGGER.info(String.format("Aggregated %d image groups over %d features, dropped %d groups for unknown images",
			groups, table.features().size(), droppedGroups));
		return table;
	}

	void aggregateFile(Path csv, ImageIndex index, FeatureTable table) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
			String headerLine = reader.readLine();
			if (headerLine == null) {
				LOGGER.warning("Skipping empty feature file: " + csv);
				return;
			}

			String[] headers = CsvLineParser.split(headerLine);
			int fileCol = Arrays.asList(headers).indexOf(FILE_COLUMN);
			if (fileCol < 0) {
				LOGGER.warning(String.format("Skipping %s: no '%s' column", csv, FILE_COLUMN));
				return;
			}
			for (int i = 0; i < headers.length; i++) {
				if (i != fileCol) {
					table.declare(headers[i]);
				}
			}

			// insertion order keeps BY_FILE groups in order of first appearance
			Map<String, GroupAccumulator> open = new LinkedHashMap<>();
			String currentFile = null;
			String line;
			int lineNum = 1;
			while ((line = reader.readLine()) != null) {
				lineNum++;
				if (line.isBlank()) {
					continue;
				}
				String[] fields = CsvLineParser.split(line);
				if (fields.length <= fileCol) {
					LOGGER.fine(String.format("%s line %d: no file value", csv.getFileName(), lineNum));
					continue;
				}

				String file = fields[fileCol];
				if (groupingMode == GroupingMode.CONTIGUOUS && !file.equals(currentFile)) {
					flushAll(open, index, table);
				}
				currentFile = file;
				open.computeIfAbsent(file, GroupAccumulator::new).addRow(headers, fields, fileCol);
			}
			flushAll(open, index, table);
		}
	}

	private void flushAll(Map<String, GroupAccumulator> open, ImageIndex index, FeatureTable table) {
		for (GroupAccumulator group : open.values()) {
			flush(group, index, table);
		}
		open.clear();
	}

	private void flush(GroupAccumulator group, ImageIndex index, FeatureTable table) {
		ImageRecord record = index.get(group.file);
		if (record == null) {
			droppedGroups++;
			LOGGER.fine(() -> "Dropping features of image outside the collection: " + group.file);
			return;
		}

		for (Map.Entry<String, RunningMean> column : group.columns.entrySet()) {
			RunningMean mean = column.getValue();
			if (mean.count == 0) {
				continue;
			}
			double value = mean.mean();
			record.putFeatureValue(column.getKey(), value);
			table.add(column.getKey(), value);
		}

		groups++;
		if (groups % progressInterval == 0) {
			LOGGER.info("Files parsed: " + groups);
		}
	}

	/**
	 * Rows of one group, reduced column by column.
	 */
	private static final class GroupAccumulator {
		private final String file;
		private final Map<String, RunningMean> columns = new LinkedHashMap<>();

		GroupAccumulator(String file) {
			this.file = file;
		}

		void addRow(String[] headers, String[] fields, int fileCol) {
			int n = Math.min(headers.length, fields.length);
			for (int i = 0; i < n; i++) {
				if (i == fileCol) {
					continue;
				}
				RunningMean mean = columns.computeIfAbsent(headers[i], k -> new RunningMean());
				OptionalDouble value = CsvLineParser.parseNumber(fields[i]);
				if (value.isPresent()) {
					mean.add(value.getAsDouble());
				}
			}
		}
	}

	private static final class RunningMean {
		private double sum;
		private int count;

		void add(double value) {
			sum += value;
			count++;
		}

		double mean() {
			return sum / count;
		}
	}
}
