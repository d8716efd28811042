package de.kherud.heatmap;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * The image collection a heatmap is built for, keyed by file name.
 *
 * <p>Stitching vectors and feature tables can only attach data to images that
 * are already in the index; rows naming any other file are dropped by the stages.
 */
public final class ImageIndex {
	private static final Logger LOGGER = Logger.getLogger(ImageIndex.class.getName());

	private final Map<String, ImageRecord> records = new TreeMap<>();

	/**
	 * Index every regular file in {@code directory} whose name fully matches {@code filePattern}.
	 */
	public static ImageIndex scan(Path directory, Pattern filePattern) throws IOException {
		ImageIndex index = new ImageIndex();
		try (Stream<Path> files = Files.list(directory)) {
			files.filter(Files::isRegularFile)
				.filter(p -> filePattern.matcher(p.getFileName().toString()).matches())
				.forEach(index::add);
		}
		LOGGER.info(String.format("Indexed %d images in %s", index.size(), directory));
		return index;
	}

	public ImageRecord add(Path imagePath) {
		ImageRecord record = new ImageRecord(imagePath);
		records.put(record.getFileName(), record);
		return record;
	}

	/**
	 * @return the record for an exact file name, or null when the image is not in the collection
	 */
	@Nullable
	public ImageRecord get(String fileName) {
		return records.get(fileName);
	}

	/**
	 * @return all records in file name order
	 */
	public Collection<ImageRecord> records() {
		return Collections.unmodifiableCollection(records.values());
	}

	/**
	 * @return records matched by a stitching vector, ordered by vector id and then line index
	 */
	public List<ImageRecord> stitchedInVectorOrder() {
		List<ImageRecord> stitched = new ArrayList<>();
		for (ImageRecord record : records.values()) {
			if (record.isStitched()) {
				stitched.add(record);
			}
		}
		stitched.sort((a, b) -> a.getVectorId() != b.getVectorId()
			? Integer.compare(a.getVectorId(), b.getVectorId())
			: Integer.compare(a.getLineIndex(), b.getLineIndex()));
		return stitched;
	}

	public int size() {
		return records.size();
	}
}
