package de.kherud.heatmap.stitch;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text layout of stitching vectors:
 * {@code file: <name>; corr: <float>; position: (<int>, <int>); grid: (<int>, <int>);}
 */
public final class StitchVectorFormat {
	private static final Logger LOGGER = Logger.getLogger(StitchVectorFormat.class.getName());

	/** Vector files carry their numeric id in the name. */
	public static final Pattern VECTOR_FILE = Pattern.compile(".*-global-positions-([0-9]+)\\.txt");

	private static final Pattern LINE = Pattern.compile(
		"file: (.+); corr: (\\S+); position: \\((-?\\d+), (-?\\d+)\\); grid: \\((-?\\d+), (-?\\d+)\\);\\s*");

	private static final String LINE_FORMAT = "file: %s; corr: %s; position: (%d, %d); grid: (%d, %d);";

	private StitchVectorFormat() {
	}

	/**
	 * @return the entry, or null if the line does not have all six fields
	 */
	@Nullable
	public static StitchEntry parseLine(String line) {
		Matcher m = LINE.matcher(line);
		if (!m.matches()) {
			return null;
		}
		try {
			Double.parseDouble(m.group(2));
			return new StitchEntry(m.group(1), m.group(2),
				Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)),
				Integer.parseInt(m.group(5)), Integer.parseInt(m.group(6)));
		} catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * @return the line without its terminating newline
	 */
	public static String formatLine(StitchEntry entry) {
		return String.format(Locale.ROOT, LINE_FORMAT, entry.fileName(), entry.correlation(),
			entry.posX(), entry.posY(), entry.gridX(), entry.gridY());
	}

	/**
	 * @return the vector id embedded in a file name, or -1 if the name is not a vector file
	 * or its id does not fit an int
	 */
	public static int vectorId(String fileName) {
		Matcher m = VECTOR_FILE.matcher(fileName);
		if (!m.matches()) {
			return -1;
		}
		try {
			return Integer.parseInt(m.group(1));
		} catch (NumberFormatException e) {
			LOGGER.warning("Ignoring stitching vector with out-of-range id: " + fileName);
			return -1;
		}
	}

	public static String vectorFileName(int vectorId) {
		return "img-global-positions-" + vectorId + ".txt";
	}
}
