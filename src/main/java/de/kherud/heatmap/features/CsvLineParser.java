package de.kherud.heatmap.features;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Splitting and number parsing for feature CSV lines.
 */
public final class CsvLineParser {

	private CsvLineParser() {
	}

	/**
	 * Split a line on commas. Commas inside double quotes do not split; the quotes
	 * are dropped.
	 */
	public static String[] split(String line) {
		List<String> fields = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean inQuotes = false;

		for (char c : line.toCharArray()) {
			if (c == '"') {
				inQuotes = !inQuotes;
			} else if (c == ',' && !inQuotes) {
				fields.add(current.toString().trim());
				current = new StringBuilder();
			} else {
				current.append(c);
			}
		}

		fields.add(current.toString().trim());
		return fields.toArray(new String[0]);
	}

	/**
	 * @return the finite decimal number in {@code field}, or empty for text, blanks,
	 * NaN, infinities and hexadecimal literals
	 */
	public static OptionalDouble parseNumber(String field) {
		String s = field.trim();
		if (s.isEmpty()) {
			return OptionalDouble.empty();
		}
		// Double.parseDouble would accept Java type suffixes such as "1d" or "2f"
		char last = Character.toLowerCase(s.charAt(s.length() - 1));
		if (last == 'd' || last == 'f') {
			return OptionalDouble.empty();
		}
		// nor hexadecimal floats such as "0x1p3"
		int digits = s.charAt(0) == '+' || s.charAt(0) == '-' ? 1 : 0;
		if (s.regionMatches(true, digits, "0x", 0, 2)) {
			return OptionalDouble.empty();
		}
		try {
			double value = Double.parseDouble(s);
			return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
		} catch (NumberFormatException e) {
			return OptionalDouble.empty();
		}
	}
}
