package de.kherud.heatmap.features;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Every per-image mean collected for each feature, in the order features were
 * first seen in CSV headers. Only used to find each feature's min and range.
 */
public final class FeatureTable {

	private final Map<String, List<Double>> values = new LinkedHashMap<>();

	public void declare(String feature) {
		values.computeIfAbsent(feature, k -> new ArrayList<>());
	}

	public void add(String feature, double mean) {
		values.computeIfAbsent(feature, k -> new ArrayList<>()).add(mean);
	}

	public Set<String> features() {
		return Collections.unmodifiableSet(values.keySet());
	}

	public List<Double> values(String feature) {
		List<Double> list = values.get(feature);
		return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
	}
}
