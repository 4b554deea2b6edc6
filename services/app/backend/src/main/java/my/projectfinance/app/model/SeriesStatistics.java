package my.projectfinance.app.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Min / max / mean / median over the finite values of a ratio series; all null when no value qualifies.
 */
public record SeriesStatistics(Double min, Double max, Double mean, Double median, int count) {
	public static SeriesStatistics of(List<Double> values) {
		List<Double> finite = new ArrayList<>();
		if (values != null) {
			for (Double value : values) {
				if (value != null && !value.isNaN() && !value.isInfinite()) {
					finite.add(value);
				}
			}
		}
		if (finite.isEmpty()) {
			return new SeriesStatistics(null, null, null, null, 0);
		}
		Collections.sort(finite);
		int n = finite.size();
		double sum = 0.0;
		for (double value : finite) {
			sum += value;
		}
		double median = n % 2 == 1
				? finite.get(n / 2)
				: 0.5 * (finite.get(n / 2 - 1) + finite.get(n / 2));
		return new SeriesStatistics(finite.get(0), finite.get(n - 1), sum / n, median, n);
	}
}
